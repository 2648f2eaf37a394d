package ai.review.agent;

import java.util.List;

/**
 * Proposes alternative next reasoning steps below a node. Used by Expansion.
 */
public interface BranchGenerator {

    /**
     * @param nodeState reasoning content of the node being expanded
     * @param context requirements and depth information
     * @return zero or more branches; zero means the node cannot be refined further
     */
    List<Branch> expand(String nodeState, ExpansionContext context);
}
