package ai.review.agent;

/**
 * What a branch generator knows besides the state being expanded.
 *
 * @param requirements the review requirements
 * @param depth depth of the node being expanded (root = 0)
 * @param maxDepth deepest level a node may be expanded at
 */
public record ExpansionContext(String requirements, int depth, int maxDepth) {

    /**
     * @return true if children created at {@code depth + 1} can no longer be expanded
     */
    public boolean childrenAtDepthLimit() {
        return depth + 1 >= maxDepth;
    }
}
