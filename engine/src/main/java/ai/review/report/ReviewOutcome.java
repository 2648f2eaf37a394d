package ai.review.report;

import ai.review.tree.Node;
import java.util.List;
import java.util.Map;

/**
 * Result of a finished search: the most robust reasoning path and the full tree behind it.
 *
 * @param reviewId the review
 * @param selectedNodeId last node of the best path
 * @param state reasoning content of the selected node
 * @param reasoning plain text account of the best path, one line per node
 * @param stats statistics of the selected node
 * @param allNodes every node of the final tree, by id
 * @param path node ids from the root to the selected node
 * @param repository repository identifier of the review
 * @param branch reviewed branch
 * @param requirements review requirements
 * @param commitsAnalyzed number of commits evaluated
 * @param iterations completed search iterations
 */
public record ReviewOutcome(
        String reviewId,
        String selectedNodeId,
        String state,
        String reasoning,
        ReviewStats stats,
        Map<String, Node> allNodes,
        List<String> path,
        String repository,
        String branch,
        String requirements,
        int commitsAnalyzed,
        int iterations) {

    public ReviewOutcome {
        path = List.copyOf(path);
    }
}
