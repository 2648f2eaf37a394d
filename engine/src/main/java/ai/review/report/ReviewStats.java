package ai.review.report;

/**
 * Statistics of the selected node.
 *
 * @param visits visits of the selected node
 * @param value accumulated reward of the selected node
 * @param totalVisits visits of the root: every simulation of the analysis, plus the initial
 *     evaluation
 * @param childrenCount children of the selected node
 */
public record ReviewStats(int visits, double value, int totalVisits, int childrenCount) {
}
