package ai.review.mcts;

import ai.review.tree.IterationContext;
import ai.review.tree.Node;
import ai.review.tree.ReviewTree;
import ai.review.tree.TreeCorruptionException;

/**
 * Upper Confidence bound for Trees.
 *
 * <p>{@code UCT = mean + c * sqrt(ln(parentVisits) / visits)}. A child that has never been
 * visited scores {@code +Infinity}, so every child is tried once before any is revisited. Equal
 * scores resolve to the lowest id, which is the child created first.
 */
public final class UctPolicy {

    private UctPolicy() {}

    /**
     * Walks from the root, always taking the best child, until reaching a node that is
     * terminal, has no children, or sits at {@code maxDepth}.
     *
     * @return id of the node to expand
     */
    public static String select(ReviewTree tree, IterationContext context) {
        Node current = tree.root();
        int depth = 0;
        while (!current.isTerminal() && !current.getChildren().isEmpty() && depth < context.maxDepth()) {
            if (depth > tree.size()) {
                throw new TreeCorruptionException(
                        "Selection descended past " + tree.size() + " levels; cycle suspected");
            }
            current = bestChild(tree, current, context.explorationConstant());
            depth++;
        }
        return current.getId();
    }

    /**
     * @return the child of {@code parent} with the highest UCT value, lowest id on ties
     */
    public static Node bestChild(ReviewTree tree, Node parent, double explorationConstant) {
        Node best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (String childId : parent.getChildren()) {
            Node child = tree.node(childId);
            double score = uct(child, parent.getVisits(), explorationConstant);
            if (best == null
                    || score > bestScore
                    || (score == bestScore && child.getId().compareTo(best.getId()) < 0)) {
                best = child;
                bestScore = score;
            }
        }
        if (best == null) {
            throw new IllegalArgumentException("Node " + parent.getId() + " has no children");
        }
        return best;
    }

    /**
     * @param child the candidate
     * @param parentVisits visit count of the candidate's parent
     * @param explorationConstant {@code c}
     * @return the UCT value, or POSITIVE_INFINITY if the child is unvisited
     */
    public static double uct(Node child, int parentVisits, double explorationConstant) {
        if (child.getVisits() == 0) {
            return Double.POSITIVE_INFINITY;
        }
        double mean = child.getMeanValue();
        double bonus = explorationConstant * Math.sqrt(Math.log(Math.max(parentVisits, 1)) / child.getVisits());
        return mean + bonus;
    }
}
