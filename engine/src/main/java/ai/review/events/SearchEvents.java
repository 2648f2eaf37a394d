package ai.review.events;

import ai.review.tree.IterationContext;
import ai.review.tree.ReviewTree;
import java.util.List;

/**
 * Payloads exchanged by the search phases. Each carries its own tree snapshot; a phase never
 * mutates the snapshot it received, it copies it first.
 */
public final class SearchEvents {

    private SearchEvents() {}

    /** {@code mcts.iteration.started}: run one more select/expand/simulate cycle. */
    public record IterationStarted(
            ReviewMetadata meta,
            ReviewTree tree,
            IterationContext context,
            String currentNodeId) implements SearchPayload {
    }

    /** {@code mcts.node.selected}: the node Selection chose for expansion. */
    public record NodeSelected(
            ReviewMetadata meta,
            ReviewTree tree,
            IterationContext context,
            String selectedNodeId) implements SearchPayload {
    }

    /** {@code mcts.node.expanded}: the selected node and the ids created under it. */
    public record NodeExpanded(
            ReviewMetadata meta,
            ReviewTree tree,
            IterationContext context,
            String selectedNodeId,
            List<String> newChildIds) implements SearchPayload {

        public NodeExpanded {
            newChildIds = List.copyOf(newChildIds);
        }
    }

    /**
     * Result of scoring one node.
     *
     * @param nodeId the simulated node
     * @param value reward in [0, 1], higher is better
     * @param explanation how the value was obtained
     */
    public record SimulationResult(String nodeId, double value, String explanation) {
    }

    /** {@code mcts.simulation.completed}. */
    public record SimulationCompleted(
            ReviewMetadata meta,
            ReviewTree tree,
            IterationContext context,
            SimulationResult result) implements SearchPayload {
    }

    /**
     * {@code mcts.backpropagation.completed}. The context already holds the incremented
     * iteration counter.
     */
    public record BackpropagationCompleted(
            ReviewMetadata meta,
            ReviewTree tree,
            IterationContext context,
            List<String> path,
            boolean complete) implements SearchPayload {

        public BackpropagationCompleted {
            path = List.copyOf(path);
        }
    }

    /** {@code mcts.iterations.completed}: the search is over, pick the best path. */
    public record IterationsCompleted(
            ReviewMetadata meta,
            ReviewTree tree,
            IterationContext context) implements SearchPayload {
    }
}
