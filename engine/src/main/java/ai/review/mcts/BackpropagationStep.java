package ai.review.mcts;

import ai.review.ReviewException;
import ai.review.events.ReviewEventBus;
import ai.review.events.SearchEvents.BackpropagationCompleted;
import ai.review.events.SearchEvents.SimulationCompleted;
import ai.review.events.SearchEvents.SimulationResult;
import ai.review.events.TopicSubscriber;
import ai.review.events.Topics;
import ai.review.tree.IterationContext;
import ai.review.tree.MissingNodeException;
import ai.review.tree.Node;
import ai.review.tree.ReviewTree;
import ai.review.tree.TreeCorruptionException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Backpropagation: adds the simulation reward to every node from the simulated one up to the
 * root and advances the iteration counter.
 *
 * <p>The update runs on a copy, so a failure part way up the chain leaves the incoming tree
 * exactly as it was. A missing node or parent aborts the update and fails the review.
 */
@Component
public class BackpropagationStep extends PhaseSupport implements TopicSubscriber<SimulationCompleted> {

    private static final Logger log = LoggerFactory.getLogger(BackpropagationStep.class);

    public BackpropagationStep(ReviewEventBus bus) {
        super(bus, "backpropagation");
    }

    @Override
    public String topic() {
        return Topics.SIMULATION_COMPLETED;
    }

    @Override
    public Class<SimulationCompleted> payloadType() {
        return SimulationCompleted.class;
    }

    @Override
    public void onEvent(SimulationCompleted event) {
        PhaseResult<Backpropagated> result = backpropagate(event.tree(), event.result());
        if (!result.isSuccess()) {
            log.warn("[{}] Backpropagation aborted, tree left unchanged: {}",
                    event.reviewId(), result.error().getMessage());
            fail(event.meta(), result.error());
            return;
        }

        IterationContext previous = event.context();
        int iteration = previous.currentIteration() + 1;
        boolean complete = iteration >= previous.maxIterations();
        Backpropagated update = result.value();
        if (log.isDebugEnabled()) {
            log.debug("[{}] Iteration {}/{}: reward {} applied along {}",
                    event.reviewId(), iteration, previous.maxIterations(),
                    String.format("%.4f", event.result().value()), update.path());
        }
        bus.publish(Topics.BACKPROPAGATION_COMPLETED, new BackpropagationCompleted(
                event.meta(),
                update.tree(),
                previous.withIteration(iteration),
                update.path(),
                complete));
    }

    /**
     * Applies one simulation result to a copy of {@code tree}. Calling it twice with the same
     * result applies the reward twice.
     *
     * @param tree tree to update, never modified
     * @param result the simulated node and its reward
     * @return the updated copy and the ids visited from the simulated node to the root, or a
     *     failure naming the missing node or the corruption found
     */
    public static PhaseResult<Backpropagated> backpropagate(ReviewTree tree, SimulationResult result) {
        if (!tree.contains(result.nodeId())) {
            return PhaseResult.failure(new MissingNodeException(result.nodeId()));
        }
        ReviewTree updated = tree.copy();
        List<String> path = new ArrayList<>();
        try {
            String currentId = result.nodeId();
            while (currentId != null) {
                if (path.size() >= updated.size()) {
                    throw new TreeCorruptionException(
                            "Backpropagation from " + result.nodeId() + " exceeded " + updated.size() + " nodes; cycle suspected");
                }
                Node current = updated.node(currentId);
                current.recordVisit(result.value());
                path.add(currentId);
                currentId = current.getParentId();
            }
        } catch (ReviewException e) {
            return PhaseResult.failure(e);
        }
        return PhaseResult.success(new Backpropagated(updated, path));
    }

    /**
     * @param tree the updated tree
     * @param path ids that received the reward, simulated node first, root last
     */
    public record Backpropagated(ReviewTree tree, List<String> path) {

        public Backpropagated {
            path = List.copyOf(path);
        }
    }
}
