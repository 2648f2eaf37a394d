package ai.review.mcts;

import ai.review.events.ReviewEventBus;
import ai.review.events.SearchEvents.IterationStarted;
import ai.review.events.SearchEvents.NodeSelected;
import ai.review.events.TopicSubscriber;
import ai.review.events.Topics;
import ai.review.tree.ReviewTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Selection: descends from the root by UCT and names the node to expand next.
 */
@Component
public class SelectionStep extends PhaseSupport implements TopicSubscriber<IterationStarted> {

    private static final Logger log = LoggerFactory.getLogger(SelectionStep.class);

    public SelectionStep(ReviewEventBus bus) {
        super(bus, "selection");
    }

    @Override
    public String topic() {
        return Topics.ITERATION_STARTED;
    }

    @Override
    public Class<IterationStarted> payloadType() {
        return IterationStarted.class;
    }

    @Override
    public void onEvent(IterationStarted event) {
        complete(event.meta(), Topics.NODE_SELECTED, select(event));
    }

    PhaseResult<NodeSelected> select(IterationStarted event) {
        return attempt(() -> {
            ReviewTree tree = event.tree().copy();
            String selected = UctPolicy.select(tree, event.context());
            if (log.isDebugEnabled()) {
                log.debug("[{}] Iteration {}: selected {} at depth {}",
                        event.reviewId(), event.context().currentIteration(), selected, tree.depthOf(selected));
            }
            return new NodeSelected(event.meta(), tree, event.context(), selected);
        });
    }
}
