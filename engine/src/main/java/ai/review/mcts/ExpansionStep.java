package ai.review.mcts;

import ai.review.agent.Branch;
import ai.review.agent.BranchGenerator;
import ai.review.agent.CollaboratorException;
import ai.review.agent.ExpansionContext;
import ai.review.agent.ExternalCalls;
import ai.review.events.ReviewEventBus;
import ai.review.events.SearchEvents.NodeExpanded;
import ai.review.events.SearchEvents.NodeSelected;
import ai.review.events.TopicSubscriber;
import ai.review.events.Topics;
import ai.review.tree.IterationContext;
import ai.review.tree.Node;
import ai.review.tree.ReviewTree;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Expansion: asks the branch generator for follow-up reasoning steps and adds one unvisited
 * child per step under the selected node.
 *
 * <p>Terminal nodes and nodes at {@code maxDepth} are passed through unexpanded. A generator
 * that proposes nothing marks the node terminal so Selection stops descending into it.
 */
@Component
public class ExpansionStep extends PhaseSupport implements TopicSubscriber<NodeSelected> {

    private static final Logger log = LoggerFactory.getLogger(ExpansionStep.class);

    private final BranchGenerator branchGenerator;
    private final ExternalCalls calls;

    public ExpansionStep(ReviewEventBus bus, BranchGenerator branchGenerator, ExternalCalls calls) {
        super(bus, "expansion");
        this.branchGenerator = branchGenerator;
        this.calls = calls;
    }

    @Override
    public String topic() {
        return Topics.NODE_SELECTED;
    }

    @Override
    public Class<NodeSelected> payloadType() {
        return NodeSelected.class;
    }

    @Override
    public void onEvent(NodeSelected event) {
        complete(event.meta(), Topics.NODE_EXPANDED, expand(event));
    }

    PhaseResult<NodeExpanded> expand(NodeSelected event) {
        return attempt(() -> {
            ReviewTree tree = event.tree().copy();
            IterationContext context = event.context();
            Node selected = tree.node(event.selectedNodeId());
            int depth = tree.depthOf(selected.getId());

            if (selected.isTerminal() || depth >= context.maxDepth()) {
                if (log.isDebugEnabled()) {
                    log.debug("[{}] {} not expandable (terminal={}, depth={})",
                            event.reviewId(), selected.getId(), selected.isTerminal(), depth);
                }
                return new NodeExpanded(event.meta(), tree, context, selected.getId(), List.of());
            }

            ExpansionContext expansionContext =
                    new ExpansionContext(event.meta().requirements(), depth, context.maxDepth());
            List<Branch> branches = calls.call("branch generator",
                    () -> branchGenerator.expand(selected.getState(), expansionContext));
            if (branches == null) {
                throw new CollaboratorException("branch generator returned no result for " + selected.getId());
            }

            List<String> created = new ArrayList<>();
            if (branches.isEmpty()) {
                selected.markTerminal();
                log.debug("[{}] No branches for {}; marked terminal", event.reviewId(), selected.getId());
            } else {
                for (Branch branch : branches) {
                    created.add(tree.addChild(selected.getId(), branch.state(), branch.terminal()).getId());
                }
                if (log.isDebugEnabled()) {
                    log.debug("[{}] Expanded {} into {}", event.reviewId(), selected.getId(), created);
                }
            }
            return new NodeExpanded(event.meta(), tree, context, selected.getId(), created);
        });
    }
}
