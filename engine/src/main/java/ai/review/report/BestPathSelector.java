package ai.review.report;

import ai.review.events.ReviewEventBus;
import ai.review.events.ReviewMetadata;
import ai.review.events.SearchEvents.IterationsCompleted;
import ai.review.events.TopicSubscriber;
import ai.review.events.Topics;
import ai.review.mcts.PhaseResult;
import ai.review.mcts.PhaseSupport;
import ai.review.tree.Node;
import ai.review.tree.ReviewTree;
import ai.review.tree.TreeCorruptionException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Picks the final reasoning path once the search has stopped.
 *
 * <p>Robust child: starting at the root, follow the most visited child (lowest id on ties) until
 * reaching a leaf or a node none of whose children has been visited. Visit counts are preferred
 * over mean values because a single lucky simulation can inflate a mean but not a count.
 */
@Component
public class BestPathSelector extends PhaseSupport implements TopicSubscriber<IterationsCompleted> {

    private static final Logger log = LoggerFactory.getLogger(BestPathSelector.class);

    public BestPathSelector(ReviewEventBus bus) {
        super(bus, "best-path");
    }

    @Override
    public String topic() {
        return Topics.ITERATIONS_COMPLETED;
    }

    @Override
    public Class<IterationsCompleted> payloadType() {
        return IterationsCompleted.class;
    }

    @Override
    public void onEvent(IterationsCompleted event) {
        PhaseResult<ReasoningCompleted> result = attempt(() -> new ReasoningCompleted(
                event.meta(), outcome(event.meta(), event.tree(), event.context().currentIteration())));
        if (complete(event.meta(), Topics.REASONING_COMPLETED, result)) {
            ReviewOutcome outcome = result.value().outcome();
            log.info("[{}] Best path {} after {} iterations (selected visits={}, total visits={})",
                    event.reviewId(), outcome.path(), outcome.iterations(),
                    outcome.stats().visits(), outcome.stats().totalVisits());
        }
    }

    /**
     * @return node ids from the root to the robust-child leaf
     */
    public static List<String> bestPath(ReviewTree tree) {
        List<String> path = new ArrayList<>();
        Node current = tree.root();
        path.add(current.getId());
        while (true) {
            Node next = null;
            for (String childId : current.getChildren()) {
                Node child = tree.node(childId);
                if (child.getVisits() == 0) {
                    continue;
                }
                if (next == null
                        || child.getVisits() > next.getVisits()
                        || (child.getVisits() == next.getVisits() && child.getId().compareTo(next.getId()) < 0)) {
                    next = child;
                }
            }
            if (next == null) {
                return path;
            }
            if (path.size() >= tree.size()) {
                throw new TreeCorruptionException("Best path longer than the tree; cycle suspected");
            }
            path.add(next.getId());
            current = next;
        }
    }

    public static ReviewOutcome outcome(ReviewMetadata meta, ReviewTree tree, int iterations) {
        List<String> path = bestPath(tree);
        Node selected = tree.node(path.get(path.size() - 1));
        ReviewStats stats = new ReviewStats(
                selected.getVisits(), selected.getValue(), tree.root().getVisits(), selected.getChildren().size());
        return new ReviewOutcome(
                meta.reviewId(),
                selected.getId(),
                selected.getState(),
                reasoning(tree, path),
                stats,
                new LinkedHashMap<>(tree.copy().getNodes()),
                path,
                meta.repository(),
                meta.branch(),
                meta.requirements(),
                meta.commitsAnalyzed(),
                iterations);
    }

    static String reasoning(ReviewTree tree, List<String> path) {
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < path.size(); i++) {
            Node node = tree.node(path.get(i));
            text.append(String.format(Locale.ROOT, "%d. [%s visits=%d mean=%.4f] %s%n",
                    i, node.getId(), node.getVisits(), node.getMeanValue(), firstLine(node.getState())));
        }
        return text.toString().trim();
    }

    private static String firstLine(String state) {
        String trimmed = state.strip();
        int newline = trimmed.indexOf('\n');
        return newline < 0 ? trimmed : trimmed.substring(0, newline).strip();
    }
}
