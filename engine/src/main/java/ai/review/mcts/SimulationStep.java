package ai.review.mcts;

import ai.review.agent.CollaboratorException;
import ai.review.agent.ExternalCalls;
import ai.review.agent.Scorer;
import ai.review.events.ReviewEventBus;
import ai.review.events.SearchEvents.NodeExpanded;
import ai.review.events.SearchEvents.SimulationCompleted;
import ai.review.events.SearchEvents.SimulationResult;
import ai.review.events.TopicSubscriber;
import ai.review.events.Topics;
import ai.review.tree.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Simulation: scores one node into a reward in [0, 1].
 *
 * <p>The node scored is the first child created by the preceding expansion, or the selected
 * node itself when the expansion created nothing. Scores outside [0, 1] are clamped; a score
 * that is not a finite number fails the phase.
 */
@Component
public class SimulationStep extends PhaseSupport implements TopicSubscriber<NodeExpanded> {

    private static final Logger log = LoggerFactory.getLogger(SimulationStep.class);

    private final Scorer scorer;
    private final ExternalCalls calls;

    public SimulationStep(ReviewEventBus bus, Scorer scorer, ExternalCalls calls) {
        super(bus, "simulation");
        this.scorer = scorer;
        this.calls = calls;
    }

    @Override
    public String topic() {
        return Topics.NODE_EXPANDED;
    }

    @Override
    public Class<NodeExpanded> payloadType() {
        return NodeExpanded.class;
    }

    @Override
    public void onEvent(NodeExpanded event) {
        complete(event.meta(), Topics.SIMULATION_COMPLETED, simulate(event));
    }

    PhaseResult<SimulationCompleted> simulate(NodeExpanded event) {
        return attempt(() -> {
            String targetId = event.newChildIds().isEmpty()
                    ? event.selectedNodeId()
                    : event.newChildIds().get(0);
            Node target = event.tree().node(targetId);

            Double raw = calls.call("scorer", () -> scorer.score(target.getState()));
            if (raw == null || raw.isNaN() || raw.isInfinite()) {
                throw new CollaboratorException("scorer returned " + raw + " for " + targetId);
            }
            double value = clamp(raw);
            String explanation = value == raw
                    ? String.format("scored %.4f", value)
                    : String.format("scored %.4f, clamped to %.4f", raw, value);
            if (log.isDebugEnabled()) {
                log.debug("[{}] Simulated {}: {}", event.reviewId(), targetId, explanation);
            }
            return new SimulationCompleted(
                    event.meta(),
                    event.tree().copy(),
                    event.context(),
                    new SimulationResult(targetId, value, explanation));
        });
    }

    static double clamp(double score) {
        return Math.max(0.0, Math.min(1.0, score));
    }
}
