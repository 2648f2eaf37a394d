package ai.review.mcts;

import ai.review.events.ReviewError;
import ai.review.events.ReviewEventBus;
import ai.review.events.ReviewMetadata;
import ai.review.events.Topics;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared plumbing for the search phases: run the phase body, publish its result, and turn any
 * failure into a {@code review.error} event carrying the review identity.
 */
public abstract class PhaseSupport {

    private static final Logger log = LoggerFactory.getLogger(PhaseSupport.class);

    protected final ReviewEventBus bus;
    private final String phase;

    protected PhaseSupport(ReviewEventBus bus, String phase) {
        this.bus = bus;
        this.phase = phase;
    }

    public String phase() {
        return phase;
    }

    /**
     * Runs {@code body}, capturing any runtime failure as a {@link PhaseResult#failure}.
     */
    protected <T> PhaseResult<T> attempt(Supplier<T> body) {
        try {
            return PhaseResult.success(body.get());
        } catch (RuntimeException e) {
            return PhaseResult.failure(e);
        }
    }

    /**
     * Publishes the value of a successful result on {@code topic}, or reports the failure.
     *
     * @return true if the result was a success
     */
    protected boolean complete(ReviewMetadata meta, String topic, PhaseResult<?> result) {
        if (result.isSuccess()) {
            bus.publish(topic, result.value());
            return true;
        }
        fail(meta, result.error());
        return false;
    }

    protected void fail(ReviewMetadata meta, Throwable error) {
        log.error("[{}] {} failed: {}", meta.reviewId(), phase, error.getMessage(), error);
        bus.publish(Topics.REVIEW_ERROR, ReviewError.of(meta, phase, error));
    }
}
