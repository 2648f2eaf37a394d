package ai.review.intake;

import ai.review.ReviewException;
import ai.review.config.MctsProperties;
import ai.review.events.ReviewError;
import ai.review.events.ReviewEventBus;
import ai.review.events.ReviewMetadata;
import ai.review.events.ReviewRequested;
import ai.review.events.Topics;
import ai.review.state.ReviewStateStore;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Entry point for new reviews: validates a request, assigns a review id and emits
 * {@code review.requested}.
 *
 * <p>Malformed requests are answered with 400 and reported as {@code review.error} under the id
 * they were given. The requested depth is capped at {@code review.mcts.max-depth}. When called from outside a running review the bus delivers the whole review
 * before {@link #submit(ReviewRequest)} returns.
 */
@Component
public class ReviewIntake {

    private static final Logger log = LoggerFactory.getLogger(ReviewIntake.class);

    private final ReviewEventBus bus;
    private final ReviewStateStore store;
    private final MctsProperties mctsProperties;

    public ReviewIntake(ReviewEventBus bus, ReviewStateStore store, MctsProperties mctsProperties) {
        this.bus = bus;
        this.store = store;
        this.mctsProperties = mctsProperties;
    }

    public IntakeResponse submit(ReviewRequest request) {
        String reviewId = UUID.randomUUID().toString();
        Instant now = Instant.now();
        store.update(reviewId, current -> current);

        try {
            validate(request);
        } catch (ReviewException e) {
            log.warn("[{}] Rejected review of '{}': {}", reviewId, request.repository(), e.getMessage());
            bus.publish(Topics.REVIEW_ERROR,
                    new ReviewError(reviewId, "intake", e.getMessage(), now, request.repository(), request.outputPath()));
            return new IntakeResponse(IntakeResponse.BAD_REQUEST, e.getMessage(), reviewId, now);
        }

        ReviewMetadata meta = new ReviewMetadata(
                reviewId,
                request.repository().trim(),
                request.branch(),
                request.requirements(),
                request.outputPath(),
                0);
        log.info("[{}] Review of {} ({}) accepted", reviewId, meta.repository(), meta.branch());
        bus.publish(Topics.REVIEW_REQUESTED, new ReviewRequested(
                meta,
                request.reviewStartCommit(),
                request.reviewEndCommit(),
                request.reviewMaxCommits(),
                request.requirements(),
                mctsProperties.getMaxIterations(),
                mctsProperties.getExplorationConstant(),
                Math.min(request.depth(), mctsProperties.getMaxDepth()),
                now));
        return new IntakeResponse(IntakeResponse.ACCEPTED, "Review accepted", reviewId, now);
    }

    static void validate(ReviewRequest request) {
        RepositoryUrl.parse(request.repository());
        if (request.depth() < 0) {
            throw new ReviewException("depth must be non-negative: " + request.depth());
        }
        if (request.reviewMaxCommits() < 0) {
            throw new ReviewException("reviewMaxCommits must be non-negative: " + request.reviewMaxCommits());
        }
    }
}
