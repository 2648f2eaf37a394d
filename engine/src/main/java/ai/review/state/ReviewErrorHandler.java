package ai.review.state;

import ai.review.events.ReviewError;
import ai.review.events.TopicSubscriber;
import ai.review.events.Topics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Terminal handler for {@code review.error}: logs the failure and marks the review failed.
 */
@Component
public class ReviewErrorHandler implements TopicSubscriber<ReviewError> {

    private static final Logger log = LoggerFactory.getLogger(ReviewErrorHandler.class);

    private final ReviewStateStore store;

    public ReviewErrorHandler(ReviewStateStore store) {
        this.store = store;
    }

    @Override
    public String topic() {
        return Topics.REVIEW_ERROR;
    }

    @Override
    public Class<ReviewError> payloadType() {
        return ReviewError.class;
    }

    @Override
    public void onEvent(ReviewError error) {
        log.error("[{}] Review failed in {}: {} (repository={}, output={})",
                error.reviewId(), error.phase(), error.message(), error.repository(), error.outputPath());
        if (error.reviewId() == null) {
            return;
        }
        store.update(error.reviewId(), current -> current.status() == ReviewStatus.FAILED ? current : current.failed(error));
    }
}
