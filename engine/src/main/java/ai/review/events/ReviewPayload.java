package ai.review.events;

/**
 * Implemented by every event payload that belongs to a running review.
 */
public interface ReviewPayload {

    ReviewMetadata meta();

    default String reviewId() {
        return meta().reviewId();
    }
}
