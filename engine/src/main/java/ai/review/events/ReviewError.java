package ai.review.events;

import java.time.Instant;

/**
 * Payload of {@code review.error}. Emitted by whichever phase failed; the review does not
 * progress after it.
 *
 * @param reviewId failing review, may be null if the failure happened before an id existed
 * @param phase name of the phase that failed
 * @param message failure description
 * @param timestamp when the failure was observed
 * @param repository repository identifier of the review
 * @param outputPath requested report location
 */
public record ReviewError(
        String reviewId,
        String phase,
        String message,
        Instant timestamp,
        String repository,
        String outputPath) {

    public static ReviewError of(ReviewMetadata meta, String phase, Throwable error) {
        String message = error.getMessage() != null ? error.getMessage() : error.toString();
        return new ReviewError(meta.reviewId(), phase, message, Instant.now(), meta.repository(), meta.outputPath());
    }
}
