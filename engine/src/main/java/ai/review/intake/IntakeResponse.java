package ai.review.intake;

import java.time.Instant;

/**
 * Answer to a submitted review, shaped like an HTTP response.
 *
 * @param status 200 when accepted, 400 when the request is malformed
 * @param message human readable outcome
 * @param reviewId id assigned to the review, also present on rejections
 * @param timestamp when the request was handled
 */
public record IntakeResponse(int status, String message, String reviewId, Instant timestamp) {

    public static final int ACCEPTED = 200;
    public static final int BAD_REQUEST = 400;

    public boolean accepted() {
        return status == ACCEPTED;
    }
}
