package ai.review;

/**
 * Base class for failures raised while a review is being processed.
 *
 * <p>These are unchecked: phases catch them at their boundary and turn them into a
 * {@code review.error} event rather than letting them escape to the event bus.
 */
public class ReviewException extends RuntimeException {

    public ReviewException(String message) {
        super(message);
    }

    public ReviewException(String message, Throwable cause) {
        super(message, cause);
    }
}
