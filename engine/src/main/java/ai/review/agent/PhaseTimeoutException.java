package ai.review.agent;

import ai.review.ReviewException;
import java.time.Duration;

/**
 * An external call did not finish within the configured phase timeout.
 */
public class PhaseTimeoutException extends ReviewException {

    public PhaseTimeoutException(String collaborator, Duration timeout) {
        super(collaborator + " did not respond within " + timeout.toMillis() + " ms");
    }
}
