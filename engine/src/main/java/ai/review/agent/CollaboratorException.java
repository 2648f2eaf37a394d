package ai.review.agent;

import ai.review.ReviewException;

/**
 * A call to an external collaborator (commit source, evaluator, branch generator, scorer)
 * failed or returned something unusable.
 */
public class CollaboratorException extends ReviewException {

    public CollaboratorException(String message) {
        super(message);
    }

    public CollaboratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
