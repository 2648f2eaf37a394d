package ai.review.intake;

import ai.review.ReviewException;

/**
 * The repository identifier of a review request could not be parsed.
 */
public class InvalidRepositoryException extends ReviewException {

    public InvalidRepositoryException(String repository) {
        super("Invalid repository identifier: '" + repository + "'");
    }
}
