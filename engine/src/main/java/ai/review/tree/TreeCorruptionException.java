package ai.review.tree;

import ai.review.ReviewException;

/**
 * Raised when a walk over parent links does not terminate within the number of nodes in the
 * tree, which can only happen if the parent relation contains a cycle.
 */
public class TreeCorruptionException extends ReviewException {

    public TreeCorruptionException(String message) {
        super(message);
    }
}
