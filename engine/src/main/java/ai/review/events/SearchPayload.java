package ai.review.events;

import ai.review.tree.IterationContext;
import ai.review.tree.ReviewTree;

/**
 * A review event that carries a tree snapshot and the search budget.
 */
public interface SearchPayload extends ReviewPayload {

    ReviewTree tree();

    IterationContext context();
}
