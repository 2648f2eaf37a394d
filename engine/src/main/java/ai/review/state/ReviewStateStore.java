package ai.review.state;

import java.util.Collection;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Per-review status and trace, keyed by review id.
 */
public interface ReviewStateStore {

    Optional<ReviewRecord> find(String reviewId);

    /**
     * Atomically replaces the record of {@code reviewId}. A review not seen before starts from
     * {@link ReviewRecord#pending(String)}.
     *
     * @return the stored record
     */
    ReviewRecord update(String reviewId, UnaryOperator<ReviewRecord> change);

    Collection<ReviewRecord> all();
}
