package ai.review.state;

/**
 * Lifecycle of a review as seen through the state store.
 */
public enum ReviewStatus {
    /** Accepted at intake, not yet picked up. */
    PENDING,
    /** Commits fetched or search in progress. */
    RUNNING,
    /** Best path chosen, report not yet written. */
    REPORTING,
    /** Report written. */
    COMPLETED,
    /** A phase emitted {@code review.error}; nothing further happens. */
    FAILED;

    public boolean isFinal() {
        return this == COMPLETED || this == FAILED;
    }
}
