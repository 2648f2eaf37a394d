package ai.review.mcts;

import java.util.Objects;

/**
 * Outcome of one phase: either a value to pass on or the cause that stopped the review.
 *
 * @param <T> type of the successful value
 */
public final class PhaseResult<T> {

    private final T value;
    private final Throwable error;

    private PhaseResult(T value, Throwable error) {
        this.value = value;
        this.error = error;
    }

    public static <T> PhaseResult<T> success(T value) {
        return new PhaseResult<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> PhaseResult<T> failure(Throwable error) {
        return new PhaseResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * @throws IllegalStateException if this is a failure
     */
    public T value() {
        if (error != null) {
            throw new IllegalStateException("Phase failed: " + error.getMessage(), error);
        }
        return value;
    }

    /**
     * @throws IllegalStateException if this is a success
     */
    public Throwable error() {
        if (error == null) {
            throw new IllegalStateException("Phase succeeded");
        }
        return error;
    }

    @Override
    public String toString() {
        return isSuccess() ? "PhaseResult{success=" + value + "}" : "PhaseResult{failure=" + error + "}";
    }
}
