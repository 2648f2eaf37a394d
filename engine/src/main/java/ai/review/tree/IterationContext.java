package ai.review.tree;

/**
 * Search budget and tuning threaded through every phase of one review.
 *
 * <p>Only {@code currentIteration} ever changes, and only by creating a new context through
 * {@link #withIteration(int)}.
 *
 * @param maxIterations number of select/expand/simulate/backpropagate cycles to run
 * @param currentIteration cycles completed so far
 * @param explorationConstant the UCT exploration weight {@code c}
 * @param maxDepth deepest level (root = 0) at which a node may still be expanded
 */
public record IterationContext(int maxIterations, int currentIteration, double explorationConstant, int maxDepth) {

    public IterationContext {
        if (maxIterations < 0) {
            throw new IllegalArgumentException("maxIterations must be non-negative: " + maxIterations);
        }
        if (currentIteration < 0) {
            throw new IllegalArgumentException("currentIteration must be non-negative: " + currentIteration);
        }
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be non-negative: " + maxDepth);
        }
        if (Double.isNaN(explorationConstant) || explorationConstant < 0.0) {
            throw new IllegalArgumentException("explorationConstant must be a non-negative number: " + explorationConstant);
        }
    }

    public IterationContext withIteration(int iteration) {
        return new IterationContext(maxIterations, iteration, explorationConstant, maxDepth);
    }

    /**
     * @return true once the iteration budget has been used up
     */
    public boolean budgetExhausted() {
        return currentIteration >= maxIterations;
    }
}
