package ai.review.agent;

/**
 * Estimates the quality of one reasoning state. Used by Simulation.
 */
@FunctionalInterface
public interface Scorer {

    /**
     * @param nodeState reasoning content to score
     * @return quality in [0, 1], higher is better
     */
    double score(String nodeState);
}
