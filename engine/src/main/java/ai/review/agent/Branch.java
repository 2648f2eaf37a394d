package ai.review.agent;

/**
 * A candidate next reasoning step produced by a {@link BranchGenerator}.
 *
 * @param state reasoning content of the step
 * @param terminal true when no meaningful refinement can follow this step
 */
public record Branch(String state, boolean terminal) {
}
