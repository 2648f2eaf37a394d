package ai.review.events;

import java.time.Instant;

/**
 * Payload of {@code review.requested}: a validated review request plus the search budget.
 */
public record ReviewRequested(
        ReviewMetadata meta,
        String reviewStartCommit,
        String reviewEndCommit,
        int reviewMaxCommits,
        String prompt,
        int maxIterations,
        double explorationConstant,
        int maxDepth,
        Instant timestamp) implements ReviewPayload {
}
