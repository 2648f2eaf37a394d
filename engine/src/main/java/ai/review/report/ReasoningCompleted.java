package ai.review.report;

import ai.review.events.ReviewMetadata;
import ai.review.events.ReviewPayload;

/**
 * Payload of {@code code-review.reasoning.completed}.
 */
public record ReasoningCompleted(ReviewMetadata meta, ReviewOutcome outcome) implements ReviewPayload {
}
