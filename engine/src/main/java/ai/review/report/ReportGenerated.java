package ai.review.report;

import ai.review.events.ReviewMetadata;
import ai.review.events.ReviewPayload;

/**
 * Payload of {@code code-review.report.generated}.
 *
 * @param meta the review
 * @param outcome what was reported
 * @param reportPath absolute path of the written report
 */
public record ReportGenerated(ReviewMetadata meta, ReviewOutcome outcome, String reportPath) implements ReviewPayload {
}
