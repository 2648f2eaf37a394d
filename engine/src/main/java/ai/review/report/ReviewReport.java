package ai.review.report;

import ai.review.agent.Issue;
import java.util.List;

/**
 * The document written to disk for a finished review.
 *
 * @param generatedAt ISO-8601 time of writing
 * @param initialScore score of the initial evaluation, null if unknown
 * @param issues findings of the initial evaluation
 * @param issueSummary summary of those findings
 * @param outcome the best path and the full tree
 */
public record ReviewReport(
        String generatedAt,
        Double initialScore,
        List<Issue> issues,
        String issueSummary,
        ReviewOutcome outcome) {
}
