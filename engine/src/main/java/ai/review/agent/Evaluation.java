package ai.review.agent;

import java.util.List;

/**
 * Initial assessment of a change. The summary becomes the root state of the search tree and
 * the score decides whether the search runs at all.
 *
 * @param score overall quality in [0, 1]
 * @param summary context summary of the change
 * @param issues findings, possibly empty
 * @param issueSummary one paragraph over the findings
 */
public record Evaluation(double score, String summary, List<Issue> issues, String issueSummary) {

    public Evaluation {
        issues = issues == null ? List.of() : List.copyOf(issues);
        summary = summary == null ? "" : summary;
        issueSummary = issueSummary == null ? "" : issueSummary;
    }
}
