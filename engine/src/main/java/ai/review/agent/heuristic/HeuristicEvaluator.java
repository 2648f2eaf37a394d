package ai.review.agent.heuristic;

import ai.review.agent.Evaluation;
import ai.review.agent.Evaluator;
import ai.review.agent.Issue;
import ai.review.git.Commits;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Offline evaluator scoring a change by its size and whether it touches tests.
 *
 * <p>An empty change scores 1.0, which skips the search. Otherwise the score starts at 0.8,
 * loses up to 0.4 as the number of changed lines grows, and loses 0.15 more when no test file
 * is part of the change.
 */
@Component
@Profile("!ai-ollama & !ai-openai")
public class HeuristicEvaluator implements Evaluator {

    static final double BASE_SCORE = 0.8;
    static final double UNTESTED_PENALTY = 0.15;
    static final int LARGE_CHANGE_LINES = 500;

    @Override
    public Evaluation evaluate(Commits commits, String prompt) {
        if (commits.count() == 0 || commits.diff().isBlank()) {
            return new Evaluation(1.0, "No changes to review.", List.of(), "No issues: the change is empty.");
        }

        int[] lines = changedLines(commits.diff());
        int changed = lines[0] + lines[1];
        boolean testsTouched = commits.files().stream().anyMatch(HeuristicEvaluator::isTestFile);

        double score = BASE_SCORE - Math.min(0.4, changed / 2000.0);
        if (!testsTouched) {
            score -= UNTESTED_PENALTY;
        }
        score = Math.max(0.0, Math.min(1.0, score));

        List<Issue> issues = new ArrayList<>();
        if (!testsTouched) {
            issues.add(new Issue(
                    "The change is not accompanied by tests",
                    "None of the " + commits.files().size() + " changed files is a test",
                    "Behaviour changed without tests can regress unnoticed",
                    "Changed code is usually expected to ship with tests that exercise it",
                    "Likely, unless the change is covered by existing tests"));
        }
        if (changed > LARGE_CHANGE_LINES) {
            issues.add(new Issue(
                    "The change is large",
                    changed + " lines added or removed",
                    "Large changes are harder to review thoroughly",
                    "Smaller, focused commits are easier to reason about",
                    "Possibly, depending on how much of it is generated or mechanical"));
        }

        String summary = summary(commits, lines, prompt);
        String issueSummary = issues.isEmpty()
                ? "No structural issues detected."
                : issues.size() + " issue(s): " + String.join("; ", issues.stream().map(Issue::claim).toList());
        return new Evaluation(score, summary, issues, issueSummary);
    }

    private static String summary(Commits commits, int[] lines, String prompt) {
        StringBuilder text = new StringBuilder();
        text.append(String.format(Locale.ROOT, "%d commit(s) touching %d file(s), +%d/-%d lines.",
                commits.count(), commits.files().size(), lines[0], lines[1]));
        text.append(" Latest: ").append(commits.messages().get(0)).append('.');
        if (prompt != null && !prompt.isBlank()) {
            text.append(" Requirements: ").append(prompt.strip()).append('.');
        }
        List<String> shown = commits.files().subList(0, Math.min(10, commits.files().size()));
        if (!shown.isEmpty()) {
            text.append(" Files: ").append(String.join(", ", shown));
            if (commits.files().size() > shown.size()) {
                text.append(" and ").append(commits.files().size() - shown.size()).append(" more");
            }
            text.append('.');
        }
        return text.toString();
    }

    /**
     * @return added and removed line counts of a unified diff
     */
    static int[] changedLines(String diff) {
        int added = 0;
        int removed = 0;
        for (String line : diff.split("\n")) {
            if (line.startsWith("+++") || line.startsWith("---")) {
                continue;
            }
            if (line.startsWith("+")) {
                added++;
            } else if (line.startsWith("-")) {
                removed++;
            }
        }
        return new int[] {added, removed};
    }

    static boolean isTestFile(String path) {
        String lower = path.toLowerCase(Locale.ROOT);
        if (lower.startsWith("test/") || lower.startsWith("tests/") || lower.contains("/test/") || lower.contains("/tests/")) {
            return true;
        }
        String name = path.substring(path.lastIndexOf('/') + 1);
        int dot = name.indexOf('.');
        String stem = dot < 0 ? name : name.substring(0, dot);
        String lowerStem = stem.toLowerCase(Locale.ROOT);
        return stem.endsWith("Test") || stem.endsWith("Tests")
                || lowerStem.startsWith("test_") || lowerStem.endsWith("_test")
                || name.toLowerCase(Locale.ROOT).matches(".*\\.(spec|test)\\.[a-z]+$");
    }
}
