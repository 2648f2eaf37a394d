package ai.review.git;

import java.util.List;

/**
 * The code change under review, as handed to the evaluator.
 *
 * @param messages one line per commit: abbreviated id followed by the short message, newest first
 * @param files paths touched by the change
 * @param diff unified diff of the whole range, possibly truncated
 */
public record Commits(List<String> messages, List<String> files, String diff) {

    public Commits {
        messages = List.copyOf(messages);
        files = List.copyOf(files);
        diff = diff == null ? "" : diff;
    }

    public int count() {
        return messages.size();
    }
}
