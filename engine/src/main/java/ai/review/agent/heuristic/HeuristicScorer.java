package ai.review.agent.heuristic;

import ai.review.agent.Scorer;
import java.util.List;
import java.util.Locale;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Offline scorer rewarding states that name concrete review concerns.
 *
 * <p>0.3 base, 0.1 per concern keyword up to 0.5, and up to 0.2 for length.
 */
@Component
@Profile("!ai-ollama & !ai-openai")
public class HeuristicScorer implements Scorer {

    static final List<String> KEYWORDS = List.of(
            "error", "test", "security", "performance", "structure", "edge case", "readab", "naming", "convention");

    @Override
    public double score(String nodeState) {
        if (nodeState == null || nodeState.isBlank()) {
            return 0.0;
        }
        String lower = nodeState.toLowerCase(Locale.ROOT);
        long hits = KEYWORDS.stream().filter(lower::contains).count();
        double score = 0.3 + Math.min(0.5, hits * 0.1) + Math.min(0.2, nodeState.length() / 2000.0);
        return Math.min(1.0, score);
    }
}
