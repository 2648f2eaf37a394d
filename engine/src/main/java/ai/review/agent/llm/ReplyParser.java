package ai.review.agent.llm;

import ai.review.agent.Branch;
import ai.review.agent.Evaluation;
import ai.review.agent.Issue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns free-form model replies into typed results.
 *
 * <p>Models often wrap JSON in prose or code fences, so the object between the first
 * {@code '{'} and the last {@code '}'} is parsed. A reply without usable JSON yields the
 * documented fallback rather than an exception: score 0.5, the generic review aspects, or an
 * evaluation built around the raw reply.
 */
final class ReplyParser {

    private static final Logger log = LoggerFactory.getLogger(ReplyParser.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final double FALLBACK_SCORE = 0.5;
    static final List<String> FALLBACK_STEPS =
            List.of("Analyze code structure", "Review error handling", "Consider performance implications");
    static final int SUMMARY_LIMIT = 500;

    private ReplyParser() {}

    static Optional<JsonNode> json(String reply) {
        if (reply == null) {
            return Optional.empty();
        }
        int start = reply.indexOf('{');
        int end = reply.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return Optional.empty();
        }
        try {
            JsonNode node = MAPPER.readTree(reply.substring(start, end + 1));
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            log.warn("Unparseable model reply: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    static Evaluation evaluation(String reply) {
        Optional<JsonNode> parsed = json(reply);
        if (parsed.isEmpty()) {
            String summary = reply == null || reply.isBlank()
                    ? "Code review completed with limited data; the model returned no analysis."
                    : truncate(reply.strip(), SUMMARY_LIMIT);
            return new Evaluation(
                    FALLBACK_SCORE,
                    summary,
                    List.of(new Issue(
                            "Evaluation used fallback parsing",
                            "The model returned a reply without a JSON object",
                            "Structured findings cannot be extracted from free text",
                            "Reply parsing failed",
                            "This is a fallback response")),
                    "Used the raw reply as summary because it could not be parsed");
        }
        JsonNode node = parsed.get();
        List<Issue> issues = new ArrayList<>();
        for (JsonNode issue : node.path("issues")) {
            issues.add(new Issue(
                    issue.path("claim").asText(""),
                    issue.path("grounds").asText(""),
                    issue.path("warrant").asText(""),
                    issue.path("backing").asText(""),
                    issue.path("qualifier").asText("")));
        }
        return new Evaluation(
                clamp(number(node.path("score"))),
                node.path("summary").asText(""),
                issues,
                node.path("issueSummary").asText(""));
    }

    static List<Branch> branches(String reply, boolean terminalAtLimit) {
        Optional<JsonNode> parsed = json(reply);
        List<Branch> branches = new ArrayList<>();
        if (parsed.isPresent()) {
            JsonNode node = parsed.get();
            for (JsonNode branch : node.path("branches")) {
                String state = branch.isTextual() ? branch.asText() : branch.path("state").asText("");
                if (!state.isBlank()) {
                    boolean terminal = terminalAtLimit || branch.path("isTerminal").asBoolean(false);
                    branches.add(new Branch(state.strip(), terminal));
                }
            }
            // older prompts ask for a plain list of step strings
            for (JsonNode step : node.path("steps")) {
                if (!step.asText("").isBlank()) {
                    branches.add(new Branch(step.asText().strip(), terminalAtLimit));
                }
            }
            if (!branches.isEmpty() || node.has("branches") || node.has("steps")) {
                return branches;
            }
        }
        for (String step : FALLBACK_STEPS) {
            branches.add(new Branch(step, terminalAtLimit));
        }
        return branches;
    }

    static double score(String reply) {
        return json(reply).map(node -> clamp(number(node.path("value")))).orElse(FALLBACK_SCORE);
    }

    private static double number(JsonNode node) {
        if (node.isNumber()) {
            return node.asDouble();
        }
        if (node.isTextual()) {
            try {
                return Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                log.debug("Non-numeric score '{}', using {}", node.asText(), FALLBACK_SCORE);
            }
        }
        return FALLBACK_SCORE;
    }

    private static double clamp(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return FALLBACK_SCORE;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static String truncate(String text, int limit) {
        return text.length() <= limit ? text : text.substring(0, limit);
    }
}
