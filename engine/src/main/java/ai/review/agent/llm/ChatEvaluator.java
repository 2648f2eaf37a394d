package ai.review.agent.llm;

import ai.review.agent.Evaluation;
import ai.review.agent.Evaluator;
import ai.review.git.Commits;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Evaluates a change with the configured chat model, asking for Toulmin-structured findings.
 */
@Component
@Profile({"ai-ollama", "ai-openai"})
public class ChatEvaluator implements Evaluator {

    private static final Logger log = LoggerFactory.getLogger(ChatEvaluator.class);

    static final String SYSTEM_PROMPT = """
            You are a senior software engineer reviewing a code change.
            Analyse the strategy of the change and the components it touches, then review it
            using the Toulmin model of argumentation.

            Reply with a single JSON object and nothing else:
            {
              "score": <number between 0 and 1, overall quality>,
              "summary": "<what the change does and how it fits the system>",
              "issues": [
                {"claim": "...", "grounds": "...", "warrant": "...", "backing": "...", "qualifier": "..."}
              ],
              "issueSummary": "<one paragraph over the issues>"
            }
            """;

    private final ChatClient chatClient;

    public ChatEvaluator(ChatClient chatClient) {
        this.chatClient = chatClient;
    }

    @Override
    public Evaluation evaluate(Commits commits, String prompt) {
        String user = "Requirements:\n" + (prompt == null || prompt.isBlank() ? "(none given)" : prompt)
                + "\n\nFiles changed:\n" + String.join("\n", commits.files())
                + "\n\nCommit messages:\n" + String.join("\n", commits.messages())
                + "\n\nDiff:\n" + commits.diff();
        if (log.isTraceEnabled()) {
            log.trace("Model evaluation prompt (user): {}", user);
        }
        String response = chatClient.prompt()
                .system(SYSTEM_PROMPT)
                .user(user)
                .call()
                .content();
        if (log.isTraceEnabled()) {
            log.trace("Model evaluation response: {}", response);
        }
        return ReplyParser.evaluation(response);
    }
}
