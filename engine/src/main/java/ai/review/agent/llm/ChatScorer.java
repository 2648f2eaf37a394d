package ai.review.agent.llm;

import ai.review.agent.Scorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

@Component
@Profile({"ai-ollama", "ai-openai"})
public class ChatScorer implements Scorer {

    private static final Logger log = LoggerFactory.getLogger(ChatScorer.class);

    static final String SYSTEM_PROMPT = """
            Rate the quality of the following code review reasoning step on a scale from 0.0 to
            1.0: how specific, well-grounded and useful it is to the author of the change.

            Reply with a single JSON object and nothing else:
            {"value": <number between 0 and 1>, "explanation": "<why you assigned this score>"}
            """;

    private final ChatClient chatClient;

    public ChatScorer(ChatClient chatClient) {
        this.chatClient = chatClient;
    }

    @Override
    public double score(String nodeState) {
        String response = chatClient.prompt()
                .system(SYSTEM_PROMPT)
                .user(nodeState)
                .call()
                .content();
        if (log.isTraceEnabled()) {
            log.trace("Model score response: {}", response);
        }
        return ReplyParser.score(response);
    }
}
