package ai.review.agent.llm;

import ai.review.agent.Branch;
import ai.review.agent.BranchGenerator;
import ai.review.agent.ExpansionContext;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Proposes next reasoning steps with the configured chat model.
 */
@Component
@Profile({"ai-ollama", "ai-openai"})
public class ChatBranchGenerator implements BranchGenerator {

    private static final Logger log = LoggerFactory.getLogger(ChatBranchGenerator.class);

    static final String SYSTEM_PROMPT = """
            You are refining a code review one reasoning step at a time.
            Given the current reasoning state, propose 2 or 3 distinct next steps that would be
            valuable to explore. Mark a step terminal when nothing useful could follow it.
            Propose no steps if the current state needs no further refinement.

            Reply with a single JSON object and nothing else:
            {"branches": [{"state": "<next reasoning step>", "isTerminal": false}]}
            """;

    private final ChatClient chatClient;

    public ChatBranchGenerator(ChatClient chatClient) {
        this.chatClient = chatClient;
    }

    @Override
    public List<Branch> expand(String nodeState, ExpansionContext context) {
        String user = "Review requirements:\n"
                + (context.requirements() == null || context.requirements().isBlank() ? "(none given)" : context.requirements())
                + "\n\nDepth " + context.depth() + " of " + context.maxDepth()
                + "\n\nCurrent reasoning state:\n" + nodeState;
        String response = chatClient.prompt()
                .system(SYSTEM_PROMPT)
                .user(user)
                .call()
                .content();
        if (log.isTraceEnabled()) {
            log.trace("Model expansion response: {}", response);
        }
        return ReplyParser.branches(response, context.childrenAtDepthLimit());
    }
}
