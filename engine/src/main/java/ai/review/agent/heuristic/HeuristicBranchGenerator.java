package ai.review.agent.heuristic;

import ai.review.agent.Branch;
import ai.review.agent.BranchGenerator;
import ai.review.agent.ExpansionContext;
import java.util.ArrayList;
import java.util.List;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Offline branch generator proposing a fixed set of review aspects per depth.
 */
@Component
@Profile("!ai-ollama & !ai-openai")
public class HeuristicBranchGenerator implements BranchGenerator {

    static final List<List<String>> ASPECTS = List.of(
            List.of("Analyze code structure", "Review error handling", "Consider performance implications"),
            List.of("Check test coverage", "Assess naming and readability", "Look for security concerns"),
            List.of("Verify edge cases", "Check consistency with existing conventions"));

    @Override
    public List<Branch> expand(String nodeState, ExpansionContext context) {
        List<String> aspects = ASPECTS.get(context.depth() % ASPECTS.size());
        boolean terminal = context.childrenAtDepthLimit();
        List<Branch> branches = new ArrayList<>();
        for (String aspect : aspects) {
            branches.add(new Branch(describe(aspect, nodeState, context), terminal));
        }
        return branches;
    }

    private static String describe(String aspect, String nodeState, ExpansionContext context) {
        StringBuilder text = new StringBuilder(aspect);
        if (context.requirements() != null && !context.requirements().isBlank()) {
            text.append(" with respect to: ").append(context.requirements().strip());
        }
        String focus = nodeState.strip();
        int newline = focus.indexOf('\n');
        if (newline >= 0) {
            focus = focus.substring(0, newline);
        }
        if (focus.length() > 160) {
            focus = focus.substring(0, 160) + "...";
        }
        if (!focus.isEmpty()) {
            text.append("\nBuilding on: ").append(focus);
        }
        return text.toString();
    }
}
