package ai.review.agent.llm;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import ai.review.events.Topics;
import ai.review.intake.IntakeResponse;
import ai.review.report.ReportGenerated;
import ai.review.state.ReviewStatus;
import ai.review.support.ReviewHarness;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;

/**
 * Runs a short review of a canned change against a local Ollama server. Requires a running
 * Ollama; set -Dollama.tests=true to run, -Dollama.model=name to pick the model.
 */
class OllamaReviewResultsTest {

    private static final Logger log = LoggerFactory.getLogger(OllamaReviewResultsTest.class);

    @TempDir
    Path outputDir;

    @Test
    void reviewCompletesWithModelCollaborators() throws Exception {
        assumeTrue(Boolean.getBoolean("ollama.tests"), "Enable with -Dollama.tests=true (requires local Ollama)");

        String model = System.getProperty("ollama.model", "llama3");
        String baseUrl = System.getProperty("ollama.base-url", "http://localhost:11434");
        ChatClient chatClient = OllamaConfiguration.buildChatClient(baseUrl, model);

        ReviewHarness harness = ReviewHarness.builder()
                .evaluator(new ChatEvaluator(chatClient))
                .branchGenerator(new ChatBranchGenerator(chatClient))
                .scorer(new ChatScorer(chatClient))
                .maxIterations(3)
                .threshold(1.0)
                .timeout(Duration.ofMinutes(5))
                .build();
        try {
            long startNanos = System.nanoTime();
            IntakeResponse response = harness.submit(ReviewHarness.request(outputDir));

            assertEquals(200, response.status());
            assertEquals(ReviewStatus.COMPLETED, harness.record(response.reviewId()).status());
            List<ReportGenerated> reports = harness.payloads(Topics.REPORT_GENERATED, ReportGenerated.class);
            assertEquals(1, reports.size());
            assertTrue(Files.exists(Path.of(reports.get(0).reportPath())));
            log.info("Model {} reviewed the change in {} ms, best path:\n{}",
                    model,
                    (System.nanoTime() - startNanos) / 1_000_000L,
                    reports.get(0).outcome().reasoning());
        } finally {
            harness.close();
        }
    }
}
