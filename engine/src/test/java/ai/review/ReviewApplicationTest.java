package ai.review;

import static org.junit.jupiter.api.Assertions.*;

import ai.review.agent.Evaluator;
import ai.review.agent.heuristic.HeuristicEvaluator;
import ai.review.config.ReviewRequestProperties;
import ai.review.state.ReviewRecord;
import ai.review.state.ReviewStatus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Files;
import java.nio.file.Path;
import org.eclipse.jgit.api.Git;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

/**
 * Boots the application with the offline collaborators and reviews a repository created on
 * disk. Nothing is reviewed at startup because no repository is configured.
 */
@SpringBootTest(properties = {"review.mcts.max-iterations=5", "review.mcts.phase-timeout=30s"})
class ReviewApplicationTest {

    @Autowired
    ReviewApplication application;

    @Autowired
    ReviewRequestProperties request;

    @Autowired
    Evaluator evaluator;

    @TempDir
    Path workDir;

    @Test
    void offlineCollaboratorsAreWired() {
        assertInstanceOf(HeuristicEvaluator.class, evaluator);
    }

    @Test
    void reviewsALocalRepositoryAndWritesTheReport() throws Exception {
        Path repo = workDir.resolve("repo");
        try (Git git = Git.init().setDirectory(repo.toFile()).setInitialBranch("main").call()) {
            Files.writeString(repo.resolve("Upload.java"), "class Upload {\n    void send() { retry(3); }\n}\n");
            git.add().addFilepattern("Upload.java").call();
            git.commit()
                    .setMessage("Add upload client")
                    .setAuthor("Reviewer", "reviewer@example.com")
                    .setCommitter("Reviewer", "reviewer@example.com")
                    .setSign(false)
                    .call();
        }
        Path report = workDir.resolve("report.json");
        request.setRepository("file://" + repo.toAbsolutePath());
        request.setRequirements("Check error handling");
        request.setOutputPath(report.toString());
        try {
            ReviewRecord record = application.review().orElseThrow();

            assertEquals(ReviewStatus.COMPLETED, record.status());
            assertEquals(5, record.currentIteration());
            assertTrue(Files.exists(report));
            JsonNode json = new ObjectMapper().readTree(report.toFile());
            assertTrue(json.path("initialScore").asDouble() < 0.9);
            assertFalse(json.path("issues").isEmpty(), "an untested change is reported");
            assertEquals(5, json.path("outcome").path("iterations").asInt());
        } finally {
            request.setRepository("");
        }
    }
}
