package ai.review.report;

import ai.review.agent.Evaluation;
import ai.review.events.ReviewEventBus;
import ai.review.events.TopicSubscriber;
import ai.review.events.Topics;
import ai.review.mcts.PhaseResult;
import ai.review.mcts.PhaseSupport;
import ai.review.state.ReviewRecord;
import ai.review.state.ReviewStateStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes the outcome of a review as a pretty-printed JSON document, to the requested output
 * path or to {@code review-<id>.json} in the working directory.
 */
@Component
public class ReportWriter extends PhaseSupport implements TopicSubscriber<ReasoningCompleted> {

    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final ReviewStateStore store;

    public ReportWriter(ReviewEventBus bus, ReviewStateStore store) {
        super(bus, "report");
        this.store = store;
    }

    @Override
    public String topic() {
        return Topics.REASONING_COMPLETED;
    }

    @Override
    public Class<ReasoningCompleted> payloadType() {
        return ReasoningCompleted.class;
    }

    @Override
    public void onEvent(ReasoningCompleted event) {
        PhaseResult<ReportGenerated> result = attempt(() -> {
            Path target = target(event.meta().reviewId(), event.meta().outputPath());
            write(target, report(event.outcome()));
            log.info("[{}] Report written to {}", event.reviewId(), target);
            return new ReportGenerated(event.meta(), event.outcome(), target.toString());
        });
        complete(event.meta(), Topics.REPORT_GENERATED, result);
    }

    ReviewReport report(ReviewOutcome outcome) {
        Evaluation evaluation = store.find(outcome.reviewId()).map(ReviewRecord::evaluation).orElse(null);
        return new ReviewReport(
                Instant.now().toString(),
                evaluation != null ? evaluation.score() : null,
                evaluation != null ? evaluation.issues() : List.of(),
                evaluation != null ? evaluation.issueSummary() : "",
                outcome);
    }

    static Path target(String reviewId, String outputPath) {
        String location = outputPath == null || outputPath.isBlank() ? "review-" + reviewId + ".json" : outputPath;
        return Paths.get(location).toAbsolutePath().normalize();
    }

    private static void write(Path target, ReviewReport report) {
        try {
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            MAPPER.writeValue(target.toFile(), report);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write report to " + target, e);
        }
    }
}
