package ai.review;

import ai.review.config.ReviewRequestProperties;
import ai.review.intake.IntakeResponse;
import ai.review.intake.ReviewIntake;
import ai.review.intake.ReviewRequest;
import ai.review.state.ReviewRecord;
import ai.review.state.ReviewStateStore;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Command line entry point. Reviews the repository given by {@code --review.request.repository}
 * and logs where the report went, or why the review failed.
 *
 * Usage:
 * {@code java -jar engine.jar --review.request.repository=owner/repo --review.request.requirements="..."}
 */
@SpringBootApplication
public class ReviewApplication implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(ReviewApplication.class);

    private final ReviewIntake intake;
    private final ReviewStateStore store;
    private final ReviewRequestProperties request;

    public ReviewApplication(ReviewIntake intake, ReviewStateStore store, ReviewRequestProperties request) {
        this.intake = intake;
        this.store = store;
        this.request = request;
    }

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(ReviewApplication.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.run(args);
    }

    @Override
    public void run(String... args) {
        if (request.getRepository() == null || request.getRepository().isBlank()) {
            log.info("No repository configured; set --review.request.repository to run a review");
            return;
        }
        review();
    }

    /**
     * Submits the configured review. The bus delivers it to completion before this returns.
     *
     * @return the final record of the review
     */
    public Optional<ReviewRecord> review() {
        IntakeResponse response = intake.submit(new ReviewRequest(
                request.getRepository(),
                request.getBranch(),
                request.getDepth(),
                request.getReviewStartCommit(),
                request.getReviewEndCommit(),
                request.getReviewMaxCommits(),
                request.getRequirements(),
                request.getOutputPath()));
        Optional<ReviewRecord> record = store.find(response.reviewId());
        if (!response.accepted()) {
            log.error("Review rejected ({}): {}", response.status(), response.message());
            return record;
        }
        record.ifPresent(r -> {
            switch (r.status()) {
                case COMPLETED -> log.info("[{}] Review completed after {} iterations, report at {}",
                        r.reviewId(), r.currentIteration(), r.reportPath());
                case FAILED -> log.error("[{}] Review failed in {}: {}",
                        r.reviewId(), r.error().phase(), r.error().message());
                default -> log.warn("[{}] Review stopped in status {} after {}", r.reviewId(), r.status(), r.lastPhase());
            }
        });
        return record;
    }
}
