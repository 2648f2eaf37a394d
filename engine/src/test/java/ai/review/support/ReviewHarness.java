package ai.review.support;

import ai.review.agent.BranchGenerator;
import ai.review.agent.Evaluation;
import ai.review.agent.Evaluator;
import ai.review.agent.ExternalCalls;
import ai.review.agent.Scorer;
import ai.review.agent.heuristic.HeuristicBranchGenerator;
import ai.review.agent.heuristic.HeuristicScorer;
import ai.review.config.MctsProperties;
import ai.review.events.ReviewEventBus;
import ai.review.events.ReviewEventObserver;
import ai.review.events.SubscriptionRegistrar;
import ai.review.events.TopicSubscriber;
import ai.review.git.CommitSource;
import ai.review.git.Commits;
import ai.review.intake.IntakeResponse;
import ai.review.intake.ReviewIntake;
import ai.review.intake.ReviewRequest;
import ai.review.mcts.BackpropagationStep;
import ai.review.mcts.ExpansionStep;
import ai.review.mcts.MctsController;
import ai.review.mcts.SearchWiring;
import ai.review.mcts.SelectionStep;
import ai.review.mcts.SimulationStep;
import ai.review.report.BestPathSelector;
import ai.review.report.ReportWriter;
import ai.review.state.InMemoryReviewStateStore;
import ai.review.state.ReviewErrorHandler;
import ai.review.state.ReviewRecord;
import ai.review.state.ReviewStateRecorder;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Wires the full review pipeline by hand, the way the Spring context does, with replaceable
 * collaborators. Every published event is recorded in order.
 *
 * <p>Usage:
 * <pre>{@code
 * ReviewHarness harness = ReviewHarness.builder().maxIterations(3).build();
 * IntakeResponse response = harness.submit(harness.request(tempDir));
 * }</pre>
 */
public final class ReviewHarness {

    /** A published event. */
    public record Published(String topic, Object payload) {
    }

    public final ReviewEventBus bus = new ReviewEventBus();
    public final InMemoryReviewStateStore store = new InMemoryReviewStateStore();
    public final MctsProperties properties;
    public final ExternalCalls calls;
    public final MctsController controller;
    private final ReviewIntake intake;
    private final List<Published> published = new ArrayList<>();

    private ReviewHarness(Builder builder) {
        this.properties = new MctsProperties();
        properties.setMaxIterations(builder.maxIterations);
        properties.setHighConfidenceThreshold(builder.threshold);
        this.calls = new ExternalCalls(builder.timeout);

        this.controller = new MctsController(bus, builder.commitSource, builder.evaluator, calls, store, properties);
        SearchWiring wiring = new SearchWiring();
        List<TopicSubscriber<?>> subscribers = List.of(
                wiring.reviewRequestedSubscriber(controller),
                wiring.backpropagationCompletedSubscriber(controller),
                new SelectionStep(bus),
                new ExpansionStep(bus, builder.branchGenerator, calls),
                new SimulationStep(bus, builder.scorer, calls),
                new BackpropagationStep(bus),
                new BestPathSelector(bus),
                new ReportWriter(bus, store),
                new ReviewErrorHandler(store));
        ReviewEventObserver recorder = (topic, payload) -> published.add(new Published(topic, payload));
        List<ReviewEventObserver> observers = List.of(recorder, new ReviewStateRecorder(store));
        new SubscriptionRegistrar(bus, subscribers, observers).afterPropertiesSet();

        this.intake = new ReviewIntake(bus, store, properties);
    }

    public static Builder builder() {
        return new Builder();
    }

    public IntakeResponse submit(ReviewRequest request) {
        return intake.submit(request);
    }

    /**
     * A valid request for {@code owner/repo} whose report goes into {@code outputDir}.
     */
    public static ReviewRequest request(Path outputDir) {
        return new ReviewRequest("owner/repo", null, 2, null, null, null, "Check error handling",
                outputDir.resolve("report.json").toString());
    }

    public ReviewRecord record(String reviewId) {
        return store.find(reviewId).orElseThrow();
    }

    public List<Published> published() {
        return List.copyOf(published);
    }

    public List<String> topics() {
        return published.stream().map(Published::topic).collect(Collectors.toList());
    }

    public <T> List<T> payloads(String topic, Class<T> type) {
        return published.stream()
                .filter(p -> p.topic().equals(topic))
                .map(p -> type.cast(p.payload()))
                .collect(Collectors.toList());
    }

    public void close() {
        calls.destroy();
    }

    public static Commits sampleCommits() {
        return new Commits(
                List.of("abc1234 Add retry to upload client", "def5678 Extract upload client"),
                List.of("src/main/java/UploadClient.java", "src/main/java/Retry.java"),
                "diff --git a/src/main/java/UploadClient.java b/src/main/java/UploadClient.java\n"
                        + "+    retry(3, () -> send(request));\n"
                        + "-    send(request);\n");
    }

    public static final class Builder {
        private CommitSource commitSource = query -> sampleCommits();
        private Evaluator evaluator = (commits, prompt) ->
                new Evaluation(0.5, "Adds retries to the upload client", List.of(), "");
        private BranchGenerator branchGenerator = new HeuristicBranchGenerator();
        private Scorer scorer = new HeuristicScorer();
        private int maxIterations = 3;
        private double threshold = 0.9;
        private Duration timeout = Duration.ofSeconds(5);

        public Builder commitSource(CommitSource commitSource) {
            this.commitSource = commitSource;
            return this;
        }

        public Builder evaluator(Evaluator evaluator) {
            this.evaluator = evaluator;
            return this;
        }

        public Builder evaluationScore(double score) {
            this.evaluator = (commits, prompt) -> new Evaluation(score, "Adds retries to the upload client", List.of(), "");
            return this;
        }

        public Builder branchGenerator(BranchGenerator branchGenerator) {
            this.branchGenerator = branchGenerator;
            return this;
        }

        public Builder scorer(Scorer scorer) {
            this.scorer = scorer;
            return this;
        }

        public Builder maxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
            return this;
        }

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public ReviewHarness build() {
            return new ReviewHarness(this);
        }
    }
}
