package ai.review.mcts;

import ai.review.agent.CollaboratorException;
import ai.review.agent.Evaluation;
import ai.review.agent.Evaluator;
import ai.review.agent.ExternalCalls;
import ai.review.config.MctsProperties;
import ai.review.events.ReviewEventBus;
import ai.review.events.ReviewMetadata;
import ai.review.events.ReviewRequested;
import ai.review.events.SearchEvents.BackpropagationCompleted;
import ai.review.events.SearchEvents.IterationStarted;
import ai.review.events.SearchEvents.IterationsCompleted;
import ai.review.events.Topics;
import ai.review.git.CommitQuery;
import ai.review.git.CommitSource;
import ai.review.git.Commits;
import ai.review.state.ReviewStateStore;
import ai.review.tree.IterationContext;
import ai.review.tree.ReviewTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Drives the search loop of a review.
 *
 * <p>On {@code review.requested} it fetches the change, has it evaluated and plants the root
 * ({@code visits = 1}, {@code value = 0}, state = evaluation summary). A confident evaluation or
 * an empty iteration budget ends the review straight away; otherwise the first iteration starts.
 *
 * <p>On {@code mcts.backpropagation.completed} it either starts the next iteration or ends the
 * search. Iterations are chained through the bus, so only one is ever in flight per review.
 */
@Component
public class MctsController extends PhaseSupport {

    private static final Logger log = LoggerFactory.getLogger(MctsController.class);

    /** What the controller did with a finished iteration. */
    public enum Decision {
        CONTINUE,
        TERMINATE
    }

    private final CommitSource commitSource;
    private final Evaluator evaluator;
    private final ExternalCalls calls;
    private final ReviewStateStore store;
    private final MctsProperties properties;

    public MctsController(
            ReviewEventBus bus,
            CommitSource commitSource,
            Evaluator evaluator,
            ExternalCalls calls,
            ReviewStateStore store,
            MctsProperties properties) {
        super(bus, "controller");
        this.commitSource = commitSource;
        this.evaluator = evaluator;
        this.calls = calls;
        this.store = store;
        this.properties = properties;
    }

    /**
     * Builds the initial tree for a request and starts or skips the search.
     *
     * @return the new tree, or the failure that was reported as {@code review.error}
     */
    public PhaseResult<ReviewTree> start(ReviewRequested request) {
        long startNanos = System.nanoTime();
        PhaseResult<Bootstrap> result = attempt(() -> bootstrap(request));
        if (!result.isSuccess()) {
            fail(request.meta(), result.error());
            return PhaseResult.failure(result.error());
        }

        Bootstrap bootstrap = result.value();
        IterationContext context = new IterationContext(
                request.maxIterations(), 0, request.explorationConstant(), request.maxDepth());
        double score = bootstrap.evaluation().score();
        log.info("[{}] Evaluated {} commits in {} ms, score {}",
                request.reviewId(), bootstrap.meta().commitsAnalyzed(),
                (System.nanoTime() - startNanos) / 1_000_000L, String.format("%.3f", score));

        if (score > properties.getHighConfidenceThreshold() || context.maxIterations() == 0) {
            log.info("[{}] Skipping search (score {}, budget {})",
                    request.reviewId(), String.format("%.3f", score), context.maxIterations());
            bus.publish(Topics.ITERATIONS_COMPLETED, new IterationsCompleted(bootstrap.meta(), bootstrap.tree(), context));
        } else {
            bus.publish(Topics.ITERATION_STARTED,
                    new IterationStarted(bootstrap.meta(), bootstrap.tree(), context, bootstrap.tree().getRootId()));
        }
        return PhaseResult.success(bootstrap.tree());
    }

    /**
     * Continues or ends the search after an iteration.
     */
    public Decision onBackpropagationCompleted(BackpropagationCompleted event) {
        IterationContext context = event.context();
        if (event.complete() || context.budgetExhausted()) {
            log.info("[{}] Search finished after {} iterations ({} nodes)",
                    event.reviewId(), context.currentIteration(), event.tree().size());
            bus.publish(Topics.ITERATIONS_COMPLETED, new IterationsCompleted(event.meta(), event.tree(), context));
            return Decision.TERMINATE;
        }
        if (log.isDebugEnabled()) {
            log.debug("[{}] Starting iteration {}", event.reviewId(), context.currentIteration() + 1);
        }
        bus.publish(Topics.ITERATION_STARTED,
                new IterationStarted(event.meta(), event.tree(), context, event.tree().getRootId()));
        return Decision.CONTINUE;
    }

    private Bootstrap bootstrap(ReviewRequested request) {
        ReviewMetadata meta = request.meta();
        CommitQuery query = new CommitQuery(
                meta.repository(),
                meta.branch(),
                request.reviewStartCommit(),
                request.reviewEndCommit(),
                request.reviewMaxCommits());
        Commits commits = calls.call("commit source", () -> commitSource.fetch(query));
        Evaluation evaluation = calls.call("evaluator", () -> evaluator.evaluate(commits, request.prompt()));
        if (evaluation == null || Double.isNaN(evaluation.score()) || Double.isInfinite(evaluation.score())) {
            throw new CollaboratorException("evaluator returned no usable score");
        }
        store.update(meta.reviewId(), current -> current.withEvaluation(evaluation));
        return new Bootstrap(meta.withCommitsAnalyzed(commits.count()), ReviewTree.withRoot(evaluation.summary()), evaluation);
    }

    private record Bootstrap(ReviewMetadata meta, ReviewTree tree, Evaluation evaluation) {
    }
}
