package ai.review.events;

/**
 * Event topics connecting the review phases. Each phase subscribes to exactly one topic and
 * emits the next, so the order of phases is fixed by the topics alone.
 */
public final class Topics {

    private Topics() {}

    public static final String REVIEW_REQUESTED = "review.requested";
    public static final String ITERATION_STARTED = "mcts.iteration.started";
    public static final String NODE_SELECTED = "mcts.node.selected";
    public static final String NODE_EXPANDED = "mcts.node.expanded";
    public static final String SIMULATION_COMPLETED = "mcts.simulation.completed";
    public static final String BACKPROPAGATION_COMPLETED = "mcts.backpropagation.completed";
    public static final String ITERATIONS_COMPLETED = "mcts.iterations.completed";
    public static final String REASONING_COMPLETED = "code-review.reasoning.completed";
    public static final String REPORT_GENERATED = "code-review.report.generated";
    public static final String REVIEW_ERROR = "review.error";
}
