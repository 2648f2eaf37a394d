package ai.review.state;

import ai.review.agent.Evaluation;
import ai.review.events.ReviewError;
import ai.review.tree.ReviewTree;
import java.time.Instant;

/**
 * Snapshot of one review's progress. Immutable; the store replaces it on every transition.
 *
 * @param reviewId the review
 * @param status lifecycle status
 * @param lastPhase topic of the last event seen for the review
 * @param currentIteration completed search iterations
 * @param tree last tree snapshot seen, null before the tree exists
 * @param evaluation initial evaluation, null until the controller has run
 * @param error the failure, null unless {@link ReviewStatus#FAILED}
 * @param reportPath where the report was written, null until {@link ReviewStatus#COMPLETED}
 * @param updatedAt time of the last transition
 */
public record ReviewRecord(
        String reviewId,
        ReviewStatus status,
        String lastPhase,
        int currentIteration,
        ReviewTree tree,
        Evaluation evaluation,
        ReviewError error,
        String reportPath,
        Instant updatedAt) {

    public static ReviewRecord pending(String reviewId) {
        return new ReviewRecord(reviewId, ReviewStatus.PENDING, null, 0, null, null, null, null, Instant.now());
    }

    public ReviewRecord withProgress(ReviewStatus newStatus, String phase, int iteration, ReviewTree snapshot) {
        return new ReviewRecord(reviewId, newStatus, phase, iteration,
                snapshot != null ? snapshot : tree, evaluation, error, reportPath, Instant.now());
    }

    public ReviewRecord withEvaluation(Evaluation newEvaluation) {
        return new ReviewRecord(reviewId, status, lastPhase, currentIteration, tree, newEvaluation, error, reportPath, Instant.now());
    }

    public ReviewRecord failed(ReviewError failure) {
        return new ReviewRecord(reviewId, ReviewStatus.FAILED, failure.phase(), currentIteration, tree, evaluation,
                failure, reportPath, Instant.now());
    }

    public ReviewRecord reported(String phase, String path) {
        return new ReviewRecord(reviewId, ReviewStatus.COMPLETED, phase, currentIteration, tree, evaluation, error,
                path, Instant.now());
    }
}
