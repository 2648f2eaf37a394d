package ai.review.agent;

import ai.review.git.Commits;

/**
 * Produces the initial context summary and confidence score for a code change. Called once per
 * review, when the tree is created.
 */
public interface Evaluator {

    /**
     * @param commits the change under review
     * @param prompt the review requirements
     * @return the evaluation, score in [0, 1]
     */
    Evaluation evaluate(Commits commits, String prompt);
}
