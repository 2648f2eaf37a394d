package ai.review.events;

/**
 * Identity of a review carried unchanged on every event, so that any phase can log the review
 * id and build a {@link ReviewError} without consulting the state store.
 *
 * @param reviewId unique id assigned at intake
 * @param repository repository identifier as submitted
 * @param branch branch under review
 * @param requirements free-form review requirements (also the evaluation prompt)
 * @param outputPath where the final report should be written, may be null
 * @param commitsAnalyzed number of commits handed to the evaluator, 0 until known
 */
public record ReviewMetadata(
        String reviewId,
        String repository,
        String branch,
        String requirements,
        String outputPath,
        int commitsAnalyzed) {

    public ReviewMetadata withCommitsAnalyzed(int count) {
        return new ReviewMetadata(reviewId, repository, branch, requirements, outputPath, count);
    }
}
