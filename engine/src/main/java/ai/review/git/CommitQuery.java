package ai.review.git;

/**
 * Which commits to collect for a review.
 *
 * @param repository repository identifier as submitted at intake
 * @param branch branch to review, used when {@code endCommit} is {@code HEAD}
 * @param startCommit exclusive lower bound; blank means from the first commit
 * @param endCommit inclusive upper bound, a commit id or ref name
 * @param maxCommits cap on the number of commits collected, newest first
 */
public record CommitQuery(String repository, String branch, String startCommit, String endCommit, int maxCommits) {
}
