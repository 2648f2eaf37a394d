package ai.review.intake;

/**
 * A review as submitted. Absent fields take their defaults: branch {@code main}, depth 2, the
 * whole history up to {@code HEAD}, at most 100 commits, no requirements, report next to the
 * working directory.
 */
public record ReviewRequest(
        String repository,
        String branch,
        Integer depth,
        String reviewStartCommit,
        String reviewEndCommit,
        Integer reviewMaxCommits,
        String requirements,
        String outputPath) {

    public static final String DEFAULT_BRANCH = "main";
    public static final int DEFAULT_DEPTH = 2;
    public static final String DEFAULT_END_COMMIT = "HEAD";
    public static final int DEFAULT_MAX_COMMITS = 100;

    public ReviewRequest {
        branch = branch == null || branch.isBlank() ? DEFAULT_BRANCH : branch;
        depth = depth == null ? DEFAULT_DEPTH : depth;
        reviewStartCommit = reviewStartCommit == null ? "" : reviewStartCommit;
        reviewEndCommit = reviewEndCommit == null || reviewEndCommit.isBlank() ? DEFAULT_END_COMMIT : reviewEndCommit;
        reviewMaxCommits = reviewMaxCommits == null ? DEFAULT_MAX_COMMITS : reviewMaxCommits;
        requirements = requirements == null ? "" : requirements;
    }

    public static ReviewRequest forRepository(String repository) {
        return new ReviewRequest(repository, null, null, null, null, null, null, null);
    }
}
