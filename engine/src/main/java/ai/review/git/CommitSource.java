package ai.review.git;

/**
 * Supplies the change under review. Implementations may block on network or disk; callers run
 * them through {@link ai.review.agent.ExternalCalls}.
 */
public interface CommitSource {

    /**
     * @param query range and repository to read
     * @return commit messages, touched files and the diff of the range
     */
    Commits fetch(CommitQuery query);
}
