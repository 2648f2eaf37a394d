package ai.review.git;

import static org.junit.jupiter.api.Assertions.*;

import ai.review.agent.CollaboratorException;
import ai.review.config.GitProperties;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.revwalk.RevCommit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Reads commits from a throwaway repository on disk.
 *
 * <p>History on {@code main}: {@code first} adds README.md and Upload.java, {@code second}
 * changes Upload.java and adds UploadTest.java, {@code third} deletes README.md.
 */
class GitCommitSourceTest {

    @TempDir
    Path repoDir;

    private Git git;
    private RevCommit first;
    private RevCommit second;
    private RevCommit third;
    private GitProperties properties;
    private GitCommitSource source;

    @BeforeEach
    void setUp() throws Exception {
        git = Git.init().setDirectory(repoDir.toFile()).setInitialBranch("main").call();
        write("README.md", "# Uploads\n");
        write("Upload.java", "class Upload {\n    void send() {}\n}\n");
        first = commit("Add upload client");
        write("Upload.java", "class Upload {\n    void send() { retry(3); }\n}\n");
        write("UploadTest.java", "class UploadTest {}\n");
        second = commit("Retry uploads");
        git.rm().addFilepattern("README.md").call();
        third = commit("Drop readme");

        properties = new GitProperties();
        properties.setWorkDir(repoDir.resolveSibling(repoDir.getFileName() + "-work").toString());
        source = new GitCommitSource(properties);
    }

    @AfterEach
    void tearDown() {
        git.close();
    }

    @Test
    void wholeHistoryIsReadNewestFirst() {
        Commits commits = source.fetch(query("main", "", "HEAD", 100));

        assertEquals(List.of(
                third.abbreviate(7).name() + " Drop readme",
                second.abbreviate(7).name() + " Retry uploads",
                first.abbreviate(7).name() + " Add upload client"), commits.messages());
        assertEquals(3, commits.count());
        // README.md was added and deleted within the range, so it does not show up
        assertEquals(List.of("Upload.java", "UploadTest.java"), commits.files().stream().sorted().toList());
        assertTrue(commits.diff().contains("+    void send() { retry(3); }"));
    }

    @Test
    void rangeExcludesTheStartCommit() {
        Commits commits = source.fetch(query("main", first.name(), "HEAD", 100));

        assertEquals(2, commits.count());
        assertEquals(List.of("README.md", "Upload.java", "UploadTest.java"), commits.files().stream().sorted().toList());
        assertTrue(commits.diff().contains("-    void send() {}"));
        assertTrue(commits.diff().contains("deleted file mode"));
    }

    @Test
    void commitCapLimitsTheDiffToTheCollectedCommits() {
        Commits commits = source.fetch(query("main", "", "HEAD", 1));

        assertEquals(List.of(third.abbreviate(7).name() + " Drop readme"), commits.messages());
        assertEquals(List.of("README.md"), commits.files());
    }

    @Test
    void commitCapNarrowsTheDiffOfABoundedRange() {
        Commits commits = source.fetch(query("main", first.name(), "HEAD", 1));

        assertEquals(List.of(third.abbreviate(7).name() + " Drop readme"), commits.messages());
        assertEquals(List.of("README.md"), commits.files(), "changes of the uncollected commit stay out of the diff");
        assertFalse(commits.diff().contains("retry(3)"));
    }

    @Test
    void explicitEndCommitIsHonoured() {
        Commits commits = source.fetch(query("main", "", second.name(), 100));

        assertEquals(2, commits.count());
        assertTrue(commits.files().contains("README.md"));
    }

    @Test
    void headFollowsTheRequestedBranch() throws Exception {
        git.branchCreate().setName("feature").call();
        git.checkout().setName("feature").call();
        write("Feature.java", "class Feature {}\n");
        RevCommit feature = commit("Add feature");
        git.checkout().setName("main").call();

        Commits commits = source.fetch(query("feature", third.name(), "HEAD", 100));

        assertEquals(List.of(feature.abbreviate(7).name() + " Add feature"), commits.messages());
        assertEquals(List.of("Feature.java"), commits.files());
    }

    @Test
    void emptyRangeYieldsNoChange() {
        Commits commits = source.fetch(query("main", third.name(), "HEAD", 100));

        assertEquals(0, commits.count());
        assertTrue(commits.files().isEmpty());
        assertEquals("", commits.diff());
    }

    @Test
    void longDiffIsTruncated() {
        properties.setMaxDiffChars(40);

        Commits commits = source.fetch(query("main", "", "HEAD", 100));

        assertTrue(commits.diff().length() < 80);
        assertTrue(commits.diff().contains("diff truncated"));
    }

    @Test
    void unknownStartCommitFails() {
        CollaboratorException error = assertThrows(CollaboratorException.class,
                () -> source.fetch(query("main", "no-such-tag", "HEAD", 100)));

        assertTrue(error.getMessage().contains("Start commit not found"));
    }

    @Test
    void directoryWithoutRepositoryFails(@TempDir Path empty) {
        assertThrows(CollaboratorException.class,
                () -> source.fetch(new CommitQuery("file://" + empty.toAbsolutePath(), "main", "", "HEAD", 100)));
    }

    private CommitQuery query(String branch, String start, String end, int maxCommits) {
        return new CommitQuery("file://" + repoDir.toAbsolutePath(), branch, start, end, maxCommits);
    }

    private void write(String name, String content) throws IOException, GitAPIException {
        Files.writeString(repoDir.resolve(name), content);
        git.add().addFilepattern(name).call();
    }

    private RevCommit commit(String message) throws GitAPIException {
        return git.commit()
                .setMessage(message)
                .setAuthor("Reviewer", "reviewer@example.com")
                .setCommitter("Reviewer", "reviewer@example.com")
                .setSign(false)
                .call();
    }
}
