package ai.review.git;

import ai.review.agent.CollaboratorException;
import ai.review.config.GitProperties;
import ai.review.intake.RepositoryUrl;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.LogCommand;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.diff.DiffEntry;
import org.eclipse.jgit.diff.DiffFormatter;
import org.eclipse.jgit.diff.RawTextComparator;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.ObjectReader;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.treewalk.AbstractTreeIterator;
import org.eclipse.jgit.treewalk.CanonicalTreeParser;
import org.eclipse.jgit.treewalk.EmptyTreeIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

/**
 * JGit-backed {@link CommitSource}.
 *
 * <p>{@code file://} repositories are opened in place. Anything else is cloned into a fresh
 * directory under {@code review.git.work-dir}, which is deleted once the commits are read.
 *
 * <p>The range is {@code startCommit..endCommit} in git terms: commits reachable from the end
 * but not from the start, newest first, capped at {@code maxCommits}. The diff spans from the
 * start commit to the end. When there is no start commit, or the cap cut the range short, it
 * starts at the parent of the oldest collected commit (or the empty tree) instead, so that the
 * diff and the commit messages describe the same commits.
 */
@Component
public class GitCommitSource implements CommitSource {

    private static final Logger log = LoggerFactory.getLogger(GitCommitSource.class);

    private static final String TRUNCATION_MARKER = "\n... diff truncated ...\n";

    private final GitProperties properties;

    public GitCommitSource(GitProperties properties) {
        this.properties = properties;
    }

    @Override
    public Commits fetch(CommitQuery query) {
        RepositoryUrl url = RepositoryUrl.parse(query.repository());
        if (url.isLocal()) {
            try (Git git = Git.open(new File(url.path()))) {
                return read(git.getRepository(), query);
            } catch (IOException e) {
                throw new CollaboratorException("Cannot read repository " + url.path() + ": " + e.getMessage(), e);
            }
        }

        Path cloneDir = null;
        try {
            Path workDir = Paths.get(properties.getWorkDir());
            Files.createDirectories(workDir);
            cloneDir = Files.createTempDirectory(workDir, "review-" + url.name() + "-");
            long startNanos = System.nanoTime();
            try (Git git = Git.cloneRepository()
                    .setURI(url.cloneUri())
                    .setDirectory(cloneDir.toFile())
                    .setBranch(query.branch())
                    .call()) {
                log.info("Cloned {} into {} in {} ms", url.cloneUri(), cloneDir, (System.nanoTime() - startNanos) / 1_000_000L);
                return read(git.getRepository(), query);
            }
        } catch (GitAPIException | IOException e) {
            throw new CollaboratorException("Cannot clone " + url.cloneUri() + ": " + e.getMessage(), e);
        } finally {
            if (cloneDir != null) {
                deleteQuietly(cloneDir);
            }
        }
    }

    Commits read(Repository repository, CommitQuery query) throws IOException {
        ObjectId end = resolveEnd(repository, query);
        ObjectId start = null;
        if (query.startCommit() != null && !query.startCommit().isBlank()) {
            start = repository.resolve(query.startCommit());
            if (start == null) {
                throw new CollaboratorException("Start commit not found: " + query.startCommit());
            }
        }

        List<RevCommit> commits = new ArrayList<>();
        try (Git git = new Git(repository)) {
            LogCommand logCommand = git.log().add(end).setMaxCount(Math.max(query.maxCommits(), 0));
            if (start != null) {
                logCommand.not(start);
            }
            for (RevCommit commit : logCommand.call()) {
                commits.add(commit);
            }
        } catch (GitAPIException e) {
            throw new CollaboratorException("Cannot read history: " + e.getMessage(), e);
        }

        List<String> messages = new ArrayList<>();
        for (RevCommit commit : commits) {
            messages.add(commit.abbreviate(7).name() + " " + commit.getShortMessage());
        }
        if (commits.isEmpty()) {
            log.info("No commits between {} and {}", query.startCommit(), query.endCommit());
            return new Commits(messages, List.of(), "");
        }

        RevCommit oldest = commits.get(commits.size() - 1);
        try (RevWalk walk = new RevWalk(repository);
             ObjectReader reader = repository.newObjectReader()) {
            RevCommit newest = walk.parseCommit(end);
            AbstractTreeIterator oldTree;
            boolean capped = commits.size() >= query.maxCommits();
            if (start != null && !capped) {
                oldTree = new CanonicalTreeParser(null, reader, walk.parseCommit(start).getTree());
            } else {
                RevCommit parsedOldest = walk.parseCommit(oldest);
                oldTree = parsedOldest.getParentCount() > 0
                        ? new CanonicalTreeParser(null, reader, walk.parseCommit(parsedOldest.getParent(0)).getTree())
                        : new EmptyTreeIterator();
            }
            AbstractTreeIterator newTree = new CanonicalTreeParser(null, reader, newest.getTree());
            return diff(repository, oldTree, newTree, messages);
        }
    }

    private Commits diff(
            Repository repository,
            AbstractTreeIterator oldTree,
            AbstractTreeIterator newTree,
            List<String> messages) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        Set<String> files = new LinkedHashSet<>();
        try (DiffFormatter formatter = new DiffFormatter(out)) {
            formatter.setRepository(repository);
            formatter.setDiffComparator(RawTextComparator.DEFAULT);
            formatter.setDetectRenames(true);
            List<DiffEntry> entries = formatter.scan(oldTree, newTree);
            for (DiffEntry entry : entries) {
                files.add(entry.getChangeType() == DiffEntry.ChangeType.DELETE ? entry.getOldPath() : entry.getNewPath());
            }
            formatter.format(entries);
        }
        String diff = out.toString(StandardCharsets.UTF_8);
        int limit = properties.getMaxDiffChars();
        if (limit > 0 && diff.length() > limit) {
            log.warn("Diff of {} chars truncated to {}", diff.length(), limit);
            diff = diff.substring(0, limit) + TRUNCATION_MARKER;
        }
        if (log.isDebugEnabled()) {
            log.debug("Collected {} commits touching {} files", messages.size(), files.size());
        }
        return new Commits(messages, new ArrayList<>(files), diff);
    }

    private ObjectId resolveEnd(Repository repository, CommitQuery query) throws IOException {
        String end = query.endCommit() == null || query.endCommit().isBlank() ? "HEAD" : query.endCommit();
        if ("HEAD".equals(end) && query.branch() != null && !query.branch().isBlank()) {
            for (String candidate : List.of("refs/heads/" + query.branch(), "refs/remotes/origin/" + query.branch())) {
                ObjectId id = repository.resolve(candidate);
                if (id != null) {
                    return id;
                }
            }
        }
        ObjectId id = repository.resolve(end);
        if (id == null) {
            throw new CollaboratorException("End commit not found: " + end);
        }
        return id;
    }

    private void deleteQuietly(Path directory) {
        try {
            FileSystemUtils.deleteRecursively(directory);
        } catch (IOException e) {
            log.warn("Could not delete clone directory {}: {}", directory, e.toString());
        }
    }
}
