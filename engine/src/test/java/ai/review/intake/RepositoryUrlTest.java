package ai.review.intake;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class RepositoryUrlTest {

    @Test
    void ownerAndRepoImplyGithub() {
        RepositoryUrl url = RepositoryUrl.parse("buger/probe");

        assertEquals("https", url.protocol());
        assertEquals("github.com", url.host());
        assertEquals("buger", url.owner());
        assertEquals("probe", url.name());
        assertEquals("https://github.com/buger/probe.git", url.cloneUri());
        assertFalse(url.isLocal());
    }

    @Test
    void hostWithoutProtocolDefaultsToHttps() {
        RepositoryUrl url = RepositoryUrl.parse("gitlab.com/group/project");

        assertEquals("https", url.protocol());
        assertEquals("gitlab.com", url.host());
        assertEquals("group/project", url.path());
    }

    @Test
    void fullUrlWithGitSuffix() {
        RepositoryUrl url = RepositoryUrl.parse("https://github.com/buger/probe.git");

        assertEquals("probe", url.name());
        assertEquals("https://github.com/buger/probe.git", url.cloneUri());
    }

    @Test
    void hostWithPortIsKept() {
        RepositoryUrl url = RepositoryUrl.parse("http://git.internal:8080/team/service");

        assertEquals("http", url.protocol());
        assertEquals("git.internal:8080", url.host());
        assertEquals("http://git.internal:8080/team/service.git", url.cloneUri());
    }

    @Test
    void fileUrlPointsAtLocalDirectory() {
        RepositoryUrl url = RepositoryUrl.parse("file:///tmp/work/repo");

        assertTrue(url.isLocal());
        assertEquals("/tmp/work/repo", url.path());
        assertEquals("repo", url.name());
        assertEquals("file:///tmp/work/repo", url.cloneUri());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "probe", "a/b/c/d", "https://owner/repo", "ftp://github.com/a/b", "file://", "owner/.."})
    void malformedIdentifiersAreRejected(String repository) {
        assertThrows(InvalidRepositoryException.class, () -> RepositoryUrl.parse(repository));
    }

    @Test
    void nullIsRejected() {
        assertThrows(InvalidRepositoryException.class, () -> RepositoryUrl.parse(null));
    }
}
