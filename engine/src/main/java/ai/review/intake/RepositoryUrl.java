package ai.review.intake;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A parsed repository identifier.
 *
 * <p>Accepted forms:
 * <ul>
 *   <li>{@code owner/repo}, which implies {@code https://github.com}
 *   <li>{@code host/owner/repo}
 *   <li>{@code protocol://host/owner/repo}, optionally ending in {@code .git}
 *   <li>{@code file:///path/to/repo} for a repository on the local file system
 * </ul>
 *
 * @param protocol {@code https}, {@code http}, {@code ssh}, {@code git} or {@code file}
 * @param host host name, empty for {@code file}
 * @param path {@code owner/repo} for remote repositories, the directory for {@code file}
 */
public record RepositoryUrl(String protocol, String host, String path) {

    public static final String DEFAULT_PROTOCOL = "https";
    public static final String DEFAULT_HOST = "github.com";

    private static final Set<String> REMOTE_PROTOCOLS = Set.of("https", "http", "ssh", "git");
    private static final String FILE_PREFIX = "file://";

    private static final Pattern REMOTE = Pattern.compile(
            "^(?:(?<protocol>[A-Za-z][A-Za-z0-9+.-]*)://)?"
                    + "(?:(?<host>[A-Za-z0-9.-]+(?::\\d+)?)/)?"
                    + "(?<owner>[A-Za-z0-9_.-]+)/"
                    + "(?<repo>[A-Za-z0-9_.-]+?)(?:\\.git)?/?$");

    /**
     * @param repository identifier as submitted
     * @return the parsed identifier
     * @throws InvalidRepositoryException if it matches none of the accepted forms
     */
    public static RepositoryUrl parse(String repository) {
        if (repository == null || repository.isBlank()) {
            throw new InvalidRepositoryException(repository);
        }
        String trimmed = repository.trim();
        if (trimmed.regionMatches(true, 0, FILE_PREFIX, 0, FILE_PREFIX.length())) {
            String directory = trimmed.substring(FILE_PREFIX.length());
            if (directory.isEmpty()) {
                throw new InvalidRepositoryException(repository);
            }
            return new RepositoryUrl("file", "", directory);
        }

        Matcher matcher = REMOTE.matcher(trimmed);
        if (!matcher.matches()) {
            throw new InvalidRepositoryException(repository);
        }
        String protocol = matcher.group("protocol");
        String host = matcher.group("host");
        // a protocol without a host would make the owner the host
        if (protocol != null && host == null) {
            throw new InvalidRepositoryException(repository);
        }
        protocol = protocol == null ? DEFAULT_PROTOCOL : protocol.toLowerCase(Locale.ROOT);
        if (!REMOTE_PROTOCOLS.contains(protocol)) {
            throw new InvalidRepositoryException(repository);
        }
        String repo = matcher.group("repo");
        if (repo.isEmpty() || repo.equals(".") || repo.equals("..")) {
            throw new InvalidRepositoryException(repository);
        }
        return new RepositoryUrl(
                protocol,
                host == null ? DEFAULT_HOST : host.toLowerCase(Locale.ROOT),
                matcher.group("owner") + "/" + repo);
    }

    public boolean isLocal() {
        return "file".equals(protocol);
    }

    public String owner() {
        if (isLocal()) {
            return "";
        }
        return path.substring(0, path.indexOf('/'));
    }

    public String name() {
        String trimmed = path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
        int slash = trimmed.lastIndexOf('/');
        return slash < 0 ? trimmed : trimmed.substring(slash + 1);
    }

    /**
     * @return the URI handed to {@code git clone}
     */
    public String cloneUri() {
        if (isLocal()) {
            return FILE_PREFIX + path;
        }
        return protocol + "://" + host + "/" + path + ".git";
    }
}
