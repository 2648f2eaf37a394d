package ai.review.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for fetching commits.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "review.git")
public class GitProperties {
  private String workDir = System.getProperty("java.io.tmpdir");
  private int maxDiffChars = 200_000;

  /**
   * Returns the directory under which remote repositories are cloned.
   * @return clone root directory
   */
  public String getWorkDir() {
    return workDir;
  }

  public void setWorkDir(String workDir) {
    this.workDir = workDir;
  }

  /**
   * Returns the cap on diff text handed to the evaluator; longer diffs are truncated.
   * @return maximum diff length in characters
   */
  public int getMaxDiffChars() {
    return maxDiffChars;
  }

  public void setMaxDiffChars(int maxDiffChars) {
    this.maxDiffChars = maxDiffChars;
  }
}
