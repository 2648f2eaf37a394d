package ai.review.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties describing a review submitted from the command line.
 *
 * Usage:
 * {@code java -jar engine.jar --review.request.repository=https://github.com/buger/probe.git
 * --review.request.requirements="Check error handling"}
 *
 * When no repository is given the application starts and exits without reviewing anything.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "review.request")
public class ReviewRequestProperties {
  private String repository = "";
  private String branch = "main";
  private int depth = 2;
  private String reviewStartCommit = "";
  private String reviewEndCommit = "HEAD";
  private int reviewMaxCommits = 100;
  private String requirements = "";
  private String outputPath;

  public String getRepository() {
    return repository;
  }

  public void setRepository(String repository) {
    this.repository = repository;
  }

  public String getBranch() {
    return branch;
  }

  public void setBranch(String branch) {
    this.branch = branch;
  }

  public int getDepth() {
    return depth;
  }

  public void setDepth(int depth) {
    this.depth = depth;
  }

  public String getReviewStartCommit() {
    return reviewStartCommit;
  }

  public void setReviewStartCommit(String reviewStartCommit) {
    this.reviewStartCommit = reviewStartCommit;
  }

  public String getReviewEndCommit() {
    return reviewEndCommit;
  }

  public void setReviewEndCommit(String reviewEndCommit) {
    this.reviewEndCommit = reviewEndCommit;
  }

  public int getReviewMaxCommits() {
    return reviewMaxCommits;
  }

  public void setReviewMaxCommits(int reviewMaxCommits) {
    this.reviewMaxCommits = reviewMaxCommits;
  }

  public String getRequirements() {
    return requirements;
  }

  public void setRequirements(String requirements) {
    this.requirements = requirements;
  }

  public String getOutputPath() {
    return outputPath;
  }

  public void setOutputPath(String outputPath) {
    this.outputPath = outputPath;
  }
}
