package ai.review.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for the MCTS search.
 *
 * Defaults: 100 iterations, UCT constant sqrt(2) ~ 1.414,
 * depth cap 10, and an early exit when the initial evaluation already scores above 0.9.
 *
 * Usage:
 * {@code java -jar engine.jar --review.mcts.max-iterations=25 --review.mcts.phase-timeout=30s}
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "review.mcts")
public class MctsProperties {
  private int maxIterations = 100;
  private double explorationConstant = 1.414;
  private int maxDepth = 10;
  private double highConfidenceThreshold = 0.9;
  private Duration phaseTimeout = Duration.ofSeconds(120);

  /**
   * Returns the number of select/expand/simulate/backpropagate cycles per review.
   * @return iteration budget
   */
  public int getMaxIterations() {
    return maxIterations;
  }

  public void setMaxIterations(int maxIterations) {
    this.maxIterations = maxIterations;
  }

  /**
   * Returns the UCT exploration weight.
   * @return exploration constant {@code c}
   */
  public double getExplorationConstant() {
    return explorationConstant;
  }

  public void setExplorationConstant(double explorationConstant) {
    this.explorationConstant = explorationConstant;
  }

  /**
   * Returns the deepest level any review may expand to. A request asking for a greater depth
   * is capped at this value.
   * @return max depth
   */
  public int getMaxDepth() {
    return maxDepth;
  }

  public void setMaxDepth(int maxDepth) {
    this.maxDepth = maxDepth;
  }

  /**
   * Returns the evaluation score above which the search is skipped entirely.
   * @return threshold in [0, 1]
   */
  public double getHighConfidenceThreshold() {
    return highConfidenceThreshold;
  }

  public void setHighConfidenceThreshold(double highConfidenceThreshold) {
    this.highConfidenceThreshold = highConfidenceThreshold;
  }

  /**
   * Returns how long a single external call (commit fetch, evaluator, branch generator, scorer)
   * may take before the phase fails.
   * @return per-call timeout
   */
  public Duration getPhaseTimeout() {
    return phaseTimeout;
  }

  public void setPhaseTimeout(Duration phaseTimeout) {
    this.phaseTimeout = phaseTimeout;
  }
}
