package ai.review.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for the Ollama-backed collaborators.
 *
 * Only read when the {@code ai-ollama} profile is active.
 *
 * Usage:
 * {@code java -jar engine.jar --spring.profiles.active=ai-ollama --review.ollama.model=qwen2.5-coder}
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "review.ollama")
public class OllamaProperties {
  private String baseUrl = "http://localhost:11434";
  private String model = "llama3";

  public String getBaseUrl() {
    return baseUrl;
  }

  public void setBaseUrl(String baseUrl) {
    this.baseUrl = baseUrl;
  }

  public String getModel() {
    return model;
  }

  public void setModel(String model) {
    this.model = model;
  }
}
