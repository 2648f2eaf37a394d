package ai.review.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for the OpenAI-backed collaborators.
 *
 * Only read when the {@code ai-openai} profile is active. The API key falls back to the
 * {@code OPENAI_API_KEY} environment variable.
 *
 * Usage:
 * {@code java -jar engine.jar --spring.profiles.active=ai-openai --review.openai.model=gpt-4o-mini}
 */
@Component
@ConfigurationProperties(prefix = "review.openai")
public class OpenAiProperties {
  private String apiKey = "";
  private String model = "gpt-4o-mini";

  public String getApiKey() {
    return apiKey;
  }

  public void setApiKey(String apiKey) {
    this.apiKey = apiKey;
  }

  public String getModel() {
    return model;
  }

  public void setModel(String model) {
    this.model = model;
  }
}
