package ai.review.agent.llm;

import ai.review.config.OllamaProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.ollama.OllamaChatModel;
import org.springframework.ai.ollama.api.OllamaApi;
import org.springframework.ai.ollama.api.OllamaChatOptions;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

/**
 * Chat client for the model-backed collaborators under {@code ai-ollama}. Requires a reachable Ollama server with
 * the configured model pulled.
 */
@Configuration
@Profile("ai-ollama")
public class OllamaConfiguration {

    private static final Logger log = LoggerFactory.getLogger(OllamaConfiguration.class);

    @Bean
    public ChatClient reviewChatClient(OllamaProperties properties) {
        log.info("Using Ollama model {} at {}", properties.getModel(), properties.getBaseUrl());
        return buildChatClient(properties.getBaseUrl(), properties.getModel());
    }

    public static ChatClient buildChatClient(String baseUrl, String modelName) {
        OllamaApi api = OllamaApi.builder()
                .baseUrl(baseUrl)
                .build();
        OllamaChatModel model = OllamaChatModel.builder()
                .ollamaApi(api)
                .defaultOptions(OllamaChatOptions.builder()
                        .model(modelName)
                        .build())
                .build();
        return ChatClient.builder(model).build();
    }
}
