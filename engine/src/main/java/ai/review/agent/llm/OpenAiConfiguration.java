package ai.review.agent.llm;

import ai.review.config.OpenAiProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

/**
 * Chat client for the model-backed collaborators under {@code ai-openai}.
 */
@Configuration
@Profile("ai-openai")
public class OpenAiConfiguration {

    private static final Logger log = LoggerFactory.getLogger(OpenAiConfiguration.class);

    @Bean
    public ChatClient reviewChatClient(OpenAiProperties properties) {
        log.info("Using OpenAI model {}", properties.getModel());
        return buildChatClient(resolveApiKey(properties.getApiKey()), properties.getModel());
    }

    static String resolveApiKey(String propertyValue) {
        if (propertyValue != null && !propertyValue.isBlank()) {
            return propertyValue.trim();
        }
        String env = System.getenv("OPENAI_API_KEY");
        if (env != null && !env.isBlank()) {
            return env.trim();
        }
        throw new IllegalStateException(
                "OpenAI API key must be set via 'review.openai.api-key' property or OPENAI_API_KEY environment variable.");
    }

    public static ChatClient buildChatClient(String apiKey, String modelName) {
        OpenAiApi api = OpenAiApi.builder()
                .apiKey(apiKey)
                .build();
        OpenAiChatModel model = OpenAiChatModel.builder()
                .openAiApi(api)
                .defaultOptions(OpenAiChatOptions.builder()
                        .model(modelName)
                        .build())
                .build();
        return ChatClient.builder(model).build();
    }
}
