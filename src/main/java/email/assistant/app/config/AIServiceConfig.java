package email.assistant.app.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.theokanning.openai.service.OpenAiService;
import email.assistant.app.cache.ResponseCache;
import email.assistant.app.service.CachingLanguageModelService;
import email.assistant.app.service.CapabilityGuard;
import email.assistant.app.service.GeminiLanguageModelService;
import email.assistant.app.service.LanguageModelService;
import email.assistant.app.service.OpenAiLanguageModelService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.web.client.RestTemplate;

/**
 * Configuration to switch between language model providers.
 * Set ai.provider=gemini or ai.provider=openai in application.properties.
 * Either provider is wrapped with the response cache.
 */
@Configuration
public class AIServiceConfig {

    @Bean
    @Primary
    @ConditionalOnProperty(name = "ai.provider", havingValue = "gemini", matchIfMissing = false)
    public LanguageModelService geminiLanguageModelService(
            @Value("${gemini.api.key:}") String apiKey,
            @Value("${gemini.model:gemini-1.5-flash}") String model,
            @Value("${gemini.embedding-model:text-embedding-004}") String embeddingModel,
            CapabilityGuard capabilityGuard,
            ResponseCache responseCache) {
        GeminiLanguageModelService gemini = new GeminiLanguageModelService(
                apiKey, model, embeddingModel, new RestTemplate(), new ObjectMapper(), capabilityGuard);
        return new CachingLanguageModelService(gemini, responseCache);
    }

    @Bean
    @Primary
    @ConditionalOnProperty(name = "ai.provider", havingValue = "openai", matchIfMissing = true)
    public LanguageModelService openAiLanguageModelService(
            @Value("${openai.api.key:}") String apiKey,
            @Value("${openai.embedding-model:text-embedding-3-small}") String embeddingModel,
            AssistantProperties properties,
            CapabilityGuard capabilityGuard,
            ResponseCache responseCache) {
        OpenAiService openAiService = new OpenAiService(apiKey, properties.getCapability().getTimeout());
        return new CachingLanguageModelService(
                new OpenAiLanguageModelService(openAiService, embeddingModel, capabilityGuard), responseCache);
    }
}
