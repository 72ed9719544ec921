package email.assistant.app.service;

import com.theokanning.openai.OpenAiHttpException;
import com.theokanning.openai.completion.chat.ChatCompletionRequest;
import com.theokanning.openai.completion.chat.ChatMessage;
import com.theokanning.openai.completion.chat.ChatMessageRole;
import com.theokanning.openai.embedding.EmbeddingRequest;
import com.theokanning.openai.service.OpenAiService;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

@Slf4j
public class OpenAiLanguageModelService implements LanguageModelService {
    static final String JSON_ONLY_INSTRUCTION = "Respond with a single valid JSON object and nothing else.";

    private final OpenAiService openAiService;
    private final String embeddingModel;
    private final CapabilityGuard capabilityGuard;

    public OpenAiLanguageModelService(OpenAiService openAiService, String embeddingModel, CapabilityGuard capabilityGuard) {
        this.openAiService = openAiService;
        this.embeddingModel = embeddingModel;
        this.capabilityGuard = capabilityGuard;
    }

    @Override
    public String complete(String systemPrompt, String prompt, String model, boolean jsonMode) {
        List<ChatMessage> messages = new ArrayList<>();
        String system = systemPrompt;
        if (jsonMode) {
            system = system == null || system.isBlank() ? JSON_ONLY_INSTRUCTION : system + "\n\n" + JSON_ONLY_INSTRUCTION;
        }
        if (system != null && !system.isBlank()) {
            messages.add(new ChatMessage(ChatMessageRole.SYSTEM.value(), system));
        }
        messages.add(new ChatMessage(ChatMessageRole.USER.value(), prompt));

        ChatCompletionRequest request = ChatCompletionRequest.builder()
            .model(model)
            .messages(messages)
            .temperature(jsonMode ? 0.1 : 0.3)
            .build();

        try {
            return capabilityGuard.call("openai completion", () -> {
                try {
                    String content = openAiService.createChatCompletion(request)
                        .getChoices().get(0).getMessage().getContent();
                    return content != null ? content.trim() : null;
                } catch (Exception e) {
                    throw handleOpenAIError(e, "completion");
                }
            });
        } catch (QuotaException | CapabilityUnavailableException e) {
            log.warn("OpenAI completion unavailable for model {}: {}", model, e.getMessage());
            return null;
        }
    }

    @Override
    public float[] embed(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        EmbeddingRequest request = EmbeddingRequest.builder()
            .model(embeddingModel)
            .input(List.of(text))
            .build();
        try {
            List<Double> values = capabilityGuard.call("openai embedding", () -> {
                try {
                    return openAiService.createEmbeddings(request).getData().get(0).getEmbedding();
                } catch (Exception e) {
                    throw handleOpenAIError(e, "embedding");
                }
            });
            return toFloats(values);
        } catch (QuotaException | CapabilityUnavailableException e) {
            log.warn("OpenAI embedding unavailable: {}", e.getMessage());
            return null;
        }
    }

    static float[] toFloats(List<Double> values) {
        if (values == null || values.isEmpty()) {
            return null;
        }
        float[] vector = new float[values.size()];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = values.get(i).floatValue();
        }
        return vector;
    }

    private RuntimeException handleOpenAIError(Exception e, String operation) {
        String errorMessage = e.getMessage() != null ? e.getMessage().toLowerCase() : "";

        // Check for quota exceeded or rate limit errors
        boolean rateLimited = e instanceof OpenAiHttpException && ((OpenAiHttpException) e).statusCode == 429;
        if (rateLimited ||
            errorMessage.contains("quota") ||
            errorMessage.contains("rate limit") ||
            (e.getCause() != null && e.getCause().getMessage() != null &&
             e.getCause().getMessage().toLowerCase().contains("429"))) {
            return new QuotaException("OpenAI quota/rate limit exceeded during " + operation + ": " + e.getMessage(), e);
        }

        if (e instanceof RuntimeException) {
            return (RuntimeException) e;
        }
        return new RuntimeException("OpenAI API error during " + operation + ": " + e.getMessage(), e);
    }
}
