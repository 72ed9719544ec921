package email.assistant.app.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Google Gemini implementation over the REST API.
 * The model is fixed by configuration; the per-call model name is ignored.
 */
@Slf4j
public class GeminiLanguageModelService implements LanguageModelService {
    private static final String GEMINI_API_BASE = "https://generativelanguage.googleapis.com/v1beta/models/";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String model;
    private final String embeddingModel;
    private final CapabilityGuard capabilityGuard;

    public GeminiLanguageModelService(String apiKey, String model, String embeddingModel,
                                      RestTemplate restTemplate, ObjectMapper objectMapper,
                                      CapabilityGuard capabilityGuard) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
        this.model = model;
        this.embeddingModel = embeddingModel;
        this.capabilityGuard = capabilityGuard;

        if (!hasApiKey()) {
            log.warn("Gemini API key not configured. Set gemini.api.key in application.properties or environment variable.");
        }
    }

    @Override
    public String complete(String systemPrompt, String prompt, String ignoredModel, boolean jsonMode) {
        if (!hasApiKey()) {
            log.warn("Gemini completion skipped, no API key");
            return null;
        }
        Map<String, Object> requestBody = new HashMap<>();
        requestBody.put("contents", List.of(Map.of("role", "user", "parts", List.of(Map.of("text", prompt)))));
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            requestBody.put("systemInstruction", Map.of("parts", List.of(Map.of("text", systemPrompt))));
        }
        Map<String, Object> generationConfig = new HashMap<>();
        generationConfig.put("temperature", jsonMode ? 0.1 : 0.3);
        if (jsonMode) {
            generationConfig.put("responseMimeType", "application/json");
        }
        requestBody.put("generationConfig", generationConfig);

        try {
            return capabilityGuard.call("gemini completion", () -> {
                JsonNode response = post(model + ":generateContent", requestBody);
                JsonNode parts = response.path("candidates").path(0).path("content").path("parts");
                if (parts.isArray() && parts.size() > 0 && parts.get(0).has("text")) {
                    return parts.get(0).get("text").asText().trim();
                }
                throw new IllegalStateException("Unexpected Gemini API response format: " + response);
            });
        } catch (QuotaException | CapabilityUnavailableException e) {
            log.warn("Gemini completion unavailable: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public float[] embed(String text) {
        if (!hasApiKey() || text == null || text.isBlank()) {
            return null;
        }
        Map<String, Object> requestBody = new HashMap<>();
        requestBody.put("model", "models/" + embeddingModel);
        requestBody.put("content", Map.of("parts", List.of(Map.of("text", text))));

        try {
            return capabilityGuard.call("gemini embedding", () -> {
                JsonNode values = post(embeddingModel + ":embedContent", requestBody).path("embedding").path("values");
                if (!values.isArray() || values.size() == 0) {
                    throw new IllegalStateException("Gemini embedding response had no values");
                }
                float[] vector = new float[values.size()];
                for (int i = 0; i < vector.length; i++) {
                    vector[i] = (float) values.get(i).asDouble();
                }
                return vector;
            });
        } catch (QuotaException | CapabilityUnavailableException e) {
            log.warn("Gemini embedding unavailable: {}", e.getMessage());
            return null;
        }
    }

    private JsonNode post(String method, Map<String, Object> requestBody) {
        try {
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);
            HttpEntity<Map<String, Object>> request = new HttpEntity<>(requestBody, headers);

            String url = GEMINI_API_BASE + method + "?key=" + apiKey;
            ResponseEntity<String> response = restTemplate.postForEntity(url, request, String.class);
            if (response.getStatusCode().is2xxSuccessful() && response.getBody() != null) {
                return objectMapper.readTree(response.getBody());
            }
            throw new IllegalStateException("Gemini API error: " + response.getStatusCode() + " - " + response.getBody());
        } catch (Exception e) {
            throw handleError(e, method);
        }
    }

    private RuntimeException handleError(Exception e, String operation) {
        String errorMessage = e.getMessage() != null ? e.getMessage().toLowerCase() : "";

        // Check for quota/rate limit errors (429, 403 with quota message)
        if (errorMessage.contains("quota") ||
            errorMessage.contains("rate limit") ||
            errorMessage.contains("429") ||
            errorMessage.contains("resource exhausted")) {
            return new QuotaException("Gemini quota/rate limit exceeded during " + operation + ": " + e.getMessage(), e);
        }

        if (e instanceof RuntimeException) {
            return (RuntimeException) e;
        }
        return new IllegalStateException("Gemini API error during " + operation + ": " + e.getMessage(), e);
    }

    private boolean hasApiKey() {
        return apiKey != null && !apiKey.isEmpty() && !apiKey.startsWith("${");
    }
}
