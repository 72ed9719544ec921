package email.assistant.app.service;

/**
 * Opaque language capability. Both operations are fallible and return null instead of
 * throwing, so every caller needs a fallback path.
 */
public interface LanguageModelService {

    /**
     * Single-turn completion.
     * @param systemPrompt instructions for the model, may be null
     * @param prompt the user message
     * @param model provider model name; providers with a fixed model may ignore it
     * @param jsonMode ask for a bare JSON object
     * @return the completion text, or null if the provider was unavailable
     */
    String complete(String systemPrompt, String prompt, String model, boolean jsonMode);

    /**
     * @return the embedding vector, or null if the provider was unavailable
     */
    float[] embed(String text);
}
