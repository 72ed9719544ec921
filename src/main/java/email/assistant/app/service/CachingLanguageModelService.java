package email.assistant.app.service;

import email.assistant.app.cache.ResponseCache;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Memoizes completions by (model, system prompt, prompt). Failed calls are not cached.
 * Embeddings pass through; they have their own per-user cache.
 */
@Slf4j
public class CachingLanguageModelService implements LanguageModelService {
    private final LanguageModelService delegate;
    private final ResponseCache responseCache;

    public CachingLanguageModelService(LanguageModelService delegate, ResponseCache responseCache) {
        this.delegate = delegate;
        this.responseCache = responseCache;
    }

    @Override
    public String complete(String systemPrompt, String prompt, String model, boolean jsonMode) {
        String key = ResponseCache.key(model, systemPrompt, prompt);
        Optional<String> cached = responseCache.get(key);
        if (cached.isPresent()) {
            log.debug("Response cache hit for model {}", model);
            return cached.get();
        }
        String response = delegate.complete(systemPrompt, prompt, model, jsonMode);
        if (response != null) {
            responseCache.put(key, response);
        }
        return response;
    }

    @Override
    public float[] embed(String text) {
        return delegate.embed(text);
    }
}
