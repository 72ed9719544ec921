package email.assistant.app.cache;

import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Memoized model responses. Entries past their time-to-live behave as absent.
 */
public interface ResponseCache {

    Optional<String> get(String key);

    void put(String key, String response);

    long size();

    static String key(String model, String systemPrompt, String prompt) {
        String raw = model + ":" + (systemPrompt != null ? systemPrompt : "") + ":" + prompt;
        return DigestUtils.md5DigestAsHex(raw.getBytes(StandardCharsets.UTF_8));
    }
}
