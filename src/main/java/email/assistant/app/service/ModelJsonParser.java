package email.assistant.app.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Parses model replies into JSON objects. Tolerates markdown code fences and chatter
 * around a single object.
 */
@Slf4j
@Component
public class ModelJsonParser {
    private final ObjectMapper objectMapper;

    public ModelJsonParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ModelResponse<JsonNode> parseObject(String raw) {
        if (raw == null || raw.isBlank()) {
            return ModelResponse.malformed(raw);
        }
        String text = stripFences(raw.trim());
        JsonNode node = readQuietly(text);
        if (node == null) {
            int start = text.indexOf('{');
            int end = text.lastIndexOf('}');
            if (start >= 0 && end > start) {
                node = readQuietly(text.substring(start, end + 1));
            }
        }
        if (node == null || !node.isObject()) {
            log.warn("Model reply was not a JSON object: {}", abbreviate(raw));
            return ModelResponse.malformed(raw);
        }
        return ModelResponse.ok(node);
    }

    private JsonNode readQuietly(String text) {
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            log.debug("JSON parse failed: {}", e.getOriginalMessage());
            return null;
        }
    }

    static String stripFences(String text) {
        if (!text.startsWith("```")) {
            return text;
        }
        int firstNewline = text.indexOf('\n');
        String body = firstNewline >= 0 ? text.substring(firstNewline + 1) : text.substring(3);
        if (body.endsWith("```")) {
            body = body.substring(0, body.length() - 3);
        }
        return body.trim();
    }

    private static String abbreviate(String raw) {
        return raw.length() > 200 ? raw.substring(0, 200) + "..." : raw;
    }
}
