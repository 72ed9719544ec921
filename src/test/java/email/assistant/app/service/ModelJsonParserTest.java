package email.assistant.app.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ModelJsonParserTest {

    private final ModelJsonParser parser = new ModelJsonParser(new ObjectMapper());

    @Test
    void parseObject_WithFencedJson_ShouldParse() {
        // When
        ModelResponse<JsonNode> response = parser.parseObject("```json\n{\"status\": \"PASS\"}\n```");

        // Then
        assertTrue(response.isOk());
        assertEquals("PASS", response.recover(text -> null).path("status").asText());
    }

    @Test
    void parseObject_WithChatterAroundObject_ShouldExtractObject() {
        // When
        ModelResponse<JsonNode> response = parser.parseObject("Sure! Here it is: {\"ids\": [1, 2]} Hope that helps.");

        // Then
        assertTrue(response.isOk());
        assertEquals(2, response.recover(text -> null).path("ids").size());
    }

    @Test
    void parseObject_WithArrayOrText_ShouldBeMalformed() {
        // When
        ModelResponse<JsonNode> array = parser.parseObject("[1, 2, 3]");
        ModelResponse<JsonNode> text = parser.parseObject("no json here");

        // Then
        assertFalse(array.isOk());
        assertFalse(text.isOk());
        assertEquals("no json here", ((ModelResponse.Malformed<JsonNode>) text).rawText());
    }

    @Test
    void parseObject_WithNull_ShouldBeMalformed() {
        // When
        ModelResponse<String> mapped = parser.parseObject(null).map(JsonNode::toString);

        // Then
        assertFalse(mapped.isOk());
        assertEquals("fallback", mapped.recover(raw -> raw == null ? "fallback" : raw));
    }
}
