package email.assistant.app.analysis;

import com.fasterxml.jackson.databind.ObjectMapper;
import email.assistant.app.config.AssistantProperties;
import email.assistant.app.service.LanguageModelService;
import email.assistant.app.service.ModelJsonParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IntentKeywordExtractorTest {

    @Mock
    private LanguageModelService languageModelService;

    private IntentKeywordExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new IntentKeywordExtractor(languageModelService, new ModelJsonParser(new ObjectMapper()), new AssistantProperties());
    }

    @Test
    void extract_WithModelKeywords_ShouldUseThem() {
        // Given
        when(languageModelService.complete(anyString(), anyString(), eq("gpt-4o-mini"), eq(true)))
                .thenReturn("{\"goal\": \"Find the Lisbon flight\", \"keywords\": [\"lisbon\", \"from:tap\", \"lisbon\", \"\"]}");

        // When
        IntentKeywords keywords = extractor.extract("when do I fly to lisbon");

        // Then
        assertEquals("Find the Lisbon flight", keywords.getGoal());
        assertEquals(List.of("lisbon", "from:tap"), keywords.getKeywords());
    }

    @Test
    void extract_WhenModelUnavailable_ShouldTokenizeIntent() {
        // Given
        when(languageModelService.complete(anyString(), anyString(), anyString(), eq(true))).thenReturn(null);

        // When
        IntentKeywords keywords = extractor.extract("when do I fly to lisbon");

        // Then
        assertEquals("when do I fly to lisbon", keywords.getGoal());
        assertEquals(List.of("fly", "lisbon"), keywords.getKeywords());
    }
}
