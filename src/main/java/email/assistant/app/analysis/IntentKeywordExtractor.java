package email.assistant.app.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import email.assistant.app.config.AssistantProperties;
import email.assistant.app.retrieval.QueryExpressions;
import email.assistant.app.service.LanguageModelService;
import email.assistant.app.service.ModelJsonParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives a goal sentence and search keywords from an intent when the caller supplied none.
 */
@Slf4j
@Component
public class IntentKeywordExtractor {
    static final String CONTEXT_PROMPT =
        "You interpret a user's natural language request about their email.\n" +
        "Return a single JSON object with:\n" +
        "- \"goal\": a short sentence describing what the user ultimately wants.\n" +
        "- \"keywords\": an array of strings with important phrases (project names, people, companies), " +
        "obvious search filters (e.g. \"from:airline\", \"newer_than:7d\") and related terms that help find the right emails.\n" +
        "Do not invent specific data such as exact dates. Convert relative times like \"last week\" to filters like \"newer_than:7d\".";

    private final LanguageModelService languageModelService;
    private final ModelJsonParser jsonParser;
    private final AssistantProperties properties;

    public IntentKeywordExtractor(LanguageModelService languageModelService, ModelJsonParser jsonParser,
                                  AssistantProperties properties) {
        this.languageModelService = languageModelService;
        this.jsonParser = jsonParser;
        this.properties = properties;
    }

    public IntentKeywords extract(String intent) {
        String raw = languageModelService.complete(CONTEXT_PROMPT, "User query:\n\"" + intent + "\"",
                properties.getAnalysis().getContextModel(), true);
        IntentKeywords extracted = jsonParser.parseObject(raw)
                .map(json -> fromJson(json, intent))
                .recover(text -> fallback(intent));
        log.info("Intent keywords for \"{}\": {}", intent, extracted.getKeywords());
        return extracted;
    }

    private static IntentKeywords fromJson(JsonNode json, String intent) {
        List<String> keywords = new ArrayList<>();
        for (JsonNode keyword : json.path("keywords")) {
            String value = keyword.asText("").trim();
            if (!value.isEmpty() && !keywords.contains(value)) {
                keywords.add(value);
            }
        }
        if (keywords.isEmpty()) {
            return fallback(intent);
        }
        String goal = json.path("goal").asText("").trim();
        return new IntentKeywords(goal.isEmpty() ? intent : goal, keywords);
    }

    private static IntentKeywords fallback(String intent) {
        return new IntentKeywords(intent, QueryExpressions.tokenize(intent));
    }
}
