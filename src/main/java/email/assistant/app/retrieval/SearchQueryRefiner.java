package email.assistant.app.retrieval;

import email.assistant.app.config.AssistantProperties;
import email.assistant.app.service.LanguageModelService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns a natural-language intent into a broad Gmail search expression.
 */
@Slf4j
@Component
public class SearchQueryRefiner {
    static final String SYSTEM_PROMPT = "You are a Gmail search expert. Output only the query string.";

    private final LanguageModelService languageModelService;
    private final AssistantProperties properties;

    public SearchQueryRefiner(LanguageModelService languageModelService, AssistantProperties properties) {
        this.languageModelService = languageModelService;
        this.properties = properties;
    }

    /**
     * @return the refined expression, the keyword fallback when the model is unavailable,
     *         or an empty string when there is no intent
     */
    public String refine(String intent) {
        if (intent == null || intent.isBlank()) {
            return "";
        }
        String prompt = String.format(
            "Convert this natural language query into a BROAD Gmail search query.\n" +
            "Query: \"%s\"\n\n" +
            "Rules:\n" +
            "1. Return ONLY the search string.\n" +
            "2. Use 'OR' between keywords to maximize results.\n" +
            "3. If a sender name is multi-word, use quotes (e.g. from:\"Angel Squad\").\n" +
            "4. Do NOT use 'subject:' unless the user explicitly asks for it.\n" +
            "5. If the user mentions a name, search for it as a keyword OR a sender (e.g. \"Brian\" OR from:Brian).\n" +
            "6. Example: \"emails from angel squad about investment\" -> from:\"Angel Squad\" (investment OR investing)",
            intent.trim());

        String refined = languageModelService.complete(SYSTEM_PROMPT, prompt, properties.getRetrieval().getRefineModel(), false);
        if (refined != null) {
            String cleaned = stripWrapping(refined);
            if (!cleaned.isEmpty()) {
                log.info("Refined search query: \"{}\" -> \"{}\"", intent, cleaned);
                return cleaned;
            }
        }
        String fallback = QueryExpressions.fallbackKeywords(intent);
        log.warn("Query refinement unavailable, using keyword fallback \"{}\"", fallback);
        return fallback;
    }

    private static String stripWrapping(String text) {
        String cleaned = text.trim();
        if (cleaned.startsWith("`") && cleaned.endsWith("`") && cleaned.length() > 1) {
            cleaned = cleaned.replaceAll("^`+|`+$", "").trim();
        }
        if (cleaned.length() > 1 && cleaned.startsWith("\"") && cleaned.endsWith("\"")
                && cleaned.indexOf('"', 1) == cleaned.length() - 1) {
            cleaned = cleaned.substring(1, cleaned.length() - 1).trim();
        }
        return cleaned;
    }
}
