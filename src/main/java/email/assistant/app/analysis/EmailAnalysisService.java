package email.assistant.app.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import email.assistant.app.config.AssistantProperties;
import email.assistant.app.model.ActionItem;
import email.assistant.app.model.Analysis;
import email.assistant.app.model.EmailMessage;
import email.assistant.app.model.IntentType;
import email.assistant.app.model.PriorityTier;
import email.assistant.app.model.ScoredMessage;
import email.assistant.app.service.LanguageModelService;
import email.assistant.app.service.MailboxClient;
import email.assistant.app.service.ModelJsonParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-message deep analysis. Messages are analyzed one at a time and a failure on one
 * message never stops the rest.
 */
@Slf4j
@Service
public class EmailAnalysisService {
    static final String SYSTEM_PROMPT = "You are an expert email analyst. Output valid JSON only.";
    private static final List<String> ENTITY_GROUPS = List.of("people", "organizations", "locations", "dates");

    private final LanguageModelService languageModelService;
    private final ModelJsonParser jsonParser;
    private final MessageContentService contentService;
    private final TravelDetailsExtractor travelDetailsExtractor;
    private final AssistantProperties properties;

    public EmailAnalysisService(LanguageModelService languageModelService, ModelJsonParser jsonParser,
                                MessageContentService contentService, TravelDetailsExtractor travelDetailsExtractor,
                                AssistantProperties properties) {
        this.languageModelService = languageModelService;
        this.jsonParser = jsonParser;
        this.contentService = contentService;
        this.travelDetailsExtractor = travelDetailsExtractor;
        this.properties = properties;
    }

    public List<Analysis> analyzeAll(String userId, MailboxClient mailbox, List<ScoredMessage> selected,
                                     String intent, IntentType intentType) {
        List<Analysis> analyses = new ArrayList<>();
        for (ScoredMessage scored : selected) {
            try {
                analyze(userId, mailbox, scored.getMessage(), intent, intentType).ifPresent(analyses::add);
            } catch (RuntimeException e) {
                log.error("Failed to analyze message {}: {}", scored.id(), e.getMessage(), e);
            }
        }
        log.info("Analyzed {} of {} selected messages", analyses.size(), selected.size());
        return analyses;
    }

    /**
     * @return empty when a run without a search intent finds the message irrelevant
     */
    public Optional<Analysis> analyze(String userId, MailboxClient mailbox, EmailMessage message,
                                      String intent, IntentType intentType) {
        EmailMessage loaded = contentService.withBody(userId, mailbox, message);
        String analysisText = EmailExcerpts.analysisText(loaded, loaded.getBody(), properties.getAnalysis().getMaxChars());
        boolean hasQuery = intent != null && !intent.isBlank();

        String raw = languageModelService.complete(SYSTEM_PROMPT, prompt(analysisText, intent, intentType),
                properties.getAnalysis().getModel(), true);
        Analysis analysis = jsonParser.parseObject(raw)
                .map(json -> fromJson(json, loaded.getId(), hasQuery))
                .recover(text -> {
                    log.warn("Analysis unavailable for message {}, using snippet summary", loaded.getId());
                    return fallback(loaded);
                });

        if (intentType != IntentType.SEARCH && analysis.getRelevance() != null
                && analysis.getRelevance() < properties.getAnalysis().getMinRelevance()) {
            log.debug("Skipping low relevance message {} ({})", loaded.getId(), analysis.getRelevance());
            return Optional.empty();
        }

        Analysis withTravel = analysis.toBuilder()
                .travelDetails(travelDetailsExtractor.extract(loaded, loaded.getBody()))
                .build();
        log.debug("Analyzed {}: {}", loaded.getId(), abbreviate(withTravel.getSummary(), 50));
        return Optional.of(withTravel);
    }

    private static String prompt(String analysisText, String intent, IntentType intentType) {
        boolean hasQuery = intent != null && !intent.isBlank();
        StringBuilder prompt = new StringBuilder("Analyze this email");
        if (hasQuery) {
            prompt.append(" focusing on: \"").append(intent).append('"');
        }
        prompt.append(".\n\n").append(analysisText).append("\n\n")
              .append("Return JSON with:\n")
              .append("- summary: 2-3 sentences").append(hasQuery ? " answering the query" : "").append('\n')
              .append("- answer: ").append(hasQuery ? "direct answer to the query (1-2 sentences)" : "null").append('\n')
              .append("- actions: [{description, dueDate?, priority? (high|medium|low)}]\n")
              .append("- key_facts: {key: value} for amounts, dates, IDs\n")
              .append("- structuredEntities: {people: [], organizations: [], locations: [], dates: []}\n")
              .append("- relevance: 0-10 score\n")
              .append("- urgent: true if the email needs attention within a day");
        if (intentType == IntentType.REPLY) {
            prompt.append("\n- reply_draft: a short reply the user could send");
        }
        return prompt.toString();
    }

    private static Analysis fromJson(JsonNode json, String emailId, boolean hasQuery) {
        Analysis.AnalysisBuilder builder = Analysis.builder()
                .emailId(emailId)
                .summary(json.path("summary").asText(""))
                .urgent(json.path("urgent").asBoolean(false));

        if (hasQuery && json.hasNonNull("answer")) {
            builder.answer(json.get("answer").asText());
        }
        for (JsonNode action : json.path("actions")) {
            String description = action.isTextual() ? action.asText() : action.path("description").asText("");
            if (!description.isBlank()) {
                builder.action(new ActionItem(description,
                        textOrNull(action.path("dueDate")),
                        PriorityTier.fromLabel(textOrNull(action.path("priority")))));
            }
        }
        Iterator<Map.Entry<String, JsonNode>> facts = json.path("key_facts").fields();
        while (facts.hasNext()) {
            Map.Entry<String, JsonNode> fact = facts.next();
            builder.keyFact(fact.getKey(), fact.getValue().isValueNode() ? fact.getValue().asText() : fact.getValue().toString());
        }
        JsonNode structured = json.path("structuredEntities");
        for (String group : ENTITY_GROUPS) {
            List<String> values = new ArrayList<>();
            for (JsonNode value : structured.path(group)) {
                values.add(value.asText());
            }
            if (!values.isEmpty()) {
                builder.structuredEntity(group, values);
                if ("people".equals(group) || "organizations".equals(group)) {
                    builder.entities(values);
                }
            }
        }
        if (json.path("relevance").isNumber()) {
            builder.relevance(Math.max(0.0, Math.min(10.0, json.get("relevance").asDouble())));
        }
        String draft = textOrNull(json.path("reply_draft"));
        if (draft != null && !draft.isBlank()) {
            builder.replyDraft(draft);
        }
        return builder.build();
    }

    private static Analysis fallback(EmailMessage message) {
        String summary = message.getSubject() != null && !message.getSubject().isBlank()
                ? message.getSubject() + ": " + nullToEmpty(message.getSnippet())
                : nullToEmpty(message.getSnippet());
        return Analysis.builder()
                .emailId(message.getId())
                .summary(summary.trim())
                .build();
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isMissingNode() || node.isNull() ? null : node.asText();
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    private static String abbreviate(String text, int max) {
        return text.length() > max ? text.substring(0, max) + "..." : text;
    }
}
