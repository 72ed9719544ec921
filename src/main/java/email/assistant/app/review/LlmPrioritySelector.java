package email.assistant.app.review;

import com.fasterxml.jackson.databind.JsonNode;
import email.assistant.app.config.AssistantProperties;
import email.assistant.app.model.EmailMessage;
import email.assistant.app.model.ScoredMessage;
import email.assistant.app.service.LanguageModelService;
import email.assistant.app.service.ModelJsonParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Asks the model for {@code prioritized_ids}. When it returns too few, a keyword and
 * recency pick over all retrieved messages is merged in after the model's ids.
 */
@Slf4j
@Component
public class LlmPrioritySelector implements ProposalStrategy {
    static final String PRIORITIZER_PROMPT =
        "You are an expert email triage and prioritization assistant.\n\n" +
        "You receive the user's query and a list of emails with id, from, subject, snippet and body excerpt.\n\n" +
        "Your job:\n" +
        "1. Decide which emails are most relevant to the user's goal.\n" +
        "2. Prefer emails that clearly match the topic, entities or intent, that are upcoming or unresolved " +
        "when the user asks about future things, and that come from important senders when that matches the query.\n" +
        "3. Ignore newsletters, promotions, spam and auto-generated noise unless the query is about them.\n\n" +
        "Return a single JSON object with \"prioritized_ids\": an array of email ids ordered from most to least important. " +
        "Only include emails that genuinely help answer the request.";

    private static final List<String> GENERIC_SIGNAL_TERMS = List.of(
            "urgent", "action", "required", "follow", "up", "reply", "confirmation", "invoice", "receipt", "meeting", "deadline");
    private static final Pattern TOKEN_SPLIT = Pattern.compile("[^a-z0-9@.]+");
    private static final int BODY_EXCERPT_CHARS = 350;

    private final LanguageModelService languageModelService;
    private final ModelJsonParser jsonParser;
    private final AssistantProperties properties;
    private final Clock clock;

    public LlmPrioritySelector(LanguageModelService languageModelService, ModelJsonParser jsonParser,
                               AssistantProperties properties, Clock clock) {
        this.languageModelService = languageModelService;
        this.jsonParser = jsonParser;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public List<ScoredMessage> propose(ReviewRequest request, String feedback) {
        Map<String, ScoredMessage> byId = new LinkedHashMap<>();
        for (ScoredMessage candidate : request.getCandidates()) {
            byId.put(candidate.id(), candidate);
        }
        Set<String> candidateIds = new LinkedHashSet<>(byId.keySet());
        for (ScoredMessage message : request.fallbackPool()) {
            byId.putIfAbsent(message.id(), message);
        }

        String systemPrompt = PRIORITIZER_PROMPT;
        if (feedback != null && !feedback.isBlank()) {
            systemPrompt += "\n\nIMPORTANT: Your previous prioritization was rejected. Feedback: \"" + feedback
                    + "\". Fix this in your new selection.";
        }
        String prompt = "Query: " + (request.getIntent() != null ? request.getIntent() : "(none, triage recent mail)")
                + "\n\nEmails:\n" + describe(request.getCandidates());

        String raw = languageModelService.complete(systemPrompt, prompt, properties.getReview().getModel(), true);
        List<String> modelIds = jsonParser.parseObject(raw)
                .map(json -> knownIds(json.path("prioritized_ids"), candidateIds))
                .recover(text -> {
                    log.warn("Prioritizer output unusable, relying on heuristic pick");
                    return List.of();
                });

        Set<String> selected = new LinkedHashSet<>(modelIds);
        if (modelIds.size() < properties.getReview().getMinModelPicks()) {
            List<String> fallback = heuristicPick(request);
            selected.addAll(fallback);
            log.info("Applied heuristic fallback: model picked {}, heuristic added {}", modelIds.size(), fallback);
        }

        List<ScoredMessage> proposal = new ArrayList<>(selected.size());
        for (String id : selected) {
            proposal.add(byId.get(id));
        }
        return proposal;
    }

    private static List<String> knownIds(JsonNode ids, Set<String> candidateIds) {
        List<String> known = new ArrayList<>();
        if (ids.isArray()) {
            for (JsonNode id : ids) {
                String value = id.asText();
                if (candidateIds.contains(value) && !known.contains(value)) {
                    known.add(value);
                }
            }
        }
        return known;
    }

    /**
     * Token hits in subject, snippet and body count 3, hits in the sender count 2, plus a
     * recency boost, over every retrieved message. Messages with no hit at all are dropped.
     */
    List<String> heuristicPick(ReviewRequest request) {
        Set<String> tokens = new LinkedHashSet<>();
        collectTokens(tokens, request.getIntent());
        request.getKeywords().forEach(keyword -> collectTokens(tokens, keyword));
        request.getMustHave().forEach(keyword -> collectTokens(tokens, keyword));
        request.getNiceToHave().forEach(keyword -> collectTokens(tokens, keyword));
        tokens.addAll(GENERIC_SIGNAL_TERMS);

        List<Map.Entry<String, Integer>> scored = new ArrayList<>();
        for (ScoredMessage candidate : request.fallbackPool()) {
            EmailMessage message = candidate.getMessage();
            String haystack = (nullToEmpty(message.getSubject()) + " " + nullToEmpty(message.getSnippet()) + " "
                    + nullToEmpty(message.getBody())).toLowerCase(Locale.ROOT);
            String sender = nullToEmpty(message.getSender()).toLowerCase(Locale.ROOT);
            int hits = 0;
            int senderHits = 0;
            for (String token : tokens) {
                if (haystack.contains(token)) {
                    hits++;
                }
                if (sender.contains(token)) {
                    senderHits++;
                }
            }
            if (hits == 0 && senderHits == 0) {
                continue;
            }
            scored.add(Map.entry(candidate.id(), hits * 3 + senderHits * 2 + recencyBoost(message)));
        }
        scored.sort(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()));

        List<String> picks = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : scored) {
            if (picks.size() == properties.getReview().getFallbackPicks()) {
                break;
            }
            picks.add(entry.getKey());
        }
        return picks;
    }

    private int recencyBoost(EmailMessage message) {
        if (message.getReceivedAt() == null) {
            return 0;
        }
        Duration age = Duration.between(message.getReceivedAt(), clock.instant());
        if (age.compareTo(Duration.ofHours(24)) < 0) {
            return 2;
        }
        if (age.compareTo(Duration.ofHours(72)) < 0) {
            return 1;
        }
        return 0;
    }

    private static void collectTokens(Set<String> tokens, String text) {
        if (text == null) {
            return;
        }
        for (String token : TOKEN_SPLIT.split(text.toLowerCase(Locale.ROOT))) {
            if (token.length() > 2) {
                tokens.add(token);
            }
        }
    }

    private static String describe(List<ScoredMessage> candidates) {
        StringBuilder sb = new StringBuilder();
        for (ScoredMessage candidate : candidates) {
            EmailMessage message = candidate.getMessage();
            if (sb.length() > 0) {
                sb.append("\n---\n");
            }
            sb.append("ID: ").append(message.getId()).append('\n')
              .append("From: ").append(nullToEmpty(message.getSender())).append('\n')
              .append("Subject: ").append(nullToEmpty(message.getSubject())).append('\n')
              .append("Snippet: ").append(nullToEmpty(message.getSnippet()));
            if (message.hasBody()) {
                String body = message.getBody();
                sb.append('\n').append("Body: ").append(body.length() > BODY_EXCERPT_CHARS ? body.substring(0, BODY_EXCERPT_CHARS) : body);
            }
        }
        return sb.toString();
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
