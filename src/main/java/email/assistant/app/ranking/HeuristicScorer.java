package email.assistant.app.ranking;

import email.assistant.app.model.ContextSignals;
import email.assistant.app.model.EmailMessage;
import email.assistant.app.model.ScoredMessage;
import email.assistant.app.model.UserPreferences;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Additive rule-based score. Every signal only ever adds, so strengthening one never
 * lowers the result.
 */
@Component
public class HeuristicScorer {
    static final int VIP_SENDER = 3;
    static final int URGENT_SUBJECT = 2;
    static final int RECENT = 1;
    static final int FLAGGED_LABEL = 4;
    static final int INTENT_IN_SENDER = 2;
    static final int INTENT_IN_SUBJECT = 2;
    static final int STRONG_GOAL = 4;
    static final int WEAK_GOAL = 2;
    static final int ENGAGED_SENDER = 3;

    private static final Duration RECENT_WINDOW = Duration.ofHours(12);
    private static final Set<String> FLAGGED_LABELS = Set.of("IMPORTANT", "STARRED");
    private static final Set<String> INTENT_STOP_WORDS = Set.of(
            "the", "and", "for", "from", "with", "that", "this", "your", "you");

    private final Clock clock;

    public HeuristicScorer(Clock clock) {
        this.clock = clock;
    }

    public static List<String> intentTokens(String intent) {
        if (intent == null || intent.isBlank()) {
            return List.of();
        }
        List<String> tokens = new ArrayList<>();
        for (String token : intent.toLowerCase(Locale.ROOT).trim().split("\\s+")) {
            if (token.length() > 2 && !INTENT_STOP_WORDS.contains(token)) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    public int score(EmailMessage message, List<String> intentTokens, UserPreferences preferences, ContextSignals context) {
        String sender = lower(message.getSender());
        String subject = lower(message.getSubject());
        int score = 0;

        if (preferences.getVipSenders().stream()
                .anyMatch(vip -> !vip.isBlank() && sender.contains(vip.toLowerCase(Locale.ROOT)))) {
            score += VIP_SENDER;
        }
        if (preferences.getUrgentKeywords().stream().anyMatch(keyword -> subject.contains(keyword.toLowerCase(Locale.ROOT)))) {
            score += URGENT_SUBJECT;
        }
        if (message.getReceivedAt() != null
                && Duration.between(message.getReceivedAt(), clock.instant()).compareTo(RECENT_WINDOW) < 0) {
            score += RECENT;
        }
        if (message.getLabels().stream().anyMatch(FLAGGED_LABELS::contains)) {
            score += FLAGGED_LABEL;
        }
        if (!intentTokens.isEmpty()) {
            if (intentTokens.stream().anyMatch(sender::contains)) {
                score += INTENT_IN_SENDER;
            }
            if (intentTokens.stream().anyMatch(subject::contains)) {
                score += INTENT_IN_SUBJECT;
            }
        }

        Double goalConfidence = context.getBestGoalConfidence().get(message.getId());
        if (goalConfidence != null) {
            score += goalConfidence >= 0.7 ? STRONG_GOAL : WEAK_GOAL;
        }
        Double replyRate = context.getSenderReplyRates().get(message.getSender());
        if (replyRate != null && replyRate > 0.5) {
            score += ENGAGED_SENDER;
        }
        return score;
    }

    /**
     * Scores every message and orders by score, then by received time, newest first.
     */
    public List<ScoredMessage> scoreAll(List<EmailMessage> messages, String intent,
                                        UserPreferences preferences, ContextSignals context) {
        List<String> tokens = intentTokens(intent);
        List<ScoredMessage> scored = new ArrayList<>(messages.size());
        for (EmailMessage message : messages) {
            scored.add(ScoredMessage.heuristic(message, score(message, tokens, preferences, context)));
        }
        scored.sort(Comparator.comparingInt(ScoredMessage::getHeuristicScore).reversed()
                .thenComparing(s -> s.getMessage().getReceivedAt(), Comparator.nullsLast(Comparator.<Instant>reverseOrder())));
        return scored;
    }

    private static String lower(String value) {
        return value != null ? value.toLowerCase(Locale.ROOT) : "";
    }
}
