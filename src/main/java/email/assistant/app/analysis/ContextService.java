package email.assistant.app.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import email.assistant.app.config.AssistantProperties;
import email.assistant.app.entity.EmailInteraction;
import email.assistant.app.entity.EmailRecord;
import email.assistant.app.entity.GoalStatus;
import email.assistant.app.entity.InteractionType;
import email.assistant.app.entity.UserGoal;
import email.assistant.app.model.BehaviorInsight;
import email.assistant.app.model.ContextSignals;
import email.assistant.app.model.EmailMessage;
import email.assistant.app.repository.EmailInteractionRepository;
import email.assistant.app.repository.EmailRecordRepository;
import email.assistant.app.repository.UserGoalRepository;
import email.assistant.app.service.LanguageModelService;
import email.assistant.app.service.ModelJsonParser;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Prior context for ranking: active goals, which emails relate to them, and how the
 * user engages with each sender.
 */
@Slf4j
@Service
public class ContextService {
    static final String GOAL_SYSTEM_PROMPT =
            "You are a goal inference assistant. Only infer goals with high confidence (>0.6). Return valid JSON only.";
    static final double MIN_INFERRED_CONFIDENCE = 0.6;
    static final double MIN_GOAL_LINK = 0.3;
    private static final int MIN_OPENS = 2;
    private static final int MAX_PATTERNS = 10;

    private final UserGoalRepository goalRepository;
    private final EmailInteractionRepository interactionRepository;
    private final EmailRecordRepository emailRecordRepository;
    private final LanguageModelService languageModelService;
    private final ModelJsonParser jsonParser;
    private final AssistantProperties properties;
    private final Clock clock;

    public ContextService(UserGoalRepository goalRepository, EmailInteractionRepository interactionRepository,
                          EmailRecordRepository emailRecordRepository, LanguageModelService languageModelService,
                          ModelJsonParser jsonParser, AssistantProperties properties, Clock clock) {
        this.goalRepository = goalRepository;
        this.interactionRepository = interactionRepository;
        this.emailRecordRepository = emailRecordRepository;
        this.languageModelService = languageModelService;
        this.jsonParser = jsonParser;
        this.properties = properties;
        this.clock = clock;
    }

    @Value
    public static class SenderPattern {
        String sender;
        int openCount;
        long totalDurationSeconds;
        double replyRate;
    }

    @Value
    static class TopicCluster {
        String keyword;
        int frequency;
    }

    public ContextSignals gather(String userId, List<EmailMessage> messages) {
        try {
            List<UserGoal> goals = new ArrayList<>(
                    goalRepository.findByUserIdAndStatusOrderByConfidenceDescCreatedAtDesc(userId, GoalStatus.ACTIVE));
            List<SenderPattern> patterns = interactionPatterns(userId);
            List<UserGoal> inferred = inferGoals(userId, patterns);
            goals.addAll(inferred);

            ContextSignals.ContextSignalsBuilder signals = ContextSignals.builder();
            linkEmailsToGoals(messages, goals).forEach(signals::goalConfidence);
            patterns.forEach(p -> signals.senderReplyRate(p.getSender(), p.getReplyRate()));
            goals.forEach(g -> signals.activeGoal(g.getGoalText()));
            signals.insights(insights(patterns));

            log.info("Context for user {}: {} active goals ({} inferred), {} sender patterns",
                    userId, goals.size(), inferred.size(), patterns.size());
            return signals.build();
        } catch (RuntimeException e) {
            log.error("Context gathering failed for user {}, continuing without it: {}", userId, e.getMessage(), e);
            return ContextSignals.empty();
        }
    }

    /**
     * Senders the user opened more than twice, busiest first, with their reply rate.
     */
    List<SenderPattern> interactionPatterns(String userId) {
        List<EmailInteraction> interactions = interactionRepository.findByUserId(userId);
        if (interactions.isEmpty()) {
            return List.of();
        }
        Set<String> emailIds = interactions.stream().map(EmailInteraction::getEmailId).collect(Collectors.toSet());
        Map<String, String> senderByEmail = new HashMap<>();
        for (EmailRecord record : emailRecordRepository.findAllById(emailIds)) {
            if (record.getSender() != null) {
                senderByEmail.put(record.getId(), record.getSender());
            }
        }

        Map<String, int[]> counts = new LinkedHashMap<>();
        Map<String, Long> durations = new HashMap<>();
        for (EmailInteraction interaction : interactions) {
            String sender = senderByEmail.get(interaction.getEmailId());
            if (sender == null) {
                continue;
            }
            int[] openAndReply = counts.computeIfAbsent(sender, s -> new int[2]);
            openAndReply[0]++;
            if (interaction.getInteractionType() == InteractionType.REPLY) {
                openAndReply[1]++;
            }
            long seconds = interaction.getDurationSeconds() != null ? interaction.getDurationSeconds() : 0;
            durations.merge(sender, seconds, Long::sum);
        }

        return counts.entrySet().stream()
                .filter(e -> e.getValue()[0] > MIN_OPENS)
                .map(e -> new SenderPattern(e.getKey(), e.getValue()[0], durations.getOrDefault(e.getKey(), 0L),
                        (double) e.getValue()[1] / e.getValue()[0]))
                .sorted(Comparator.comparingInt(SenderPattern::getOpenCount).reversed())
                .limit(MAX_PATTERNS)
                .collect(Collectors.toList());
    }

    List<UserGoal> inferGoals(String userId, List<SenderPattern> patterns) {
        if (patterns.isEmpty()) {
            return List.of();
        }
        StringBuilder prompt = new StringBuilder("Analyze these email interaction patterns and infer the user's current goals.\n\n");
        prompt.append("Top senders by interaction:\n");
        patterns.stream().limit(5).forEach(p -> prompt.append(String.format("- %s (%d opens, %d min total, %d%% reply rate)%n",
                p.getSender(), p.getOpenCount(), Math.round(p.getTotalDurationSeconds() / 60.0), Math.round(p.getReplyRate() * 100))));
        prompt.append("\nTopic clusters:\n");
        topicClusters(userId).stream().limit(5).forEach(c -> prompt.append("- ").append(c.getKeyword())
                .append(" (").append(c.getFrequency()).append(" emails)\n"));
        prompt.append("\nReturn JSON with inferred goals (only if confidence > 0.6):\n")
              .append("{\"goals\": [{\"goal_text\": \"Complete Q4 financial report\", \"confidence\": 0.85, \"evidence\": \"...\"}]}");

        String raw = languageModelService.complete(GOAL_SYSTEM_PROMPT, prompt.toString(),
                properties.getAnalysis().getContextModel(), true);
        List<UserGoal> candidates = jsonParser.parseObject(raw)
                .map(json -> goalsFrom(json, userId))
                .recover(text -> List.of());

        List<UserGoal> saved = new ArrayList<>();
        for (UserGoal goal : candidates) {
            saved.add(goalRepository.save(goal));
        }
        return saved;
    }

    private List<UserGoal> goalsFrom(JsonNode json, String userId) {
        List<UserGoal> goals = new ArrayList<>();
        Instant now = clock.instant();
        for (JsonNode node : json.path("goals")) {
            String text = node.path("goal_text").asText("").trim();
            double confidence = node.path("confidence").asDouble(0.0);
            if (text.isEmpty() || confidence < MIN_INFERRED_CONFIDENCE) {
                continue;
            }
            UserGoal goal = new UserGoal();
            goal.setUserId(userId);
            goal.setGoalText(text);
            goal.setStatus(GoalStatus.ACTIVE);
            goal.setConfidence(confidence);
            goal.setSource("inferred");
            goal.setCreatedAt(now);
            goal.setUpdatedAt(now);
            goals.add(goal);
        }
        return goals;
    }

    /**
     * Subject words longer than four characters that recur in at least three recent emails.
     */
    List<TopicCluster> topicClusters(String userId) {
        Map<String, Integer> frequency = new LinkedHashMap<>();
        for (EmailRecord record : emailRecordRepository.findTop50ByUserIdOrderByReceivedAtDesc(userId)) {
            if (record.getSubject() == null) {
                continue;
            }
            for (String word : record.getSubject().toLowerCase(Locale.ROOT).split("\\s+")) {
                if (word.length() > 4) {
                    frequency.merge(word, 1, Integer::sum);
                }
            }
        }
        return frequency.entrySet().stream()
                .filter(e -> e.getValue() >= 3)
                .map(e -> new TopicCluster(e.getKey(), e.getValue()))
                .sorted(Comparator.comparingInt(TopicCluster::getFrequency).reversed())
                .collect(Collectors.toList());
    }

    /**
     * Email id to the confidence of the best goal whose words overlap its subject and
     * snippet enough.
     */
    static Map<String, Double> linkEmailsToGoals(List<EmailMessage> messages, List<UserGoal> goals) {
        Map<String, Double> best = new LinkedHashMap<>();
        for (EmailMessage message : messages) {
            String text = ((message.getSubject() != null ? message.getSubject() : "") + " "
                    + (message.getSnippet() != null ? message.getSnippet() : "")).toLowerCase(Locale.ROOT);
            for (UserGoal goal : goals) {
                String[] goalWords = goal.getGoalText().toLowerCase(Locale.ROOT).trim().split("\\s+");
                int matches = 0;
                for (String word : goalWords) {
                    if (word.length() > 3 && text.contains(word)) {
                        matches++;
                    }
                }
                double relevance = (double) matches / goalWords.length;
                if (relevance > MIN_GOAL_LINK) {
                    best.merge(message.getId(), goal.getConfidence(), Math::max);
                }
            }
        }
        return best;
    }

    static List<BehaviorInsight> insights(List<SenderPattern> patterns) {
        List<BehaviorInsight> insights = new ArrayList<>();
        if (!patterns.isEmpty()) {
            List<String> top = patterns.stream().limit(3).map(SenderPattern::getSender).collect(Collectors.toList());
            insights.add(new BehaviorInsight("sender_frequency",
                    "You interact most with: " + String.join(", ", top), 0.9, top));
        }
        List<String> engaged = patterns.stream()
                .filter(p -> p.getReplyRate() > 0.5)
                .map(SenderPattern::getSender)
                .collect(Collectors.toList());
        if (!engaged.isEmpty()) {
            insights.add(new BehaviorInsight("sender_engagement",
                    "High reply rate with: " + String.join(", ", engaged), 0.85, engaged));
        }
        return insights;
    }
}
