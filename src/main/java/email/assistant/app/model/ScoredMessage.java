package email.assistant.app.model;

import lombok.Value;

/**
 * A message with its derived ranking data. Recomputed on every run.
 */
@Value
public class ScoredMessage {
    EmailMessage message;
    int heuristicScore;
    PriorityTier tier;
    /** Heuristic weight plus weighted semantic similarity; null when no intent was ranked against. */
    Double combinedScore;

    public static ScoredMessage heuristic(EmailMessage message, int score) {
        return new ScoredMessage(message, score, PriorityTier.fromScore(score), null);
    }

    public ScoredMessage withCombinedScore(double combined) {
        return new ScoredMessage(message, heuristicScore, tier, combined);
    }

    public String id() {
        return message.getId();
    }
}
