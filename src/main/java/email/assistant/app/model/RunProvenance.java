package email.assistant.app.model;

import email.assistant.app.review.ReviewState;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class RunProvenance {
    Long runId;
    IntentType intentType;
    List<String> queriesUsed;
    boolean storedFallbackUsed;
    ReviewState reviewOutcome;
    int reviewAttempts;
    String reviewFeedback;
    int retrievedCount;
}
