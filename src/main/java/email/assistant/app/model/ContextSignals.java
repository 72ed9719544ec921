package email.assistant.app.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Prior-context signals used by the heuristic scorer: goal links per email and how
 * often the user replies to each sender.
 */
@Value
@Builder
public class ContextSignals {
    /** Email id to the confidence of the best active goal it is linked to. */
    @Singular("goalConfidence")
    Map<String, Double> bestGoalConfidence;
    /** Sender header value to reply rate in [0, 1]. */
    @Singular("senderReplyRate")
    Map<String, Double> senderReplyRates;
    @Singular
    List<String> activeGoals;
    @Singular
    List<BehaviorInsight> insights;

    public static ContextSignals empty() {
        return ContextSignals.builder().build();
    }
}
