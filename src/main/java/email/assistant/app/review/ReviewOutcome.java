package email.assistant.app.review;

import email.assistant.app.model.ScoredMessage;
import lombok.Value;

import java.util.List;

@Value
public class ReviewOutcome {
    ReviewState finalState;
    List<ScoredMessage> proposal;
    /** Number of reviews performed. */
    int attempts;
    int proposalRounds;
    String feedback;
}
