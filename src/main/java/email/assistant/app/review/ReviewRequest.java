package email.assistant.app.review;

import email.assistant.app.model.ScoredMessage;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ReviewRequest {
    String intent;
    @Singular
    List<String> keywords;
    @Singular("mustHaveTerm")
    List<String> mustHave;
    @Singular("niceToHaveTerm")
    List<String> niceToHave;
    /** Ranked, deduplicated messages the proposal is drawn from. */
    @Singular
    List<ScoredMessage> candidates;
    /** Every scored message of the run, before truncation and thread dedup. */
    @Singular("retrievedMessage")
    List<ScoredMessage> retrieved;
    int maxAttempts;

    /**
     * Messages the heuristic fallback scores: everything retrieved, or the candidates when
     * the caller passed nothing wider.
     */
    public List<ScoredMessage> fallbackPool() {
        return retrieved.isEmpty() ? candidates : retrieved;
    }
}
