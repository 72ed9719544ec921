package email.assistant.app.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Deep analysis of one message for one run.
 */
@Value
@Builder(toBuilder = true)
public class Analysis {
    String emailId;
    String summary;
    /** Direct answer to the run's intent, when there was one. */
    String answer;
    @Singular
    List<ActionItem> actions;
    @Singular
    List<String> entities;
    @Singular("structuredEntity")
    Map<String, List<String>> structuredEntities;
    @Singular
    Map<String, String> keyFacts;
    Double relevance;
    boolean urgent;
    String replyDraft;
    TravelDetails travelDetails;

    public double relevanceOrZero() {
        return relevance != null ? relevance : 0.0;
    }
}
