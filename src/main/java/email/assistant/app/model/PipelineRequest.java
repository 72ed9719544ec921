package email.assistant.app.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One pipeline invocation. Only {@code userId} is required; an absent intent means a
 * passive sweep of recent mail.
 */
@Value
@Builder
public class PipelineRequest {
    String userId;
    String intent;
    @Singular
    List<String> keywords;
    @Singular("mustHaveTerm")
    List<String> mustHave;
    @Singular("niceToHaveTerm")
    List<String> niceToHave;
    /** Ignore the last-run time window. Defaults to true for runs with an intent. */
    Boolean forceFullScan;
    /** Per-query mailbox result cap. */
    Integer maxResults;
    /** Ranking budget. */
    Integer limit;
    /** How many thread representatives get deep analysis. */
    Integer maxAnalyze;
    boolean quickMode;

    public boolean hasIntent() {
        return intent != null && !intent.isBlank();
    }
}
