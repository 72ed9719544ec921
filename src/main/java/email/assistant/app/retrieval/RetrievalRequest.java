package email.assistant.app.retrieval;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class RetrievalRequest {
    String intent;
    @Singular
    List<String> keywords;
    @Singular("mustHaveTerm")
    List<String> mustHave;
    @Singular("niceToHaveTerm")
    List<String> niceToHave;
    /** Gmail time filter appended to queries without one; null for a full scan. */
    String timeWindow;
    int maxResults;
}
