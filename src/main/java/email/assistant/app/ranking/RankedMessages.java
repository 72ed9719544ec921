package email.assistant.app.ranking;

import email.assistant.app.model.ScoredMessage;
import lombok.Value;

import java.util.List;

@Value
public class RankedMessages {
    /** Every candidate with its heuristic tier, before truncation. */
    List<ScoredMessage> scored;
    /** Final order within the budget. */
    List<ScoredMessage> ranked;
}
