package email.assistant.app.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Suggestion {
    SuggestionType type;
    String title;
    String details;
    /** Null for aggregate cards that summarise several emails. */
    String sourceEmailId;
    PriorityTier priority;
    /** Only set for suggestions created from a dated action. */
    String dueDate;
}
