package email.assistant.app.model;

import lombok.Value;

@Value
public class ActionItem {
    String description;
    String dueDate;
    PriorityTier priority;
}
