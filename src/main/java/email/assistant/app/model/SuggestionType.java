package email.assistant.app.model;

public enum SuggestionType {
    TASK,
    REPLY,
    INFO
}
