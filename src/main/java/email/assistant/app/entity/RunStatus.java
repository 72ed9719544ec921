package email.assistant.app.entity;

public enum RunStatus {
    STARTED,
    COMPLETED,
    FAILED
}
