package email.assistant.app.entity;

public enum GoalStatus {
    ACTIVE,
    COMPLETED,
    PAUSED
}
