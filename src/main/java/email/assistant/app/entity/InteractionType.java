package email.assistant.app.entity;

public enum InteractionType {
    OPEN,
    REPLY,
    ARCHIVE,
    STAR,
    DELETE
}
