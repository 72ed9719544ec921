package email.assistant.app.model;

public enum IntentType {
    SEARCH,
    REPLY,
    PROCESS;

    public String label() {
        return name().toLowerCase();
    }
}
