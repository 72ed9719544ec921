package email.assistant.app.review;

public enum ReviewState {
    PROPOSING,
    REVIEWING,
    PASS,
    FAIL_RETRY,
    FAIL_ACCEPTED;

    public boolean isTerminal() {
        return this == PASS || this == FAIL_ACCEPTED;
    }
}
