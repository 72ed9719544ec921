package email.assistant.app.review;

public enum ReviewStatus {
    PASS,
    FAIL
}
