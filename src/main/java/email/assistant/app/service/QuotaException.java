package email.assistant.app.service;

/**
 * Provider quota or rate limit was hit. Never retried.
 */
public class QuotaException extends RuntimeException {
    public QuotaException(String message, Throwable cause) {
        super(message, cause);
    }
}
