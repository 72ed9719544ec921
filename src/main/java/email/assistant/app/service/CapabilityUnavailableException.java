package email.assistant.app.service;

/**
 * A mailbox or model call failed or timed out after its retry. Call sites catch this and
 * fall back to a default value.
 */
public class CapabilityUnavailableException extends RuntimeException {
    public CapabilityUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
