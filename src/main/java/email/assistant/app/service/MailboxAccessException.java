package email.assistant.app.service;

/**
 * No mailbox client could be established for a user. Fatal for the run.
 */
public class MailboxAccessException extends RuntimeException {
    public MailboxAccessException(String message) {
        super(message);
    }

    public MailboxAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
