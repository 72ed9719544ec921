package email.assistant.app.service;

import email.assistant.app.model.EmailMessage;
import email.assistant.app.model.MessageStub;

import java.util.List;
import java.util.Optional;

/**
 * One user's mailbox. Query syntax is provider specific and passed through untouched.
 */
public interface MailboxClient {

    /**
     * @throws CapabilityUnavailableException if the provider cannot be reached
     */
    List<MessageStub> search(String query, int maxResults);

    /**
     * Headers, labels and snippet; the body is loaded separately.
     * @return empty if the message could not be fetched
     */
    Optional<EmailMessage> fetch(String id);

    /**
     * Decoded body text, preferring text/plain.
     * @return empty if the message could not be fetched
     */
    Optional<String> fetchBody(String id);
}
