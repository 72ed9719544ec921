package email.assistant.app.retrieval;

import email.assistant.app.model.EmailMessage;
import lombok.Value;

import java.util.List;

@Value
public class RetrievalResult {
    List<EmailMessage> messages;
    /** Literal queries sent to the mailbox, in branch order. */
    List<String> queriesUsed;
    boolean failsafeUsed;
}
