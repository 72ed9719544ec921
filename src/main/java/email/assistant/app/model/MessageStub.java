package email.assistant.app.model;

import lombok.Value;

/**
 * Search hit returned by the mailbox before the full message is fetched.
 */
@Value
public class MessageStub {
    String id;
    String threadId;
}
