package email.assistant.app.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * A mailbox message as fetched from the provider. The body may be absent until it is
 * loaded lazily; everything else is fixed once fetched.
 */
@Value
@Builder(toBuilder = true)
public class EmailMessage {
    String id;
    String threadId;
    String sender;
    @Singular
    List<String> recipients;
    String subject;
    String snippet;
    String body;
    Instant receivedAt;
    @Singular
    List<String> labels;

    public boolean hasBody() {
        return body != null && !body.isBlank();
    }

    public EmailMessage withBody(String newBody) {
        return toBuilder().body(newBody).build();
    }
}
