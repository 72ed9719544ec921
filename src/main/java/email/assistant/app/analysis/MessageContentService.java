package email.assistant.app.analysis;

import com.github.benmanes.caffeine.cache.Cache;
import email.assistant.app.model.EmailMessage;
import email.assistant.app.service.MailboxClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Loads message bodies on demand and keeps them for the life of the process.
 */
@Slf4j
@Service
public class MessageContentService {
    private final Cache<String, String> bodyCache;

    public MessageContentService(@Qualifier("messageBodyCache") Cache<String, String> bodyCache) {
        this.bodyCache = bodyCache;
    }

    /**
     * @return the message with its body set; the snippet stands in when the body cannot be fetched
     */
    public EmailMessage withBody(String userId, MailboxClient mailbox, EmailMessage message) {
        if (message.hasBody()) {
            return message;
        }
        String body = bodyCache.get(userId + ":" + message.getId(),
                key -> mailbox.fetchBody(message.getId()).filter(text -> !text.isBlank()).orElse(null));
        if (body == null) {
            log.debug("Body unavailable for message {}, using snippet", message.getId());
            return message.withBody(message.getSnippet() != null ? message.getSnippet() : "");
        }
        return message.withBody(body);
    }
}
