package email.assistant.app.service;

import com.google.api.client.googleapis.json.GoogleJsonResponseException;
import com.google.api.services.gmail.Gmail;
import com.google.api.services.gmail.model.ListMessagesResponse;
import com.google.api.services.gmail.model.Message;
import email.assistant.app.model.EmailMessage;
import email.assistant.app.model.MessageStub;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Slf4j
public class GmailMailboxClient implements MailboxClient {
    private static final String ME = "me";
    private static final List<String> METADATA_HEADERS = List.of("From", "To", "Subject", "Date");

    private final Gmail gmail;
    private final CapabilityGuard capabilityGuard;
    private final GmailMessageMapper messageMapper;

    public GmailMailboxClient(Gmail gmail, CapabilityGuard capabilityGuard, GmailMessageMapper messageMapper) {
        this.gmail = gmail;
        this.capabilityGuard = capabilityGuard;
        this.messageMapper = messageMapper;
    }

    @Override
    public List<MessageStub> search(String query, int maxResults) {
        ListMessagesResponse response = capabilityGuard.call("gmail search", () -> {
            try {
                return gmail.users().messages().list(ME)
                    .setQ(query)
                    .setMaxResults((long) maxResults)
                    .execute();
            } catch (IOException e) {
                throw translate(e, "search");
            }
        });

        List<MessageStub> stubs = new ArrayList<>();
        if (response != null && response.getMessages() != null) {
            for (Message messageRef : response.getMessages()) {
                stubs.add(new MessageStub(messageRef.getId(), messageRef.getThreadId()));
            }
        }
        log.debug("Query '{}' returned {} messages", query, stubs.size());
        return stubs;
    }

    @Override
    public Optional<EmailMessage> fetch(String id) {
        try {
            Message message = capabilityGuard.call("gmail fetch", () -> {
                try {
                    return gmail.users().messages().get(ME, id)
                        .setFormat("metadata")
                        .setMetadataHeaders(METADATA_HEADERS)
                        .execute();
                } catch (IOException e) {
                    throw translate(e, "fetch");
                }
            });
            return Optional.ofNullable(message).map(messageMapper::toEmailMessage);
        } catch (QuotaException | CapabilityUnavailableException e) {
            log.warn("Could not fetch message {}: {}", id, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Optional<String> fetchBody(String id) {
        try {
            Message message = capabilityGuard.call("gmail body fetch", () -> {
                try {
                    return gmail.users().messages().get(ME, id)
                        .setFormat("full")
                        .execute();
                } catch (IOException e) {
                    throw translate(e, "body fetch");
                }
            });
            return Optional.ofNullable(message).map(messageMapper::extractBody);
        } catch (QuotaException | CapabilityUnavailableException e) {
            log.warn("Could not fetch body of message {}: {}", id, e.getMessage());
            return Optional.empty();
        }
    }

    private static RuntimeException translate(IOException e, String operation) {
        if (e instanceof GoogleJsonResponseException && ((GoogleJsonResponseException) e).getStatusCode() == 429) {
            return new QuotaException("Gmail rate limit exceeded during " + operation, e);
        }
        return new IllegalStateException("Gmail " + operation + " failed: " + e.getMessage(), e);
    }
}
