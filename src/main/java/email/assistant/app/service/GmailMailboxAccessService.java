package email.assistant.app.service;

import com.google.api.client.auth.oauth2.BearerToken;
import com.google.api.client.auth.oauth2.Credential;
import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.http.javanet.NetHttpTransport;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.gson.GsonFactory;
import com.google.api.services.gmail.Gmail;
import email.assistant.app.entity.User;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Builds Gmail clients from the access token stored on the user. Token issuance and
 * refresh happen elsewhere.
 */
@Slf4j
@Service
public class GmailMailboxAccessService implements MailboxAccessService {
    private static final JsonFactory JSON_FACTORY = GsonFactory.getDefaultInstance();
    private static final String APPLICATION_NAME = "Email Assistant";

    private final NetHttpTransport httpTransport;
    private final CapabilityGuard capabilityGuard;
    private final GmailMessageMapper messageMapper;
    private final Clock clock;

    public GmailMailboxAccessService(CapabilityGuard capabilityGuard, GmailMessageMapper messageMapper, Clock clock) throws Exception {
        this.httpTransport = GoogleNetHttpTransport.newTrustedTransport();
        this.capabilityGuard = capabilityGuard;
        this.messageMapper = messageMapper;
        this.clock = clock;
    }

    @Override
    public MailboxClient open(User user) {
        if (user.getToken() == null || !user.getToken().isUsable(clock.instant())) {
            throw new MailboxAccessException("No usable mailbox token for user " + user.getId());
        }
        try {
            Credential credential = new Credential.Builder(BearerToken.authorizationHeaderAccessMethod())
                .setTransport(httpTransport)
                .setJsonFactory(JSON_FACTORY)
                .build();
            credential.setAccessToken(user.getToken().getAccessToken());

            Gmail gmail = new Gmail.Builder(httpTransport, JSON_FACTORY, credential)
                .setApplicationName(APPLICATION_NAME)
                .build();
            return new GmailMailboxClient(gmail, capabilityGuard, messageMapper);
        } catch (RuntimeException e) {
            log.error("Failed to build Gmail client for user {}: {}", user.getId(), e.getMessage(), e);
            throw new MailboxAccessException("Could not build Gmail client for user " + user.getId(), e);
        }
    }
}
