package email.assistant.app.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.Data;

import java.time.Instant;

/**
 * Mailbox credential issued outside this service; only read here.
 */
@Embeddable
@Data
public class OAuthToken {
    @Column(length = 4000)
    private String accessToken;

    private Instant expiry;

    public boolean isUsable(Instant now) {
        return accessToken != null && !accessToken.isBlank()
                && (expiry == null || expiry.isAfter(now));
    }
}
