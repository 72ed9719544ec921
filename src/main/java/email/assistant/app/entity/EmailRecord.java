package email.assistant.app.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

@Entity
@Table(name = "emails", indexes = @Index(name = "idx_emails_user_received", columnList = "userId, receivedAt"))
@Data
public class EmailRecord {
    // Gmail message id
    @Id
    private String id;

    @Column(nullable = false)
    private String userId;

    private String threadId;

    private String sender;

    @Column(columnDefinition = "TEXT")
    private String subject;

    @Column(columnDefinition = "TEXT")
    private String snippet;

    private Instant receivedAt;

    // Comma separated label ids
    private String labels;

    private String priority;

    private boolean processed;

    @Column(columnDefinition = "TEXT")
    private String analysis;

    private Instant createdAt;
}
