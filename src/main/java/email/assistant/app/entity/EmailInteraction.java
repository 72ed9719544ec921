package email.assistant.app.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

@Entity
@Table(name = "email_interactions")
@Data
public class EmailInteraction {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String userId;

    @Column(nullable = false)
    private String emailId;

    @Enumerated(EnumType.STRING)
    private InteractionType interactionType;

    @Column(name = "occurred_at")
    private Instant timestamp;

    // How long the email was open
    private Integer durationSeconds;
}
