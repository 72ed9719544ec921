package email.assistant.app.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

@Entity
@Table(name = "runs")
@Data
public class PipelineRun {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    private RunStatus status;

    private Instant startedAt;

    private Instant completedAt;

    // JSON
    @Column(columnDefinition = "TEXT")
    private String metadata;
}
