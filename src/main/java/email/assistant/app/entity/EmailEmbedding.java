package email.assistant.app.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

@Entity
@Table(name = "email_embeddings")
@Data
public class EmailEmbedding {
    @EmbeddedId
    private EmbeddingKey id;

    @Convert(converter = EmbeddingVectorConverter.class)
    @Column(columnDefinition = "TEXT")
    private float[] vector;

    private Instant createdAt;
}
