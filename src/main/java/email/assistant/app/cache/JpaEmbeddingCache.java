package email.assistant.app.cache;

import com.github.benmanes.caffeine.cache.Cache;
import email.assistant.app.entity.EmailEmbedding;
import email.assistant.app.entity.EmbeddingKey;
import email.assistant.app.repository.EmailEmbeddingRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Optional;

/**
 * Embedding cache backed by the email_embeddings table with a Caffeine front so a run
 * does not read the same row twice.
 */
@Slf4j
@Component
public class JpaEmbeddingCache implements EmbeddingCache {
    private final EmailEmbeddingRepository repository;
    private final Cache<String, float[]> front;
    private final Clock clock;

    public JpaEmbeddingCache(EmailEmbeddingRepository repository,
                             @Qualifier("embeddingFrontCache") Cache<String, float[]> front,
                             Clock clock) {
        this.repository = repository;
        this.front = front;
        this.clock = clock;
    }

    @Override
    public Optional<float[]> get(String userId, String emailId) {
        String frontKey = frontKey(userId, emailId);
        float[] cached = front.getIfPresent(frontKey);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<float[]> stored = repository.findById(new EmbeddingKey(userId, emailId))
                .map(EmailEmbedding::getVector);
        stored.ifPresent(vector -> front.put(frontKey, vector));
        return stored;
    }

    @Override
    public void put(String userId, String emailId, float[] vector) {
        if (vector == null) {
            return;
        }
        EmailEmbedding embedding = new EmailEmbedding();
        embedding.setId(new EmbeddingKey(userId, emailId));
        embedding.setVector(vector);
        embedding.setCreatedAt(clock.instant());
        repository.save(embedding);
        front.put(frontKey(userId, emailId), vector);
    }

    @Override
    @Transactional
    public void invalidateUser(String userId) {
        int removed = repository.deleteByUserId(userId);
        String prefix = userId + ":";
        front.asMap().keySet().removeIf(key -> key.startsWith(prefix));
        log.info("Invalidated {} cached embeddings for user {}", removed, userId);
    }

    private static String frontKey(String userId, String emailId) {
        return userId + ":" + emailId;
    }
}
