package email.assistant.app.cache;

import java.util.Optional;

/**
 * Per-user message embeddings. Entries never expire; they are dropped as a whole when
 * the user's intent changes.
 */
public interface EmbeddingCache {

    Optional<float[]> get(String userId, String emailId);

    /**
     * Idempotent overwrite.
     */
    void put(String userId, String emailId, float[] vector);

    void invalidateUser(String userId);
}
