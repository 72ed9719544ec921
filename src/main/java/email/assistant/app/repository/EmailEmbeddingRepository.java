package email.assistant.app.repository;

import email.assistant.app.entity.EmailEmbedding;
import email.assistant.app.entity.EmbeddingKey;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface EmailEmbeddingRepository extends JpaRepository<EmailEmbedding, EmbeddingKey> {
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM EmailEmbedding e WHERE e.id.userId = :userId")
    int deleteByUserId(@Param("userId") String userId);

    long countByIdUserId(String userId);
}
