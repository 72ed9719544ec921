package email.assistant.app.repository;

import email.assistant.app.entity.EmailRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface EmailRecordRepository extends JpaRepository<EmailRecord, String> {
    List<EmailRecord> findByUserIdAndReceivedAtAfterOrderByReceivedAtDesc(String userId, Instant after, Pageable pageable);

    List<EmailRecord> findTop50ByUserIdOrderByReceivedAtDesc(String userId);
}
