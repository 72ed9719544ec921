package email.assistant.app.repository;

import email.assistant.app.entity.SuggestionRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SuggestionRecordRepository extends JpaRepository<SuggestionRecord, Long> {
    List<SuggestionRecord> findByRunId(Long runId);
}
