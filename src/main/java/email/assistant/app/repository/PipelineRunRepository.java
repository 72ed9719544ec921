package email.assistant.app.repository;

import email.assistant.app.entity.PipelineRun;
import email.assistant.app.entity.RunStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface PipelineRunRepository extends JpaRepository<PipelineRun, Long> {
    Optional<PipelineRun> findFirstByUserIdAndStatusOrderByStartedAtDesc(String userId, RunStatus status);
}
