package email.assistant.app.repository;

import email.assistant.app.entity.EmailInteraction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface EmailInteractionRepository extends JpaRepository<EmailInteraction, Long> {
    List<EmailInteraction> findByUserId(String userId);
}
