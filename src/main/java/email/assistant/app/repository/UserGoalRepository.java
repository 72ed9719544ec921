package email.assistant.app.repository;

import email.assistant.app.entity.GoalStatus;
import email.assistant.app.entity.UserGoal;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface UserGoalRepository extends JpaRepository<UserGoal, Long> {
    List<UserGoal> findByUserIdAndStatusOrderByConfidenceDescCreatedAtDesc(String userId, GoalStatus status);
}
