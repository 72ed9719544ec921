package email.assistant.app.service;

import email.assistant.app.entity.User;
import email.assistant.app.model.PipelineRequest;
import email.assistant.app.repository.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Periodic passive run for every connected user. Off unless {@code assistant.sweep.enabled=true}.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "assistant.sweep.enabled", havingValue = "true")
public class PassiveSweepScheduler {
    private final UserRepository userRepository;
    private final AssistantPipelineService pipelineService;

    public PassiveSweepScheduler(UserRepository userRepository, AssistantPipelineService pipelineService) {
        this.userRepository = userRepository;
        this.pipelineService = pipelineService;
    }

    @Scheduled(fixedRateString = "${assistant.sweep.interval:PT5M}", initialDelayString = "${assistant.sweep.initial-delay:PT1M}")
    public void sweep() {
        List<User> users = userRepository.findByTokenAccessTokenIsNotNull();
        log.info("Passive sweep started for {} users", users.size());
        int failed = 0;
        for (User user : users) {
            try {
                pipelineService.run(PipelineRequest.builder().userId(user.getId()).build());
            } catch (PipelineRunException e) {
                failed++;
                log.error("Passive run {} failed for user {}: {}", e.getRunId(), user.getId(), e.getMessage());
            }
        }
        log.info("Passive sweep ended ({} failed)", failed);
    }
}
