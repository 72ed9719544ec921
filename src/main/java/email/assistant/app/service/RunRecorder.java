package email.assistant.app.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import email.assistant.app.entity.PipelineRun;
import email.assistant.app.entity.RunStatus;
import email.assistant.app.repository.PipelineRunRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;

/**
 * Keeps the runs table current: one row per pipeline run with its outcome as JSON.
 */
@Slf4j
@Component
public class RunRecorder {
    private final PipelineRunRepository runRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RunRecorder(PipelineRunRepository runRepository, ObjectMapper objectMapper, Clock clock) {
        this.runRepository = runRepository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public PipelineRun start(String userId) {
        PipelineRun run = new PipelineRun();
        run.setUserId(userId);
        run.setStatus(RunStatus.STARTED);
        run.setStartedAt(clock.instant());
        return runRepository.save(run);
    }

    public PipelineRun complete(PipelineRun run, Map<String, Object> metadata) {
        return finish(run, RunStatus.COMPLETED, metadata);
    }

    public PipelineRun fail(PipelineRun run, Throwable error) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return finish(run, RunStatus.FAILED, Map.of("error", message));
    }

    private PipelineRun finish(PipelineRun run, RunStatus status, Map<String, Object> metadata) {
        run.setStatus(status);
        run.setCompletedAt(clock.instant());
        try {
            run.setMetadata(objectMapper.writeValueAsString(metadata));
        } catch (JsonProcessingException e) {
            log.error("Could not serialize metadata for run {}: {}", run.getId(), e.getMessage(), e);
        }
        return runRepository.save(run);
    }
}
