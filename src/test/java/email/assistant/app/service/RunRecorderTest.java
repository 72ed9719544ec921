package email.assistant.app.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import email.assistant.app.entity.PipelineRun;
import email.assistant.app.entity.RunStatus;
import email.assistant.app.repository.PipelineRunRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RunRecorderTest {

    private static final Instant NOW = Instant.parse("2024-06-01T09:00:00Z");

    @Mock
    private PipelineRunRepository runRepository;

    private RunRecorder recorder;

    @BeforeEach
    void setUp() {
        recorder = new RunRecorder(runRepository, new ObjectMapper(), Clock.fixed(NOW, ZoneOffset.UTC));
        when(runRepository.save(any(PipelineRun.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void start_ShouldCreateStartedRun() {
        // When
        PipelineRun run = recorder.start("user123");

        // Then
        assertEquals("user123", run.getUserId());
        assertEquals(RunStatus.STARTED, run.getStatus());
        assertEquals(NOW, run.getStartedAt());
        assertNull(run.getCompletedAt());
    }

    @Test
    void complete_ShouldStoreMetadataAsJson() {
        // Given
        PipelineRun run = recorder.start("user123");
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("quickMode", true);
        metadata.put("emailCount", 4);

        // When
        recorder.complete(run, metadata);

        // Then
        assertEquals(RunStatus.COMPLETED, run.getStatus());
        assertEquals(NOW, run.getCompletedAt());
        assertEquals("{\"quickMode\":true,\"emailCount\":4}", run.getMetadata());
    }

    @Test
    void fail_ShouldRecordErrorMessage() {
        // Given
        PipelineRun run = recorder.start("user123");

        // When
        recorder.fail(run, new MailboxAccessException("No usable token"));

        // Then
        assertEquals(RunStatus.FAILED, run.getStatus());
        assertEquals("{\"error\":\"No usable token\"}", run.getMetadata());
        verify(runRepository, times(2)).save(run);
    }
}
