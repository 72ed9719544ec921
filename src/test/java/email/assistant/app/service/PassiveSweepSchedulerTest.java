package email.assistant.app.service;

import email.assistant.app.entity.User;
import email.assistant.app.model.PipelineRequest;
import email.assistant.app.model.PipelineResult;
import email.assistant.app.repository.UserRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PassiveSweepSchedulerTest {

    @Mock
    private UserRepository userRepository;

    @Mock
    private AssistantPipelineService pipelineService;

    @InjectMocks
    private PassiveSweepScheduler scheduler;

    @Test
    void sweep_WhenOneUserFails_ShouldContinueWithOthers() {
        // Given
        when(userRepository.findByTokenAccessTokenIsNotNull()).thenReturn(List.of(user("u1"), user("u2")));
        when(pipelineService.run(any(PipelineRequest.class)))
                .thenThrow(new PipelineRunException(1L, "Run 1 failed: token revoked", null))
                .thenReturn(PipelineResult.builder().build());

        // When
        scheduler.sweep();

        // Then
        ArgumentCaptor<PipelineRequest> requests = ArgumentCaptor.forClass(PipelineRequest.class);
        verify(pipelineService, times(2)).run(requests.capture());
        assertEquals("u1", requests.getAllValues().get(0).getUserId());
        assertEquals("u2", requests.getAllValues().get(1).getUserId());
        assertFalse(requests.getAllValues().get(1).hasIntent());
    }

    @Test
    void sweep_WithNoConnectedUsers_ShouldDoNothing() {
        // Given
        when(userRepository.findByTokenAccessTokenIsNotNull()).thenReturn(List.of());

        // When
        scheduler.sweep();

        // Then
        verifyNoInteractions(pipelineService);
    }

    private static User user(String id) {
        User user = new User();
        user.setId(id);
        return user;
    }
}
