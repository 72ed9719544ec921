package email.assistant.app.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import email.assistant.app.entity.EmailRecord;
import email.assistant.app.entity.SuggestionRecord;
import email.assistant.app.model.Analysis;
import email.assistant.app.model.EmailMessage;
import email.assistant.app.model.PriorityTier;
import email.assistant.app.model.ScoredMessage;
import email.assistant.app.model.Suggestion;
import email.assistant.app.model.SuggestionType;
import email.assistant.app.repository.EmailRecordRepository;
import email.assistant.app.repository.SuggestionRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PipelineStoreTest {

    private static final Instant NOW = Instant.parse("2024-06-01T09:00:00Z");

    @Mock
    private EmailRecordRepository emailRecordRepository;

    @Mock
    private SuggestionRecordRepository suggestionRecordRepository;

    private PipelineStore store;

    @BeforeEach
    void setUp() {
        store = new PipelineStore(emailRecordRepository, suggestionRecordRepository, new ObjectMapper(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @SuppressWarnings("unchecked")
    void saveRetrieved_ShouldKeepAnalysisOfExistingRecords() {
        // Given
        EmailRecord existing = new EmailRecord();
        existing.setId("m1");
        existing.setUserId("user123");
        existing.setAnalysis("{\"summary\":\"old\"}");
        existing.setProcessed(true);
        when(emailRecordRepository.findAllById(anyList())).thenReturn(List.of(existing));

        // When
        store.saveRetrieved("user123", List.of(message("m1"), message("m2")));

        // Then
        ArgumentCaptor<List<EmailRecord>> saved = ArgumentCaptor.forClass(List.class);
        verify(emailRecordRepository).saveAll(saved.capture());
        List<EmailRecord> records = saved.getValue();
        assertEquals(2, records.size());
        assertSame(existing, records.get(0));
        assertTrue(records.get(0).isProcessed());
        assertEquals("{\"summary\":\"old\"}", records.get(0).getAnalysis());
        assertEquals("INBOX,IMPORTANT", records.get(0).getLabels());
        assertEquals("user123", records.get(1).getUserId());
        assertEquals(NOW, records.get(1).getCreatedAt());
    }

    @Test
    void savePriorities_ShouldStoreTierLabel() {
        // Given
        EmailRecord record = new EmailRecord();
        record.setId("m1");
        when(emailRecordRepository.findAllById(anyList())).thenReturn(List.of(record));

        // When
        store.savePriorities(List.of(ScoredMessage.heuristic(message("m1"), 5)));

        // Then
        assertEquals("high", record.getPriority());
    }

    @Test
    void saveAnalyses_ShouldStoreJsonAndMarkProcessed() {
        // Given
        EmailRecord record = new EmailRecord();
        record.setId("m1");
        when(emailRecordRepository.findAllById(anyList())).thenReturn(List.of(record));

        // When
        store.saveAnalyses(List.of(Analysis.builder().emailId("m1").summary("Invoice due Friday").build()));

        // Then
        assertTrue(record.isProcessed());
        assertTrue(record.getAnalysis().contains("\"summary\":\"Invoice due Friday\""));
    }

    @Test
    @SuppressWarnings("unchecked")
    void saveSuggestions_ShouldTagRunId() {
        // Given
        Suggestion suggestion = Suggestion.builder()
                .type(SuggestionType.TASK)
                .title("Pay invoice")
                .details("From email summary: ...")
                .sourceEmailId("m1")
                .priority(PriorityTier.HIGH)
                .dueDate("2024-06-07")
                .build();

        // When
        store.saveSuggestions("user123", 42L, List.of(suggestion));

        // Then
        ArgumentCaptor<List<SuggestionRecord>> saved = ArgumentCaptor.forClass(List.class);
        verify(suggestionRecordRepository).saveAll(saved.capture());
        SuggestionRecord record = saved.getValue().get(0);
        assertEquals(42L, record.getRunId());
        assertEquals("task", record.getType());
        assertEquals("high", record.getPriority());
        assertEquals("pending", record.getStatus());
    }

    @Test
    void recentMessages_ShouldConvertStoredRecords() {
        // Given
        EmailRecord record = new EmailRecord();
        record.setId("m1");
        record.setThreadId("t1");
        record.setSubject("Stored");
        record.setLabels("INBOX,STARRED");
        record.setReceivedAt(NOW.minusSeconds(3600));
        when(emailRecordRepository.findByUserIdAndReceivedAtAfterOrderByReceivedAtDesc(eq("user123"), eq(NOW.minusSeconds(30L * 86400)), any(Pageable.class)))
                .thenReturn(new ArrayList<>(List.of(record)));

        // When
        List<EmailMessage> messages = store.recentMessages("user123", 30, 250);

        // Then
        assertEquals(1, messages.size());
        assertEquals("Stored", messages.get(0).getSubject());
        assertEquals(List.of("INBOX", "STARRED"), messages.get(0).getLabels());
    }

    private static EmailMessage message(String id) {
        return EmailMessage.builder()
                .id(id)
                .threadId("t-" + id)
                .sender("alice@acme.com")
                .subject("Subject " + id)
                .receivedAt(NOW)
                .label("INBOX")
                .label("IMPORTANT")
                .build();
    }
}
