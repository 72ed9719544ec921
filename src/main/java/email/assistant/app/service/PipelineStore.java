package email.assistant.app.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import email.assistant.app.entity.EmailRecord;
import email.assistant.app.entity.SuggestionRecord;
import email.assistant.app.model.Analysis;
import email.assistant.app.model.EmailMessage;
import email.assistant.app.model.ScoredMessage;
import email.assistant.app.model.Suggestion;
import email.assistant.app.repository.EmailRecordRepository;
import email.assistant.app.repository.SuggestionRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Durable side of a run. Every write is an upsert keyed by message id, so re-running is safe.
 */
@Slf4j
@Component
public class PipelineStore {
    private final EmailRecordRepository emailRecordRepository;
    private final SuggestionRecordRepository suggestionRecordRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public PipelineStore(EmailRecordRepository emailRecordRepository, SuggestionRecordRepository suggestionRecordRepository,
                         ObjectMapper objectMapper, Clock clock) {
        this.emailRecordRepository = emailRecordRepository;
        this.suggestionRecordRepository = suggestionRecordRepository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Transactional
    public void saveRetrieved(String userId, List<EmailMessage> messages) {
        if (messages.isEmpty()) {
            return;
        }
        Map<String, EmailRecord> existing = byId(messages.stream().map(EmailMessage::getId).collect(Collectors.toList()));
        List<EmailRecord> records = new ArrayList<>(messages.size());
        for (EmailMessage message : messages) {
            EmailRecord record = existing.get(message.getId());
            if (record == null) {
                record = new EmailRecord();
                record.setId(message.getId());
                record.setUserId(userId);
                record.setCreatedAt(clock.instant());
            }
            record.setThreadId(message.getThreadId());
            record.setSender(message.getSender());
            record.setSubject(message.getSubject());
            record.setSnippet(message.getSnippet());
            record.setReceivedAt(message.getReceivedAt());
            record.setLabels(String.join(",", message.getLabels()));
            records.add(record);
        }
        emailRecordRepository.saveAll(records);
        log.debug("Stored {} messages for user {}", records.size(), userId);
    }

    @Transactional
    public void savePriorities(List<ScoredMessage> scored) {
        Map<String, EmailRecord> records = byId(scored.stream().map(ScoredMessage::id).collect(Collectors.toList()));
        for (ScoredMessage message : scored) {
            EmailRecord record = records.get(message.id());
            if (record != null) {
                record.setPriority(message.getTier().label());
            }
        }
        emailRecordRepository.saveAll(records.values());
    }

    @Transactional
    public void saveAnalyses(List<Analysis> analyses) {
        Map<String, EmailRecord> records = byId(analyses.stream().map(Analysis::getEmailId).collect(Collectors.toList()));
        for (Analysis analysis : analyses) {
            EmailRecord record = records.get(analysis.getEmailId());
            if (record == null) {
                continue;
            }
            try {
                record.setAnalysis(objectMapper.writeValueAsString(analysis));
                record.setProcessed(true);
            } catch (JsonProcessingException e) {
                log.error("Could not serialize analysis for message {}: {}", analysis.getEmailId(), e.getMessage(), e);
            }
        }
        emailRecordRepository.saveAll(records.values());
    }

    @Transactional
    public void saveSuggestions(String userId, Long runId, List<Suggestion> suggestions) {
        Instant now = clock.instant();
        List<SuggestionRecord> records = new ArrayList<>(suggestions.size());
        for (Suggestion suggestion : suggestions) {
            SuggestionRecord record = new SuggestionRecord();
            record.setUserId(userId);
            record.setRunId(runId);
            record.setSourceEmailId(suggestion.getSourceEmailId());
            record.setType(suggestion.getType().name().toLowerCase());
            record.setTitle(suggestion.getTitle());
            record.setDescription(suggestion.getDetails());
            record.setDueDate(suggestion.getDueDate());
            record.setPriority(suggestion.getPriority().label());
            record.setCreatedAt(now);
            records.add(record);
        }
        suggestionRecordRepository.saveAll(records);
    }

    /**
     * Messages stored for the user within the last {@code days}, newest first.
     */
    @Transactional(readOnly = true)
    public List<EmailMessage> recentMessages(String userId, int days, int limit) {
        Instant since = clock.instant().minus(Duration.ofDays(days));
        return emailRecordRepository
                .findByUserIdAndReceivedAtAfterOrderByReceivedAtDesc(userId, since, PageRequest.of(0, limit))
                .stream()
                .map(PipelineStore::toMessage)
                .collect(Collectors.toList());
    }

    static EmailMessage toMessage(EmailRecord record) {
        EmailMessage.EmailMessageBuilder builder = EmailMessage.builder()
                .id(record.getId())
                .threadId(record.getThreadId())
                .sender(record.getSender())
                .subject(record.getSubject())
                .snippet(record.getSnippet())
                .receivedAt(record.getReceivedAt());
        if (record.getLabels() != null && !record.getLabels().isBlank()) {
            builder.labels(Arrays.asList(record.getLabels().split(",")));
        }
        return builder.build();
    }

    private Map<String, EmailRecord> byId(List<String> ids) {
        return emailRecordRepository.findAllById(ids).stream()
                .collect(Collectors.toMap(EmailRecord::getId, Function.identity()));
    }
}
