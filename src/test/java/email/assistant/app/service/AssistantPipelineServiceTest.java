package email.assistant.app.service;

import email.assistant.app.analysis.ContextService;
import email.assistant.app.analysis.EmailAnalysisService;
import email.assistant.app.analysis.IntentClassifier;
import email.assistant.app.analysis.IntentKeywordExtractor;
import email.assistant.app.analysis.IntentKeywords;
import email.assistant.app.cache.EmbeddingCache;
import email.assistant.app.config.AssistantProperties;
import email.assistant.app.entity.PipelineRun;
import email.assistant.app.entity.User;
import email.assistant.app.model.Analysis;
import email.assistant.app.model.ContextSignals;
import email.assistant.app.model.EmailMessage;
import email.assistant.app.model.IntentType;
import email.assistant.app.model.PipelineRequest;
import email.assistant.app.model.PipelineResult;
import email.assistant.app.model.PriorityTier;
import email.assistant.app.model.ScoredMessage;
import email.assistant.app.model.Suggestion;
import email.assistant.app.model.SuggestionType;
import email.assistant.app.ranking.RankedMessages;
import email.assistant.app.ranking.RankingService;
import email.assistant.app.ranking.ThreadDeduplicator;
import email.assistant.app.repository.UserRepository;
import email.assistant.app.retrieval.RetrievalCascade;
import email.assistant.app.retrieval.RetrievalRequest;
import email.assistant.app.retrieval.RetrievalResult;
import email.assistant.app.retrieval.TimeWindowPolicy;
import email.assistant.app.review.ReviewLoop;
import email.assistant.app.review.ReviewOutcome;
import email.assistant.app.review.ReviewRequest;
import email.assistant.app.review.ReviewState;
import email.assistant.app.suggestion.SuggestionSynthesizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AssistantPipelineServiceTest {

    @Mock
    private UserRepository userRepository;
    @Mock
    private MailboxAccessService mailboxAccessService;
    @Mock
    private MailboxClient mailbox;
    @Mock
    private EmbeddingCache embeddingCache;
    @Mock
    private IntentClassifier intentClassifier;
    @Mock
    private IntentKeywordExtractor keywordExtractor;
    @Mock
    private TimeWindowPolicy timeWindowPolicy;
    @Mock
    private RetrievalCascade retrievalCascade;
    @Mock
    private ContextService contextService;
    @Mock
    private RankingService rankingService;
    @Mock
    private ThreadDeduplicator threadDeduplicator;
    @Mock
    private ReviewLoop reviewLoop;
    @Mock
    private EmailAnalysisService analysisService;
    @Mock
    private SuggestionSynthesizer suggestionSynthesizer;
    @Mock
    private PipelineStore store;
    @Mock
    private RunRecorder runRecorder;

    private AssistantPipelineService pipelineService;
    private PipelineRun run;
    private User user;

    @BeforeEach
    void setUp() {
        pipelineService = new AssistantPipelineService(userRepository, mailboxAccessService, embeddingCache,
                intentClassifier, keywordExtractor, timeWindowPolicy, retrievalCascade, contextService,
                rankingService, threadDeduplicator, reviewLoop, analysisService, suggestionSynthesizer,
                store, runRecorder, new AssistantProperties());

        run = new PipelineRun();
        run.setId(7L);
        run.setUserId("user123");

        user = new User();
        user.setId("user123");
        user.setLastIntent("find my invoices");

        lenient().when(runRecorder.start("user123")).thenReturn(run);
        lenient().when(userRepository.findById("user123")).thenReturn(Optional.of(user));
        lenient().when(intentClassifier.classify(any())).thenReturn(IntentType.SEARCH);
        lenient().when(timeWindowPolicy.windowFor(eq("user123"), anyBoolean())).thenReturn("newer_than:1d");
        lenient().when(contextService.gather(eq("user123"), anyList())).thenReturn(ContextSignals.empty());
        lenient().when(threadDeduplicator.dedup(anyList())).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void run_WhenMailboxUnavailable_ShouldFailRunAndRethrowWithRunId() {
        // Given
        when(mailboxAccessService.open(user)).thenThrow(new MailboxAccessException("No usable token for user123"));

        // When
        PipelineRunException thrown = assertThrows(PipelineRunException.class,
                () -> pipelineService.run(searchRequest().build()));

        // Then
        assertEquals(7L, thrown.getRunId());
        assertTrue(thrown.getMessage().contains("No usable token"));
        verify(runRecorder).fail(eq(run), any(MailboxAccessException.class));
        verify(runRecorder, never()).complete(any(), any());
        verifyNoInteractions(retrievalCascade);
    }

    @Test
    void run_WhenUserUnknown_ShouldFailRun() {
        // Given
        when(runRecorder.start("ghost")).thenReturn(run);
        when(userRepository.findById("ghost")).thenReturn(Optional.empty());

        // When / Then
        assertThrows(PipelineRunException.class,
                () -> pipelineService.run(PipelineRequest.builder().userId("ghost").build()));
        verify(runRecorder).fail(eq(run), any(MailboxAccessException.class));
    }

    @Test
    void run_PassiveWithNoMail_ShouldCompleteWithEmptyResult() {
        // Given
        when(mailboxAccessService.open(user)).thenReturn(mailbox);
        when(retrievalCascade.retrieve(eq(mailbox), any(RetrievalRequest.class)))
                .thenReturn(new RetrievalResult(List.of(), List.of("newer_than:1d"), false));

        // When
        PipelineResult result = pipelineService.run(PipelineRequest.builder().userId("user123").build());

        // Then
        assertTrue(result.getPrioritized().isEmpty());
        assertTrue(result.getSuggestions().isEmpty());
        assertEquals(7L, result.getProvenance().getRunId());
        verify(store, never()).recentMessages(anyString(), anyInt(), anyInt());
        verify(runRecorder).complete(eq(run), any());
        verifyNoInteractions(rankingService, reviewLoop, analysisService, embeddingCache);
    }

    @Test
    void run_PassiveRun_ShouldUseLastRunWindowAndPassiveCap() {
        // Given
        when(mailboxAccessService.open(user)).thenReturn(mailbox);
        when(retrievalCascade.retrieve(eq(mailbox), any(RetrievalRequest.class)))
                .thenReturn(new RetrievalResult(List.of(), List.of("newer_than:1d"), false));

        // When
        pipelineService.run(PipelineRequest.builder().userId("user123").build());

        // Then
        ArgumentCaptor<RetrievalRequest> captor = ArgumentCaptor.forClass(RetrievalRequest.class);
        verify(retrievalCascade).retrieve(eq(mailbox), captor.capture());
        assertEquals(25, captor.getValue().getMaxResults());
        assertEquals("newer_than:1d", captor.getValue().getTimeWindow());
        verify(timeWindowPolicy).windowFor("user123", false);
    }

    @Test
    void run_WhenMailboxEmptyForIntent_ShouldFallBackToStoredMessages() {
        // Given
        EmailMessage stored = message("s1");
        when(mailboxAccessService.open(user)).thenReturn(mailbox);
        when(retrievalCascade.retrieve(eq(mailbox), any(RetrievalRequest.class)))
                .thenReturn(new RetrievalResult(List.of(), List.of("invoice"), true));
        when(store.recentMessages("user123", 30, 250)).thenReturn(List.of(stored));
        List<ScoredMessage> scored = List.of(ScoredMessage.heuristic(stored, 1));
        when(rankingService.rank(eq("user123"), eq(List.of(stored)), eq("find my invoices"), any(), any(), eq(false), eq(25)))
                .thenReturn(new RankedMessages(scored, scored));

        // When
        PipelineResult result = pipelineService.run(searchRequest().quickMode(true).build());

        // Then
        assertTrue(result.getProvenance().isStoredFallbackUsed());
        assertEquals(1, result.getProvenance().getRetrievedCount());
        assertEquals(List.of("s1"), ids(result.getPrioritized()));
    }

    @Test
    void run_QuickMode_ShouldSkipReviewAndAnalysis() {
        // Given
        List<EmailMessage> messages = messages(3);
        List<ScoredMessage> scored = scoredAll(messages);
        when(mailboxAccessService.open(user)).thenReturn(mailbox);
        when(retrievalCascade.retrieve(eq(mailbox), any(RetrievalRequest.class)))
                .thenReturn(new RetrievalResult(messages, List.of("invoice"), false));
        when(rankingService.rank(eq("user123"), eq(messages), any(), any(), any(), anyBoolean(), anyInt()))
                .thenReturn(new RankedMessages(scored, scored));

        // When
        PipelineResult result = pipelineService.run(searchRequest().quickMode(true).build());

        // Then
        assertEquals(3, result.getPrioritized().size());
        assertTrue(result.getAnalyses().isEmpty());
        verify(store).savePriorities(scored);
        verifyNoInteractions(reviewLoop, analysisService, suggestionSynthesizer);
        verify(runRecorder).complete(run, Map.of("quickMode", true, "emailCount", 3));
    }

    @Test
    void run_WhenIntentChanges_ShouldInvalidateEmbeddingsAndForceRefresh() {
        // Given
        List<EmailMessage> messages = messages(2);
        List<ScoredMessage> scored = scoredAll(messages);
        when(mailboxAccessService.open(user)).thenReturn(mailbox);
        when(retrievalCascade.retrieve(eq(mailbox), any(RetrievalRequest.class)))
                .thenReturn(new RetrievalResult(messages, List.of("flight"), false));
        when(rankingService.rank(eq("user123"), eq(messages), eq("show my flight"), any(), any(), eq(true), anyInt()))
                .thenReturn(new RankedMessages(scored, scored));

        // When
        pipelineService.run(PipelineRequest.builder()
                .userId("user123")
                .intent("  show my flight ")
                .keyword("flight")
                .quickMode(true)
                .build());

        // Then
        verify(embeddingCache).invalidateUser("user123");
        verify(userRepository).save(user);
        assertEquals("show my flight", user.getLastIntent());
    }

    @Test
    void run_WithoutKeywords_ShouldExtractThemFromIntent() {
        // Given
        when(keywordExtractor.extract("find my invoices"))
                .thenReturn(new IntentKeywords("Find invoices", List.of("invoice", "billing")));
        when(mailboxAccessService.open(user)).thenReturn(mailbox);
        when(retrievalCascade.retrieve(eq(mailbox), any(RetrievalRequest.class)))
                .thenReturn(new RetrievalResult(List.of(), List.of(), true));
        when(store.recentMessages("user123", 30, 250)).thenReturn(List.of());

        // When
        pipelineService.run(PipelineRequest.builder().userId("user123").intent("find my invoices").build());

        // Then
        ArgumentCaptor<RetrievalRequest> captor = ArgumentCaptor.forClass(RetrievalRequest.class);
        verify(retrievalCascade).retrieve(eq(mailbox), captor.capture());
        assertEquals(List.of("invoice", "billing"), captor.getValue().getKeywords());
        assertEquals(60, captor.getValue().getMaxResults());
        verify(timeWindowPolicy).windowFor("user123", true);
        verifyNoInteractions(embeddingCache);
    }

    @Test
    @SuppressWarnings("unchecked")
    void run_FullRun_ShouldAnalyzeWithinLimitAndRecordOutcome() {
        // Given
        List<EmailMessage> messages = messages(7);
        List<ScoredMessage> scored = scoredAll(messages);
        when(mailboxAccessService.open(user)).thenReturn(mailbox);
        when(retrievalCascade.retrieve(eq(mailbox), any(RetrievalRequest.class)))
                .thenReturn(new RetrievalResult(messages, List.of("invoice"), false));
        when(rankingService.rank(eq("user123"), eq(messages), any(), any(), any(), anyBoolean(), anyInt()))
                .thenReturn(new RankedMessages(scored, scored));
        when(reviewLoop.run(any(ReviewRequest.class)))
                .thenReturn(new ReviewOutcome(ReviewState.PASS, scored, 1, 1, null));
        List<Analysis> analyses = List.of(Analysis.builder().emailId("m0").summary("Invoice due").build());
        when(analysisService.analyzeAll(eq("user123"), eq(mailbox), anyList(), eq("find my invoices"), eq(IntentType.SEARCH)))
                .thenReturn(analyses);
        List<Suggestion> suggestions = List.of(Suggestion.builder()
                .type(SuggestionType.TASK).title("Pay invoice").details("Invoice due")
                .sourceEmailId("m0").priority(PriorityTier.HIGH).build());
        when(suggestionSynthesizer.synthesize(analyses, IntentType.SEARCH)).thenReturn(suggestions);

        // When
        PipelineResult result = pipelineService.run(searchRequest().build());

        // Then
        ArgumentCaptor<List<ScoredMessage>> selected = ArgumentCaptor.forClass(List.class);
        verify(analysisService).analyzeAll(eq("user123"), eq(mailbox), selected.capture(), any(), any());
        assertEquals(List.of("m0", "m1", "m2", "m3", "m4"), ids(selected.getValue()));
        verify(store).saveAnalyses(analyses);
        verify(store).saveSuggestions("user123", 7L, suggestions);

        ArgumentCaptor<Map<String, Object>> metadata = ArgumentCaptor.forClass(Map.class);
        verify(runRecorder).complete(eq(run), metadata.capture());
        assertEquals("PASS", metadata.getValue().get("reviewOutcome"));
        assertEquals(1, metadata.getValue().get("suggestionsCount"));
        assertEquals(7, metadata.getValue().get("prioritizedCount"));
        assertEquals(7, metadata.getValue().get("rankedCount"));
        assertEquals(ReviewState.PASS, result.getProvenance().getReviewOutcome());
        assertEquals(suggestions, result.getSuggestions());
    }

    @Test
    @SuppressWarnings("unchecked")
    void run_WhenReviewSelectsSubset_ShouldReturnItAsPrioritized() {
        // Given
        List<EmailMessage> messages = messages(5);
        List<ScoredMessage> scored = scoredAll(messages);
        List<ScoredMessage> accepted = List.of(scored.get(3), scored.get(1));
        when(mailboxAccessService.open(user)).thenReturn(mailbox);
        when(retrievalCascade.retrieve(eq(mailbox), any(RetrievalRequest.class)))
                .thenReturn(new RetrievalResult(messages, List.of("invoice"), false));
        when(rankingService.rank(eq("user123"), eq(messages), any(), any(), any(), anyBoolean(), anyInt()))
                .thenReturn(new RankedMessages(scored, scored.subList(0, 4)));
        when(reviewLoop.run(any(ReviewRequest.class)))
                .thenReturn(new ReviewOutcome(ReviewState.PASS, accepted, 1, 1, null));
        when(analysisService.analyzeAll(eq("user123"), eq(mailbox), eq(accepted), any(), any())).thenReturn(List.of());
        when(suggestionSynthesizer.synthesize(List.of(), IntentType.SEARCH)).thenReturn(List.of());

        // When
        PipelineResult result = pipelineService.run(searchRequest().build());

        // Then
        assertEquals(List.of("m3", "m1"), ids(result.getPrioritized()));
        assertEquals(List.of("m0", "m1", "m2", "m3"), ids(result.getRanked()));

        ArgumentCaptor<ReviewRequest> reviewRequest = ArgumentCaptor.forClass(ReviewRequest.class);
        verify(reviewLoop).run(reviewRequest.capture());
        assertEquals(4, reviewRequest.getValue().getCandidates().size());
        assertEquals(5, reviewRequest.getValue().getRetrieved().size());

        ArgumentCaptor<Map<String, Object>> metadata = ArgumentCaptor.forClass(Map.class);
        verify(runRecorder).complete(eq(run), metadata.capture());
        assertEquals(2, metadata.getValue().get("prioritizedCount"));
        assertEquals(4, metadata.getValue().get("rankedCount"));
    }

    @Test
    void run_ReplyIntent_ShouldAnalyzeFewerMessages() {
        // Given
        List<EmailMessage> messages = messages(4);
        List<ScoredMessage> scored = scoredAll(messages);
        when(intentClassifier.classify("reply to alice")).thenReturn(IntentType.REPLY);
        when(mailboxAccessService.open(user)).thenReturn(mailbox);
        when(retrievalCascade.retrieve(eq(mailbox), any(RetrievalRequest.class)))
                .thenReturn(new RetrievalResult(messages, List.of("alice"), false));
        when(rankingService.rank(eq("user123"), eq(messages), any(), any(), any(), anyBoolean(), anyInt()))
                .thenReturn(new RankedMessages(scored, scored));
        when(reviewLoop.run(any(ReviewRequest.class)))
                .thenReturn(new ReviewOutcome(ReviewState.FAIL_ACCEPTED, List.of(), 3, 3, "still off topic"));

        // When
        PipelineResult result = pipelineService.run(PipelineRequest.builder()
                .userId("user123").intent("reply to alice").keyword("alice").build());

        // Then
        verify(analysisService).analyzeAll(eq("user123"), eq(mailbox),
                eq(scored.subList(0, 2)), eq("reply to alice"), eq(IntentType.REPLY));
        assertEquals(ReviewState.FAIL_ACCEPTED, result.getProvenance().getReviewOutcome());
        assertEquals("still off topic", result.getProvenance().getReviewFeedback());
        assertEquals(ids(scored), ids(result.getPrioritized()));
    }

    private static PipelineRequest.PipelineRequestBuilder searchRequest() {
        return PipelineRequest.builder()
                .userId("user123")
                .intent("find my invoices")
                .keyword("invoice");
    }

    private static EmailMessage message(String id) {
        return EmailMessage.builder()
                .id(id)
                .threadId("t-" + id)
                .sender("billing@acme.com")
                .subject("Invoice " + id)
                .receivedAt(Instant.parse("2024-06-01T09:00:00Z"))
                .build();
    }

    private static List<EmailMessage> messages(int count) {
        List<EmailMessage> messages = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            messages.add(message("m" + i));
        }
        return messages;
    }

    private static List<ScoredMessage> scoredAll(List<EmailMessage> messages) {
        List<ScoredMessage> scored = new ArrayList<>();
        for (EmailMessage message : messages) {
            scored.add(ScoredMessage.heuristic(message, 2));
        }
        return scored;
    }

    private static List<String> ids(List<ScoredMessage> scored) {
        List<String> ids = new ArrayList<>();
        for (ScoredMessage message : scored) {
            ids.add(message.id());
        }
        return ids;
    }
}
