package email.assistant.app.service;

import email.assistant.app.analysis.ContextService;
import email.assistant.app.analysis.EmailAnalysisService;
import email.assistant.app.analysis.IntentClassifier;
import email.assistant.app.analysis.IntentKeywordExtractor;
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
import email.assistant.app.model.RunProvenance;
import email.assistant.app.model.ScoredMessage;
import email.assistant.app.model.Suggestion;
import email.assistant.app.model.UserPreferences;
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
import email.assistant.app.suggestion.SuggestionSynthesizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs one end-to-end pass for a user: retrieve, rank, review, analyze, suggest.
 * Each run gets a row in the runs table; any failure marks it failed and surfaces
 * as {@link PipelineRunException}.
 */
@Slf4j
@Service
public class AssistantPipelineService {
    private final UserRepository userRepository;
    private final MailboxAccessService mailboxAccessService;
    private final EmbeddingCache embeddingCache;
    private final IntentClassifier intentClassifier;
    private final IntentKeywordExtractor keywordExtractor;
    private final TimeWindowPolicy timeWindowPolicy;
    private final RetrievalCascade retrievalCascade;
    private final ContextService contextService;
    private final RankingService rankingService;
    private final ThreadDeduplicator threadDeduplicator;
    private final ReviewLoop reviewLoop;
    private final EmailAnalysisService analysisService;
    private final SuggestionSynthesizer suggestionSynthesizer;
    private final PipelineStore store;
    private final RunRecorder runRecorder;
    private final AssistantProperties properties;

    public AssistantPipelineService(
            UserRepository userRepository,
            MailboxAccessService mailboxAccessService,
            EmbeddingCache embeddingCache,
            IntentClassifier intentClassifier,
            IntentKeywordExtractor keywordExtractor,
            TimeWindowPolicy timeWindowPolicy,
            RetrievalCascade retrievalCascade,
            ContextService contextService,
            RankingService rankingService,
            ThreadDeduplicator threadDeduplicator,
            ReviewLoop reviewLoop,
            EmailAnalysisService analysisService,
            SuggestionSynthesizer suggestionSynthesizer,
            PipelineStore store,
            RunRecorder runRecorder,
            AssistantProperties properties) {
        this.userRepository = userRepository;
        this.mailboxAccessService = mailboxAccessService;
        this.embeddingCache = embeddingCache;
        this.intentClassifier = intentClassifier;
        this.keywordExtractor = keywordExtractor;
        this.timeWindowPolicy = timeWindowPolicy;
        this.retrievalCascade = retrievalCascade;
        this.contextService = contextService;
        this.rankingService = rankingService;
        this.threadDeduplicator = threadDeduplicator;
        this.reviewLoop = reviewLoop;
        this.analysisService = analysisService;
        this.suggestionSynthesizer = suggestionSynthesizer;
        this.store = store;
        this.runRecorder = runRecorder;
        this.properties = properties;
    }

    public PipelineResult run(PipelineRequest request) {
        Objects.requireNonNull(request.getUserId(), "userId");
        PipelineRun run = runRecorder.start(request.getUserId());
        log.info("Run {} started for user {} (intent: {})", run.getId(), request.getUserId(),
                request.hasIntent() ? request.getIntent() : "<passive>");
        try {
            return execute(run, request);
        } catch (RuntimeException e) {
            log.error("Run {} failed for user {}: {}", run.getId(), request.getUserId(), e.getMessage(), e);
            runRecorder.fail(run, e);
            throw new PipelineRunException(run.getId(), "Run " + run.getId() + " failed: " + e.getMessage(), e);
        }
    }

    private PipelineResult execute(PipelineRun run, PipelineRequest request) {
        String userId = request.getUserId();
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new MailboxAccessException("Unknown user " + userId));

        boolean hasIntent = request.hasIntent();
        String intent = hasIntent ? request.getIntent().trim() : null;
        IntentType intentType = intentClassifier.classify(intent);

        boolean forceRefresh = false;
        if (hasIntent && !intent.equals(user.getLastIntent())) {
            // embeddings were computed against another intent
            embeddingCache.invalidateUser(userId);
            user.setLastIntent(intent);
            userRepository.save(user);
            forceRefresh = true;
        }

        List<String> keywords = request.getKeywords();
        if (hasIntent && keywords.isEmpty() && request.getMustHave().isEmpty() && request.getNiceToHave().isEmpty()) {
            keywords = keywordExtractor.extract(intent).getKeywords();
        }

        MailboxClient mailbox = mailboxAccessService.open(user);

        boolean forceFullScan = request.getForceFullScan() != null ? request.getForceFullScan() : hasIntent;
        String window = timeWindowPolicy.windowFor(userId, forceFullScan);
        int maxResults = request.getMaxResults() != null ? request.getMaxResults()
                : hasIntent ? properties.getRetrieval().getSearchMaxResults()
                : properties.getRetrieval().getPassiveMaxResults();

        RetrievalResult retrieval = retrievalCascade.retrieve(mailbox, RetrievalRequest.builder()
                .intent(intent)
                .keywords(keywords)
                .mustHave(request.getMustHave())
                .niceToHave(request.getNiceToHave())
                .timeWindow(window)
                .maxResults(maxResults)
                .build());
        store.saveRetrieved(userId, retrieval.getMessages());

        List<EmailMessage> messages = retrieval.getMessages();
        boolean storedFallbackUsed = false;
        if (messages.isEmpty() && hasIntent) {
            messages = store.recentMessages(userId, properties.getRetrieval().getStoredFallbackDays(),
                    properties.getRetrieval().getStoredFallbackLimit());
            storedFallbackUsed = !messages.isEmpty();
            log.info("Mailbox returned nothing for run {}; {} stored messages used instead", run.getId(), messages.size());
        }

        RunProvenance.RunProvenanceBuilder provenance = RunProvenance.builder()
                .runId(run.getId())
                .intentType(intentType)
                .queriesUsed(retrieval.getQueriesUsed())
                .storedFallbackUsed(storedFallbackUsed)
                .retrievedCount(messages.size());

        if (messages.isEmpty()) {
            runRecorder.complete(run, metadata(retrieval, 0, 0));
            return PipelineResult.builder()
                    .prioritized(List.of())
                    .ranked(List.of())
                    .analyses(List.of())
                    .suggestions(List.of())
                    .context(ContextSignals.empty())
                    .provenance(provenance.build())
                    .build();
        }

        ContextSignals context = contextService.gather(userId, messages);
        UserPreferences preferences = UserPreferences.of(user.getVipSenders(), user.getUrgentKeywords());
        int budget = request.getLimit() != null ? request.getLimit()
                : hasIntent ? properties.getRanking().getSearchLimit()
                : properties.getRanking().getPassiveLimit();
        RankedMessages ranked = rankingService.rank(userId, messages, intent, preferences, context, forceRefresh, budget);
        store.savePriorities(ranked.getScored());

        List<ScoredMessage> deduped = threadDeduplicator.dedup(ranked.getRanked());
        log.info("Run {}: {} retrieved, {} ranked, {} after thread dedup", run.getId(), messages.size(),
                ranked.getRanked().size(), deduped.size());

        if (request.isQuickMode()) {
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("quickMode", true);
            metadata.put("emailCount", deduped.size());
            runRecorder.complete(run, metadata);
            return PipelineResult.builder()
                    .prioritized(deduped)
                    .ranked(deduped)
                    .analyses(List.of())
                    .suggestions(List.of())
                    .context(context)
                    .provenance(provenance.build())
                    .build();
        }

        ReviewOutcome review = reviewLoop.run(ReviewRequest.builder()
                .intent(intent)
                .keywords(keywords)
                .mustHave(request.getMustHave())
                .niceToHave(request.getNiceToHave())
                .candidates(deduped)
                .retrieved(ranked.getScored())
                .maxAttempts(properties.getReview().getMaxAttempts())
                .build());
        provenance.reviewOutcome(review.getFinalState())
                .reviewAttempts(review.getAttempts())
                .reviewFeedback(review.getFeedback());

        List<ScoredMessage> proposal = review.getProposal();
        if (proposal.isEmpty()) {
            log.warn("Review for run {} selected nothing; analyzing the top ranked messages", run.getId());
            proposal = deduped;
        }
        int maxAnalyze = request.getMaxAnalyze() != null ? request.getMaxAnalyze()
                : intentType == IntentType.REPLY ? properties.getAnalysis().getReplyMaxAnalyze()
                : properties.getAnalysis().getMaxAnalyze();
        List<ScoredMessage> selected = proposal.subList(0, Math.min(maxAnalyze, proposal.size()));

        List<Analysis> analyses = analysisService.analyzeAll(userId, mailbox, selected, intent, intentType);
        store.saveAnalyses(analyses);

        List<Suggestion> suggestions = suggestionSynthesizer.synthesize(analyses, intentType);
        store.saveSuggestions(userId, run.getId(), suggestions);

        Map<String, Object> metadata = metadata(retrieval, proposal.size(), suggestions.size());
        metadata.put("rankedCount", deduped.size());
        metadata.put("analyzedCount", analyses.size());
        metadata.put("storedFallbackUsed", storedFallbackUsed);
        metadata.put("reviewOutcome", review.getFinalState().name());
        metadata.put("reviewAttempts", review.getAttempts());
        runRecorder.complete(run, metadata);
        log.info("Run {} completed: {} analyses, {} suggestions", run.getId(), analyses.size(), suggestions.size());

        return PipelineResult.builder()
                .prioritized(proposal)
                .ranked(deduped)
                .analyses(analyses)
                .suggestions(suggestions)
                .context(context)
                .provenance(provenance.build())
                .build();
    }

    private static Map<String, Object> metadata(RetrievalResult retrieval, int prioritizedCount, int suggestionsCount) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("queries", retrieval.getQueriesUsed());
        metadata.put("failsafeUsed", retrieval.isFailsafeUsed());
        metadata.put("retrievedCount", retrieval.getMessages().size());
        metadata.put("prioritizedCount", prioritizedCount);
        metadata.put("suggestionsCount", suggestionsCount);
        return metadata;
    }
}
