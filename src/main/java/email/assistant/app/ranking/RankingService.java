package email.assistant.app.ranking;

import email.assistant.app.model.ContextSignals;
import email.assistant.app.model.EmailMessage;
import email.assistant.app.model.PriorityTier;
import email.assistant.app.model.ScoredMessage;
import email.assistant.app.model.UserPreferences;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
public class RankingService {
    private final HeuristicScorer heuristicScorer;
    private final SemanticRanker semanticRanker;

    public RankingService(HeuristicScorer heuristicScorer, SemanticRanker semanticRanker) {
        this.heuristicScorer = heuristicScorer;
        this.semanticRanker = semanticRanker;
    }

    /**
     * Heuristic scoring, then the semantic pass when there is an intent, truncated to the budget.
     */
    public RankedMessages rank(String userId, List<EmailMessage> messages, String intent,
                               UserPreferences preferences, ContextSignals context,
                               boolean forceRefresh, int budget) {
        List<ScoredMessage> scored = heuristicScorer.scoreAll(messages, intent, preferences, context);
        log.info("Heuristic tiers for {} messages: high={}, medium={}, low={}", scored.size(),
                count(scored, PriorityTier.HIGH), count(scored, PriorityTier.MEDIUM), count(scored, PriorityTier.LOW));

        List<ScoredMessage> ranked = scored;
        if (intent != null && !intent.isBlank() && !ranked.isEmpty()) {
            ranked = semanticRanker.rerank(userId, intent, ranked, forceRefresh);
        }
        if (ranked.size() > budget) {
            ranked = ranked.subList(0, budget);
        }
        return new RankedMessages(List.copyOf(scored), List.copyOf(ranked));
    }

    private static long count(List<ScoredMessage> ranked, PriorityTier tier) {
        return ranked.stream().filter(s -> s.getTier() == tier).count();
    }
}
