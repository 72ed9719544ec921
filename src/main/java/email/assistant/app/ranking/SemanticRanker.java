package email.assistant.app.ranking;

import email.assistant.app.analysis.EmailExcerpts;
import email.assistant.app.cache.EmbeddingCache;
import email.assistant.app.config.AssistantProperties;
import email.assistant.app.model.ScoredMessage;
import email.assistant.app.service.LanguageModelService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Second ranking pass for runs with an intent: tier weight plus weighted cosine
 * similarity between each message and the intent.
 */
@Slf4j
@Component
public class SemanticRanker {
    private final LanguageModelService languageModelService;
    private final EmbeddingCache embeddingCache;
    private final AssistantProperties properties;

    public SemanticRanker(LanguageModelService languageModelService, EmbeddingCache embeddingCache,
                          AssistantProperties properties) {
        this.languageModelService = languageModelService;
        this.embeddingCache = embeddingCache;
        this.properties = properties;
    }

    /**
     * @param heuristicOrdered candidates in heuristic order, which breaks ties
     * @param forceRefresh recompute every embedding instead of reading the cache
     * @return the candidates with combined scores, best first; unchanged when the intent
     *         cannot be embedded
     */
    public List<ScoredMessage> rerank(String userId, String intent, List<ScoredMessage> heuristicOrdered, boolean forceRefresh) {
        float[] intentVector = languageModelService.embed(intent);
        if (intentVector == null) {
            log.warn("Intent embedding unavailable, keeping heuristic order for {} messages", heuristicOrdered.size());
            return heuristicOrdered;
        }

        double weight = properties.getRanking().getSimilarityWeight();
        List<ScoredMessage> combined = new ArrayList<>(heuristicOrdered.size());
        for (ScoredMessage scored : heuristicOrdered) {
            double similarity = 0.0;
            try {
                similarity = VectorMath.cosine(messageVector(userId, scored, forceRefresh), intentVector);
            } catch (RuntimeException e) {
                log.warn("Embedding failed for message {}, similarity set to 0: {}", scored.id(), e.getMessage());
            }
            combined.add(scored.withCombinedScore(scored.getTier().weight() + weight * similarity));
        }
        // stable sort keeps heuristic order on ties
        combined.sort(Comparator.comparingDouble(ScoredMessage::getCombinedScore).reversed());
        return combined;
    }

    private float[] messageVector(String userId, ScoredMessage scored, boolean forceRefresh) {
        if (!forceRefresh) {
            float[] cached = embeddingCache.get(userId, scored.id()).orElse(null);
            if (cached != null) {
                return cached;
            }
        }
        float[] vector = languageModelService.embed(EmailExcerpts.embeddingText(scored.getMessage()));
        if (vector != null) {
            embeddingCache.put(userId, scored.id(), vector);
        } else {
            log.debug("No embedding for message {}", scored.id());
        }
        return vector;
    }
}
