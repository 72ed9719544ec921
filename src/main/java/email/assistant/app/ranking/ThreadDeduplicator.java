package email.assistant.app.ranking;

import email.assistant.app.model.ScoredMessage;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps one message per thread so deep analysis is not spent twice on a conversation.
 * The latest message wins and takes the slot of the thread's first ranked member.
 */
@Component
public class ThreadDeduplicator {

    public List<ScoredMessage> dedup(List<ScoredMessage> ranked) {
        Map<String, ScoredMessage> representatives = new LinkedHashMap<>();
        for (ScoredMessage candidate : ranked) {
            String threadId = candidate.getMessage().getThreadId();
            String key = threadId != null && !threadId.isBlank() ? "t:" + threadId : "m:" + candidate.id();
            ScoredMessage current = representatives.get(key);
            if (current == null || isLater(candidate, current)) {
                // re-putting an existing key keeps its position
                representatives.put(key, candidate);
            }
        }
        return new ArrayList<>(representatives.values());
    }

    private static boolean isLater(ScoredMessage candidate, ScoredMessage current) {
        Instant candidateAt = candidate.getMessage().getReceivedAt();
        Instant currentAt = current.getMessage().getReceivedAt();
        if (candidateAt == null) {
            return false;
        }
        return currentAt == null || candidateAt.isAfter(currentAt);
    }
}
