package email.assistant.app.retrieval;

import email.assistant.app.entity.RunStatus;
import email.assistant.app.repository.PipelineRunRepository;
import org.springframework.stereotype.Component;

/**
 * Decides how far back a run looks: since the last completed run, or one day when the
 * user has never completed one.
 */
@Component
public class TimeWindowPolicy {
    private final PipelineRunRepository runRepository;

    public TimeWindowPolicy(PipelineRunRepository runRepository) {
        this.runRepository = runRepository;
    }

    /**
     * @return a Gmail time filter, or null for a full scan
     */
    public String windowFor(String userId, boolean forceFullScan) {
        if (forceFullScan) {
            return null;
        }
        return runRepository.findFirstByUserIdAndStatusOrderByStartedAtDesc(userId, RunStatus.COMPLETED)
                .map(run -> "after:" + run.getStartedAt().getEpochSecond())
                .orElse(QueryExpressions.RECENT_ITEMS);
    }
}
