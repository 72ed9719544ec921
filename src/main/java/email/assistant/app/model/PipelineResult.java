package email.assistant.app.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Everything a caller needs to render a run without re-deriving it.
 */
@Value
@Builder
public class PipelineResult {
    /** Messages accepted by the review loop, most important first. Equal to {@code ranked} in quick mode. */
    List<ScoredMessage> prioritized;
    /** Every ranked message after thread dedup. */
    List<ScoredMessage> ranked;
    List<Analysis> analyses;
    List<Suggestion> suggestions;
    ContextSignals context;
    RunProvenance provenance;
}
