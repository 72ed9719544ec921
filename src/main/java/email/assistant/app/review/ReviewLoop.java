package email.assistant.app.review;

import email.assistant.app.model.ScoredMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Propose, review, and retry with the critique as guidance. A failing review is retried
 * while the attempt counter is within {@code maxAttempts}; after that the current proposal
 * is accepted so the run can continue.
 */
@Slf4j
@Component
public class ReviewLoop {
    private final ProposalStrategy proposer;
    private final ProposalCritic critic;

    public ReviewLoop(ProposalStrategy proposer, ProposalCritic critic) {
        this.proposer = proposer;
        this.critic = critic;
    }

    public ReviewOutcome run(ReviewRequest request) {
        if (request.getCandidates().isEmpty()) {
            log.info("No candidates to review, passing");
            return new ReviewOutcome(ReviewState.PASS, List.of(), 0, 0, null);
        }

        ReviewState state = ReviewState.PROPOSING;
        List<ScoredMessage> proposal = List.of();
        String feedback = null;
        int attempts = 0;
        int rounds = 0;

        while (!state.isTerminal()) {
            switch (state) {
                case PROPOSING:
                    proposal = proposer.propose(request, feedback);
                    rounds++;
                    log.info("Proposal round {} selected {} of {} messages", rounds, proposal.size(), request.getCandidates().size());
                    state = ReviewState.REVIEWING;
                    break;
                case REVIEWING:
                    Critique critique = critic.review(request, proposal);
                    attempts++;
                    if (critique == null) {
                        log.warn("Reviewer unavailable on attempt {}, accepting proposal", attempts);
                        critique = Critique.pass("Reviewer unavailable");
                    }
                    feedback = critique.getFeedback();
                    if (critique.passed()) {
                        state = ReviewState.PASS;
                    } else {
                        log.info("Review attempt {} failed: {}", attempts, feedback);
                        state = ReviewState.FAIL_RETRY;
                    }
                    break;
                case FAIL_RETRY:
                    if (attempts <= request.getMaxAttempts()) {
                        state = ReviewState.PROPOSING;
                    } else {
                        log.warn("Max review attempts reached ({}), proceeding with current proposal", attempts);
                        state = ReviewState.FAIL_ACCEPTED;
                    }
                    break;
                default:
                    throw new IllegalStateException("Unexpected review state " + state);
            }
        }
        return new ReviewOutcome(state, proposal, attempts, rounds, feedback);
    }
}
