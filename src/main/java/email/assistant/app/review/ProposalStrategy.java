package email.assistant.app.review;

import email.assistant.app.model.ScoredMessage;

import java.util.List;

public interface ProposalStrategy {

    /**
     * Picks the prioritized subset of the candidates, most important first.
     * @param feedback the previous round's critique, null on the first round
     */
    List<ScoredMessage> propose(ReviewRequest request, String feedback);
}
