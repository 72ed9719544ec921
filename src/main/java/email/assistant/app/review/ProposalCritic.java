package email.assistant.app.review;

import email.assistant.app.model.ScoredMessage;

import java.util.List;

public interface ProposalCritic {

    /**
     * @return the verdict, or null when the critic could not be reached
     */
    Critique review(ReviewRequest request, List<ScoredMessage> proposal);
}
