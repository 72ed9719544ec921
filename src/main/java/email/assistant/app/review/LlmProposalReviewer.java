package email.assistant.app.review;

import email.assistant.app.config.AssistantProperties;
import email.assistant.app.model.ScoredMessage;
import email.assistant.app.service.LanguageModelService;
import email.assistant.app.service.ModelJsonParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

@Slf4j
@Component
public class LlmProposalReviewer implements ProposalCritic {
    static final String REVIEWER_PROMPT =
        "You are a strict reviewer that audits an email prioritization.\n\n" +
        "You receive the user's query, the candidate emails and the emails that were selected.\n" +
        "Check that the selection is clearly relevant to the query and reasonable given the other candidates. " +
        "Look for obvious problems: highly relevant emails that were missed, irrelevant emails that were selected, " +
        "or the wrong type of email for the request (for example newsletters instead of flight confirmations).\n\n" +
        "Return a single JSON object with \"status\" (\"PASS\" or \"FAIL\") and \"feedback\" " +
        "(a short, specific explanation of what is wrong and what should be selected instead). " +
        "Use PASS when the selection would likely satisfy the request.";

    private static final int MAX_LISTED_CANDIDATES = 40;

    private final LanguageModelService languageModelService;
    private final ModelJsonParser jsonParser;
    private final AssistantProperties properties;

    public LlmProposalReviewer(LanguageModelService languageModelService, ModelJsonParser jsonParser,
                               AssistantProperties properties) {
        this.languageModelService = languageModelService;
        this.jsonParser = jsonParser;
        this.properties = properties;
    }

    @Override
    public Critique review(ReviewRequest request, List<ScoredMessage> proposal) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Query: \"").append(request.getIntent() != null ? request.getIntent() : "triage recent mail").append("\"\n\n");
        prompt.append("Candidate Emails:\n");
        request.getCandidates().stream().limit(MAX_LISTED_CANDIDATES)
                .forEach(c -> prompt.append("- [").append(c.id()).append("] ").append(c.getMessage().getSubject()).append('\n'));
        prompt.append("\nSelected Emails:\n");
        proposal.forEach(p -> prompt.append("Subject: ").append(p.getMessage().getSubject()).append('\n'));

        String raw = languageModelService.complete(REVIEWER_PROMPT, prompt.toString(), properties.getReview().getModel(), true);
        if (raw == null) {
            return null;
        }
        return jsonParser.parseObject(raw)
                .map(json -> {
                    String feedback = json.path("feedback").asText("");
                    return "PASS".equalsIgnoreCase(json.path("status").asText()) ? Critique.pass(feedback) : Critique.fail(feedback);
                })
                .recover(text -> {
                    log.error("Failed to parse reviewer output: {}", text);
                    return Critique.unparseable();
                });
    }
}
