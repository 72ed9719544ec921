package email.assistant.app.suggestion;

import email.assistant.app.model.ActionItem;
import email.assistant.app.model.Analysis;
import email.assistant.app.model.IntentType;
import email.assistant.app.model.PriorityTier;
import email.assistant.app.model.Suggestion;
import email.assistant.app.model.SuggestionType;
import email.assistant.app.model.TravelDetails;
import email.assistant.app.model.TravelLeg;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns analyses into typed suggestions. Per-analysis rules are additive; search runs
 * also get at most one aggregate card, preferring the trip summary.
 */
@Slf4j
@Component
public class SuggestionSynthesizer {
    static final int REVIEW_TITLE_CHARS = 60;
    static final int NEXT_STEPS_EXCERPT_CHARS = 180;
    static final int NEXT_STEPS_TOP = 6;
    private static final String ELLIPSIS = "…";

    public List<Suggestion> synthesize(List<Analysis> analyses, IntentType intentType) {
        List<Suggestion> suggestions = new ArrayList<>();

        for (Analysis analysis : analyses) {
            String summary = analysis.getSummary() != null ? analysis.getSummary() : "";

            for (ActionItem action : analysis.getActions()) {
                PriorityTier priority = action.getPriority() != null
                        ? action.getPriority()
                        : (analysis.isUrgent() ? PriorityTier.HIGH : PriorityTier.MEDIUM);
                suggestions.add(Suggestion.builder()
                        .type(SuggestionType.TASK)
                        .title(action.getDescription())
                        .details("From email summary: " + summary)
                        .sourceEmailId(analysis.getEmailId())
                        .priority(priority)
                        .dueDate(action.getDueDate())
                        .build());
            }

            if (analysis.isUrgent() && analysis.getActions().isEmpty()) {
                suggestions.add(Suggestion.builder()
                        .type(SuggestionType.TASK)
                        .title("Review Urgent Email")
                        .details(summary)
                        .sourceEmailId(analysis.getEmailId())
                        .priority(PriorityTier.HIGH)
                        .build());
            }

            if (intentType != IntentType.SEARCH && analysis.getActions().isEmpty()) {
                suggestions.add(Suggestion.builder()
                        .type(SuggestionType.INFO)
                        .title("Review: " + abbreviate(summary, REVIEW_TITLE_CHARS))
                        .details("No explicit actions detected. Consider replying or archiving.")
                        .sourceEmailId(analysis.getEmailId())
                        .priority(PriorityTier.MEDIUM)
                        .build());
            }

            if (intentType == IntentType.REPLY && analysis.getReplyDraft() != null) {
                suggestions.add(Suggestion.builder()
                        .type(SuggestionType.REPLY)
                        .title("Suggested Reply")
                        .details(analysis.getReplyDraft())
                        .sourceEmailId(analysis.getEmailId())
                        .priority(PriorityTier.MEDIUM)
                        .build());
            }
        }

        if (intentType == IntentType.SEARCH && !analyses.isEmpty()) {
            Analysis travel = analyses.stream()
                    .filter(a -> a.getTravelDetails() != null)
                    .findFirst()
                    .orElse(null);
            suggestions.add(travel != null ? tripSummary(travel.getTravelDetails()) : nextSteps(analyses));
        }

        log.info("Generated {} suggestions from {} analyses", suggestions.size(), analyses.size());
        return suggestions;
    }

    static Suggestion tripSummary(TravelDetails details) {
        String reference = details.bookingReference();
        List<String> blocks = new ArrayList<>();
        if (reference != null) {
            blocks.add("Confirmation/PNR: " + reference);
        }
        if (!details.getLegs().isEmpty()) {
            blocks.add("Legs:\n" + details.getLegs().stream()
                    .map(SuggestionSynthesizer::describeLeg)
                    .collect(Collectors.joining("\n")));
        }
        blocks.add(String.join("\n",
                reference != null
                        ? "Add PNR " + reference + " to your calendar/notes and keep it handy for check-in."
                        : "Add this trip to your calendar and set a check-in reminder.",
                "Check baggage allowances and seat assignments before departure.",
                "Open the airline/OTA link to manage or change seats if needed."));

        return Suggestion.builder()
                .type(SuggestionType.INFO)
                .title("Trip summary")
                .details(String.join("\n\n", blocks))
                .priority(PriorityTier.HIGH)
                .build();
    }

    static Suggestion nextSteps(List<Analysis> analyses) {
        String bullets = analyses.stream()
                .sorted(Comparator.comparingDouble(Analysis::relevanceOrZero).reversed())
                .limit(NEXT_STEPS_TOP)
                .map(a -> "- " + abbreviate(a.getSummary() != null ? a.getSummary() : "", NEXT_STEPS_EXCERPT_CHARS))
                .collect(Collectors.joining("\n"));
        String followUps = String.join("\n",
                "Reply or forward key emails that match your query.",
                "Save important links/codes into your tracker.",
                "Set reminders for any dates or deadlines mentioned.");

        return Suggestion.builder()
                .type(SuggestionType.INFO)
                .title("Next steps for your search")
                .details("Top matches:\n" + bullets + "\n\nRecommended actions:\n" + followUps)
                .priority(PriorityTier.MEDIUM)
                .build();
    }

    private static String describeLeg(TravelLeg leg) {
        StringBuilder line = new StringBuilder("- ")
                .append(leg.getFrom() != null ? leg.getFrom() : "?")
                .append(" → ")
                .append(leg.getTo() != null ? leg.getTo() : "?");
        if (leg.getDate() != null) {
            line.append(" (").append(leg.getDate()).append(')');
        }
        if (leg.getDepartTime() != null) {
            line.append(' ').append(leg.getDepartTime());
        }
        if (leg.getArriveTime() != null) {
            line.append(" → ").append(leg.getArriveTime());
        }
        return line.toString();
    }

    private static String abbreviate(String text, int max) {
        return text.length() > max ? text.substring(0, max) + ELLIPSIS : text;
    }
}
