package email.assistant.app.analysis;

import email.assistant.app.model.IntentType;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

@Component
public class IntentClassifier {
    private static final List<String> REPLY_TRIGGERS =
            List.of("reply", "respond", "draft", "follow up", "follow-up", "response");

    /**
     * No intent is a passive processing run; intents asking for a reply are reply runs;
     * everything else is a search.
     */
    public IntentType classify(String intent) {
        if (intent == null || intent.isBlank()) {
            return IntentType.PROCESS;
        }
        String lower = intent.toLowerCase(Locale.ROOT);
        return REPLY_TRIGGERS.stream().anyMatch(lower::contains) ? IntentType.REPLY : IntentType.SEARCH;
    }
}
