package email.assistant.app.model;

import lombok.Value;

import java.util.ArrayList;
import java.util.List;

@Value
public class UserPreferences {
    public static final List<String> DEFAULT_URGENT_KEYWORDS =
            List.of("urgent", "asap", "deadline", "important", "action required");

    List<String> vipSenders;
    List<String> urgentKeywords;

    public static UserPreferences defaults() {
        return of(List.of(), List.of());
    }

    /**
     * Builds preferences with the default urgent keywords followed by the user's extras.
     */
    public static UserPreferences of(List<String> vipSenders, List<String> extraUrgentKeywords) {
        List<String> urgent = new ArrayList<>(DEFAULT_URGENT_KEYWORDS);
        if (extraUrgentKeywords != null) {
            for (String keyword : extraUrgentKeywords) {
                if (keyword != null && !keyword.isBlank()) {
                    urgent.add(keyword.toLowerCase());
                }
            }
        }
        return new UserPreferences(
                vipSenders != null ? List.copyOf(vipSenders) : List.of(),
                List.copyOf(urgent));
    }
}
