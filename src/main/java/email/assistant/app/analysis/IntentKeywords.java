package email.assistant.app.analysis;

import lombok.Value;

import java.util.List;

@Value
public class IntentKeywords {
    String goal;
    List<String> keywords;
}
