package email.assistant.app.model;

import lombok.Value;

import java.util.List;

@Value
public class BehaviorInsight {
    String type;
    String description;
    double confidence;
    List<String> senders;
}
