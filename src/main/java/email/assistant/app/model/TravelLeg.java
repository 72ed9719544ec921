package email.assistant.app.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TravelLeg {
    String from;
    String to;
    String date;
    String departTime;
    String arriveTime;
    String flight;
}
