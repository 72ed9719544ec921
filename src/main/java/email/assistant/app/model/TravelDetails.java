package email.assistant.app.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Itinerary facts pulled out of a booking or confirmation email.
 */
@Value
@Builder
public class TravelDetails {
    String pnr;
    @Singular
    List<String> passengers;
    @Singular
    List<TravelLeg> legs;
    String flight;
    String confirmationNumber;

    public String bookingReference() {
        return pnr != null ? pnr : confirmationNumber;
    }
}
