package email.assistant.app.analysis;

import email.assistant.app.model.EmailMessage;
import email.assistant.app.model.TravelDetails;
import email.assistant.app.model.TravelLeg;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex-based itinerary extraction for booking and confirmation emails.
 */
@Component
public class TravelDetailsExtractor {
    private static final List<String> TRAVEL_KEYWORDS = List.of(
            "flight", "itinerary", "itenerary", "trip", "pnr", "confirmation", "boarding", "depart", "arrival", "airport");
    private static final Pattern AIRLINE_HINT = Pattern.compile(
            "(airlines?|airways?|delta|united|american|alaska|frontier|spirit|jetblue|southwest|lufthansa|qatar|emirates|"
            + "etihad|air france|klm|qantas|turkish|alitalia|british airways|virgin|expedia|booking\\.com|orbitz|"
            + "travelocity|air canada)", Pattern.CASE_INSENSITIVE);
    private static final Pattern LABELLED_PNR = Pattern.compile(
            "(confirmation|record locator|pnr|booking reference)[^\\w]{0,6}([A-Z0-9]{6})\\b", Pattern.CASE_INSENSITIVE);
    // six characters mixing letters and digits
    private static final Pattern BARE_PNR = Pattern.compile("\\b(?=[A-Z0-9]*\\d)(?=[A-Z0-9]*[A-Z])([A-Z0-9]{6})\\b");
    private static final Pattern PASSENGER = Pattern.compile("\\b([A-Z][a-z]+(?:\\s+[A-Z][a-z]+)+)\\b");
    private static final Pattern LEG = Pattern.compile("\\b([A-Z]{3})\\s*(?:-|–|—|→|to)\\s*([A-Z]{3})\\b");
    private static final Pattern FLIGHT = Pattern.compile("\\b([A-Z]{2,3}\\s?\\d{2,4})\\b");
    private static final int MAX_PASSENGERS = 3;

    /**
     * @return itinerary facts, or null when the text does not look like travel or carries
     *         no booking reference, leg or flight number
     */
    public TravelDetails extract(EmailMessage message, String text) {
        String body = text != null ? text : "";
        String lower = body.toLowerCase(Locale.ROOT);
        String subject = message.getSubject() != null ? message.getSubject().toLowerCase(Locale.ROOT) : "";
        boolean looksTravel = TRAVEL_KEYWORDS.stream().anyMatch(k -> lower.contains(k) || subject.contains(k))
                || AIRLINE_HINT.matcher(body).find();
        if (!looksTravel) {
            return null;
        }

        String pnr = null;
        Matcher labelled = LABELLED_PNR.matcher(body);
        if (labelled.find()) {
            pnr = labelled.group(2).toUpperCase(Locale.ROOT);
        } else {
            Matcher bare = BARE_PNR.matcher(body);
            if (bare.find()) {
                pnr = bare.group(1);
            }
        }

        TravelDetails.TravelDetailsBuilder builder = TravelDetails.builder();
        Matcher legs = LEG.matcher(body);
        boolean hasLeg = false;
        while (legs.find()) {
            builder.leg(TravelLeg.builder().from(legs.group(1)).to(legs.group(2)).build());
            hasLeg = true;
        }

        Matcher flightMatcher = FLIGHT.matcher(body);
        String flight = flightMatcher.find() ? flightMatcher.group(1).replaceAll("\\s+", " ") : null;

        if (pnr == null && !hasLeg && flight == null) {
            return null;
        }

        Set<String> passengers = new LinkedHashSet<>();
        Matcher names = PASSENGER.matcher(body);
        while (names.find() && passengers.size() < MAX_PASSENGERS) {
            String name = names.group(1);
            if (name.length() < 40) {
                passengers.add(name);
            }
        }

        return builder
                .pnr(pnr)
                .confirmationNumber(pnr)
                .flight(flight)
                .passengers(passengers)
                .build();
    }
}
