package email.assistant.app.review;

import lombok.Value;

@Value
public class Critique {
    public static final String UNPARSEABLE_FEEDBACK = "Failed to parse reviewer output";

    ReviewStatus status;
    String feedback;

    public static Critique pass(String feedback) {
        return new Critique(ReviewStatus.PASS, feedback);
    }

    public static Critique fail(String feedback) {
        return new Critique(ReviewStatus.FAIL, feedback);
    }

    public static Critique unparseable() {
        return fail(UNPARSEABLE_FEEDBACK);
    }

    public boolean passed() {
        return status == ReviewStatus.PASS;
    }
}
