package email.assistant.app.model;

/**
 * Coarse priority bucket derived from a heuristic score.
 */
public enum PriorityTier {
    HIGH(3),
    MEDIUM(2),
    LOW(1);

    private final int weight;

    PriorityTier(int weight) {
        this.weight = weight;
    }

    public int weight() {
        return weight;
    }

    public String label() {
        return name().toLowerCase();
    }

    public static PriorityTier fromScore(int score) {
        if (score >= 4) {
            return HIGH;
        }
        if (score >= 2) {
            return MEDIUM;
        }
        return LOW;
    }

    /**
     * Lenient parse of model output such as "High" or "medium"; null when unrecognised.
     */
    public static PriorityTier fromLabel(String label) {
        if (label == null) {
            return null;
        }
        switch (label.trim().toLowerCase()) {
            case "high":
                return HIGH;
            case "medium":
                return MEDIUM;
            case "low":
                return LOW;
            default:
                return null;
        }
    }
}
