package email.assistant.app.ranking;

public final class VectorMath {

    private VectorMath() {
    }

    /**
     * Cosine similarity in [-1, 1]. Zero when either vector is missing, empty, of a
     * different length, or has zero norm.
     */
    public static double cosine(float[] a, float[] b) {
        if (a == null || b == null || a.length == 0 || a.length != b.length) {
            return 0.0;
        }
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0 || normB == 0) {
            return 0.0;
        }
        double similarity = dot / (Math.sqrt(normA) * Math.sqrt(normB));
        // rounding can push parallel vectors just past 1
        return Math.max(-1.0, Math.min(1.0, similarity));
    }
}
