package mirage.ai.training;

/**
 * Overall reading of a two-party match from the participants' reward totals.
 */
public enum Verdict {
    FIRST_DOMINATES("participant 1 dominates"),
    SECOND_DOMINATES("participant 2 dominates"),
    MUTUAL_BENEFIT("mutual benefit"),
    MUTUAL_LOSS("mutual loss"),
    UNDETERMINED("undetermined");

    private final String description;

    Verdict(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Dominance means a positive total that out-scores the other side by more
     * than half again; it is checked before the sign-based readings. Two
     * negative totals are never a dominance.
     */
    public static Verdict of(double first, double second) {
        if (first > 0 && first > second * 1.5) {
            return FIRST_DOMINATES;
        }
        if (second > 0 && second > first * 1.5) {
            return SECOND_DOMINATES;
        }
        if (first > 0 && second > 0) {
            return MUTUAL_BENEFIT;
        }
        if (first < 0 && second < 0) {
            return MUTUAL_LOSS;
        }
        return UNDETERMINED;
    }
}
