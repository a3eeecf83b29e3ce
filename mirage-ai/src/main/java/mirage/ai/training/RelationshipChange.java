package mirage.ai.training;

/**
 * How an interaction moved the relationship, from the mean of both totals.
 */
public enum RelationshipChange {
    SIGNIFICANTLY_IMPROVED("significantly improved"),
    SLIGHTLY_IMPROVED("slightly improved"),
    UNCHANGED("unchanged"),
    SLIGHTLY_WORSENED("slightly worsened"),
    SIGNIFICANTLY_WORSENED("significantly worsened");

    private final String description;

    RelationshipChange(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public static RelationshipChange of(double first, double second) {
        double score = (first + second) / 2.0;
        if (score > 5) {
            return SIGNIFICANTLY_IMPROVED;
        }
        if (score > 2) {
            return SLIGHTLY_IMPROVED;
        }
        if (score < -5) {
            return SIGNIFICANTLY_WORSENED;
        }
        if (score < -2) {
            return SLIGHTLY_WORSENED;
        }
        return UNCHANGED;
    }
}
