package mirage.ai.env;

/**
 * Big Five personality scalars, each in [0, 1].
 */
public enum Trait {
    OPENNESS("O"),
    CONSCIENTIOUSNESS("C"),
    EXTRAVERSION("E"),
    AGREEABLENESS("A"),
    NEUROTICISM("N");

    public static final double NEUTRAL = 0.5;

    private final String code;

    Trait(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /** Accepts the one-letter code or the full name, case-insensitive. */
    public static Trait parse(String s) {
        for (Trait t : values()) {
            if (t.code.equalsIgnoreCase(s) || t.name().equalsIgnoreCase(s)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown personality trait: " + s);
    }
}
