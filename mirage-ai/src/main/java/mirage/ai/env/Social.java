package mirage.ai.env;

public enum Social {
    REPUTATION,
    TRUST,
    WEALTH,
    STATUS;

    public static final double NEUTRAL = 0.5;

    public static Social parse(String s) {
        for (Social v : values()) {
            if (v.name().equalsIgnoreCase(s)) {
                return v;
            }
        }
        throw new IllegalArgumentException("Unknown social attribute: " + s);
    }
}
