package mirage.ai.env;

public enum Emotion {
    JOY,
    ANGER,
    SADNESS,
    FEAR;

    public static final double NEUTRAL = 0.25;

    public static Emotion parse(String s) {
        for (Emotion e : values()) {
            if (e.name().equalsIgnoreCase(s)) {
                return e;
            }
        }
        throw new IllegalArgumentException("Unknown emotion: " + s);
    }
}
