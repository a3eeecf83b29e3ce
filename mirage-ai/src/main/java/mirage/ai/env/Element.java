package mirage.ai.env;

/**
 * Elemental affinities. Values are non-negative weights; they are either
 * proportions already or raw counts that the encoders normalize.
 */
public enum Element {
    METAL,
    WOOD,
    WATER,
    FIRE,
    EARTH;

    public static final double NEUTRAL = 0.2;

    public static Element parse(String s) {
        for (Element e : values()) {
            if (e.name().equalsIgnoreCase(s)) {
                return e;
            }
        }
        throw new IllegalArgumentException("Unknown element: " + s);
    }
}
