package mirage.ai.nn;

public final class NNConstants {
    private NNConstants() { }

    public static final int DEFAULT_HIDDEN = 64;          // width of both shared trunk layers
    public static final double DEFAULT_PROBABILITY_FLOOR = 1e-6;
    public static final int MIN_ACTIONS = 2;
    public static final int MAX_ACTIONS = 12;             // widest catalog (interaction)

    // Adam defaults
    public static final double ADAM_BETA1 = 0.9;
    public static final double ADAM_BETA2 = 0.999;
    public static final double ADAM_EPSILON = 1e-8;
}
