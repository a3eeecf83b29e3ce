package mirage.ai.env;

/**
 * Environment pressures acting on a participant. Threat, opportunity and
 * social pressure random-walk within [0, 1]; time pressure only ever rises.
 */
public enum Pressure {
    THREAT(0.1),
    OPPORTUNITY(0.3),
    SOCIAL(0.2),
    TIME(0.1);

    public static final double WALK_STEP = 0.1;
    public static final double TIME_INCREMENT = 0.05;

    private final double initial;

    Pressure(double initial) {
        this.initial = initial;
    }

    public double getInitial() {
        return initial;
    }
}
