package mirage.ai.env;

/**
 * Targeted side effects an outcome has on the acting participant, on top of
 * the generic success/failure adjustments.
 */
public enum Effect {
    /** Open conflict: health -0.1, anger +0.15. */
    CONFLICT,
    /** Brush with danger: fear +0.15. */
    DANGER,
    /** Gain: wealth +0.2. */
    WINDFALL,
    /** Material loss: wealth -0.15. */
    LOSS,
    /** Relationship built: trust +0.1, reputation +0.1. */
    BOND;

    void apply(EpisodicState s) {
        switch (this) {
            case CONFLICT:
                s.adjustHealth(-0.1);
                s.adjustEmotion(Emotion.ANGER, 0.15);
                break;
            case DANGER:
                s.adjustEmotion(Emotion.FEAR, 0.15);
                break;
            case WINDFALL:
                s.adjustWealth(0.2);
                break;
            case LOSS:
                s.adjustWealth(-0.15);
                break;
            case BOND:
                s.adjustTrust(0.1);
                s.adjustReputation(0.1);
                break;
            default:
                throw new IllegalStateException("Unhandled effect " + this);
        }
    }
}
