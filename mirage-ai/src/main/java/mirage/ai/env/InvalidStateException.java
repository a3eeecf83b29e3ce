package mirage.ai.env;

/**
 * {@code step} was called while the environment was not ACTIVE.
 */
public class InvalidStateException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    private final Phase phase;

    public InvalidStateException(Phase phase) {
        super("step() requires an ACTIVE environment but it is " + phase + "; call reset() first");
        this.phase = phase;
    }

    public Phase getPhase() {
        return phase;
    }
}
