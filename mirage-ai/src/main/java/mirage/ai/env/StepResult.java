package mirage.ai.env;

/**
 * What one {@link Environment#step(int)} produced. {@code state} is the
 * observation for whoever acts next.
 */
public final class StepResult {
    private final double[] state;
    private final double reward;
    private final boolean done;
    private final int actorIndex;
    private final int actionIndex;
    private final Outcome outcome;

    public StepResult(double[] state, double reward, boolean done, int actorIndex, int actionIndex, Outcome outcome) {
        this.state = state;
        this.reward = reward;
        this.done = done;
        this.actorIndex = actorIndex;
        this.actionIndex = actionIndex;
        this.outcome = outcome;
    }

    public double[] getState() { return state; }
    public double getReward() { return reward; }
    public boolean isDone() { return done; }

    /** 0 for single-participant environments. */
    public int getActorIndex() { return actorIndex; }
    public int getActionIndex() { return actionIndex; }
    public Outcome getOutcome() { return outcome; }

    public String getActionLabel() {
        return outcome.getAction().getLabel();
    }

    public String getOutcomeLabel() {
        return outcome.getLabel();
    }
}
