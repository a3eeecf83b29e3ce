package mirage.ai.env;

import java.util.Set;

/**
 * Result of resolving one action: which branch happened, its label, the
 * reward and the targeted effects that apply to the actor.
 */
public final class Outcome {
    private final ActionSpec action;
    private final boolean success;
    private final double successProbability;
    private final double reward;

    public Outcome(ActionSpec action, boolean success, double successProbability, double reward) {
        this.action = action;
        this.success = success;
        this.successProbability = successProbability;
        this.reward = reward;
    }

    public ActionSpec getAction() { return action; }
    public boolean isSuccess() { return success; }
    public double getSuccessProbability() { return successProbability; }
    public double getReward() { return reward; }

    public String getLabel() {
        return success ? action.getSuccessLabel() : action.getFailureLabel();
    }

    public Set<Effect> getEffects() {
        return success ? action.getSuccessEffects() : action.getFailureEffects();
    }

    /** Same outcome with a different reward, used by partner-dependent scaling. */
    public Outcome withReward(double newReward) {
        return new Outcome(action, success, successProbability, newReward);
    }
}
