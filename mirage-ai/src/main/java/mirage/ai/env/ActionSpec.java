package mirage.ai.env;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * One entry of an action catalog: how personality and pressures shift the
 * success chance, what each branch is called, what it pays and which
 * targeted effects it carries.
 */
public final class ActionSpec {

    /** Additive adjustment to the 0.5 baseline success probability. */
    @FunctionalInterface
    public interface SuccessAdjustment {
        double adjust(CharacterProfile profile, EpisodicState state);
    }

    /** Personality-dependent reward bias added to both branches. */
    @FunctionalInterface
    public interface RewardBias {
        double bias(CharacterProfile profile);
    }

    private final String label;
    private final SuccessAdjustment adjustment;
    private final String successLabel;
    private final double successReward;
    private final Set<Effect> successEffects;
    private final String failureLabel;
    private final double failureReward;
    private final Set<Effect> failureEffects;
    private final RewardBias rewardBias;
    private final boolean prosocial;

    private ActionSpec(Builder b) {
        this.label = b.label;
        this.adjustment = b.adjustment;
        this.successLabel = b.successLabel;
        this.successReward = b.successReward;
        this.successEffects = Collections.unmodifiableSet(b.successEffects);
        this.failureLabel = b.failureLabel;
        this.failureReward = b.failureReward;
        this.failureEffects = Collections.unmodifiableSet(b.failureEffects);
        this.rewardBias = b.rewardBias;
        this.prosocial = b.prosocial;
    }

    public static Builder builder(String label) {
        return new Builder(label);
    }

    public String getLabel() { return label; }
    public String getSuccessLabel() { return successLabel; }
    public String getFailureLabel() { return failureLabel; }
    public double getSuccessReward() { return successReward; }
    public double getFailureReward() { return failureReward; }
    public Set<Effect> getSuccessEffects() { return successEffects; }
    public Set<Effect> getFailureEffects() { return failureEffects; }
    public boolean isProsocial() { return prosocial; }

    public double adjustment(CharacterProfile profile, EpisodicState state) {
        return adjustment.adjust(profile, state);
    }

    public double rewardBias(CharacterProfile profile) {
        return rewardBias.bias(profile);
    }

    @Override
    public String toString() {
        return label;
    }

    public static final class Builder {
        private final String label;
        private SuccessAdjustment adjustment = (p, s) -> 0.0;
        private String successLabel;
        private double successReward;
        private final Set<Effect> successEffects = EnumSet.noneOf(Effect.class);
        private String failureLabel;
        private double failureReward;
        private final Set<Effect> failureEffects = EnumSet.noneOf(Effect.class);
        private RewardBias rewardBias = p -> 0.0;
        private boolean prosocial;

        private Builder(String label) {
            this.label = label;
        }

        public Builder odds(SuccessAdjustment adjustment) {
            this.adjustment = adjustment;
            return this;
        }

        public Builder success(String outcome, double reward, Effect... effects) {
            this.successLabel = outcome;
            this.successReward = reward;
            Collections.addAll(successEffects, effects);
            return this;
        }

        public Builder failure(String outcome, double reward, Effect... effects) {
            this.failureLabel = outcome;
            this.failureReward = reward;
            Collections.addAll(failureEffects, effects);
            return this;
        }

        public Builder bias(RewardBias rewardBias) {
            this.rewardBias = rewardBias;
            return this;
        }

        public Builder prosocial() {
            this.prosocial = true;
            return this;
        }

        public ActionSpec build() {
            if (successLabel == null || failureLabel == null) {
                throw new IllegalStateException("Action " + label + " needs both outcome branches");
            }
            return new ActionSpec(this);
        }
    }
}
