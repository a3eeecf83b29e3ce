package mirage.ai.training;

import com.google.common.base.Preconditions;

/**
 * Generalized advantage estimation, computed backward from the last step.
 * The bootstrap value is used only for the transition leaving the last
 * index; every other step bootstraps from {@code values[t + 1]}. A done
 * flag at step t cuts both the bootstrap and the accumulated trace.
 */
public final class AdvantageEstimator {

    private AdvantageEstimator() { }

    public static Result compute(double[] rewards, double[] values, double bootstrapValue,
                                 boolean[] dones, double gamma, double lambda) {
        Preconditions.checkArgument(values.length == rewards.length && dones.length == rewards.length,
                "rewards, values and dones must have equal length: %s, %s, %s",
                rewards.length, values.length, dones.length);
        int n = rewards.length;
        double[] advantages = new double[n];
        double[] returns = new double[n];
        double gae = 0.0;
        for (int t = n - 1; t >= 0; t--) {
            double nextValue = t == n - 1 ? bootstrapValue : values[t + 1];
            double nextNonTerminal = dones[t] ? 0.0 : 1.0;
            double delta = rewards[t] + gamma * nextValue * nextNonTerminal - values[t];
            gae = delta + gamma * lambda * nextNonTerminal * gae;
            advantages[t] = gae;
            returns[t] = gae + values[t];
        }
        return new Result(returns, advantages);
    }

    public static Result compute(Trajectory trajectory, double gamma, double lambda) {
        return compute(trajectory.rewards(), trajectory.values(), trajectory.getBootstrapValue(),
                trajectory.dones(), gamma, lambda);
    }

    public static final class Result {
        private final double[] returns;
        private final double[] advantages;

        Result(double[] returns, double[] advantages) {
            this.returns = returns;
            this.advantages = advantages;
        }

        public double[] getReturns() {
            return returns;
        }

        public double[] getAdvantages() {
            return advantages;
        }
    }
}
