package mirage.ai.training;

import java.util.Collections;
import java.util.List;

import com.google.common.base.Preconditions;

/**
 * Flattened optimizer input: one row per collected step, with the
 * advantages and returns estimated for it.
 */
public final class Batch {
    private final double[][] states;
    private final int[] actions;
    private final double[] oldLogProbs;
    private final double[] advantages;
    private final double[] returns;

    public Batch(double[][] states, int[] actions, double[] oldLogProbs, double[] advantages, double[] returns) {
        int n = states.length;
        Preconditions.checkArgument(actions.length == n && oldLogProbs.length == n
                        && advantages.length == n && returns.length == n,
                "batch columns must have equal length");
        this.states = states;
        this.actions = actions;
        this.oldLogProbs = oldLogProbs;
        this.advantages = advantages;
        this.returns = returns;
    }

    public static Batch of(Trajectory trajectory, double gamma, double lambda) {
        return of(Collections.singletonList(trajectory), gamma, lambda);
    }

    /**
     * Estimate advantages per trajectory, then concatenate.
     */
    public static Batch of(List<Trajectory> trajectories, double gamma, double lambda) {
        int n = 0;
        for (Trajectory t : trajectories) {
            n += t.size();
        }
        double[][] states = new double[n][];
        int[] actions = new int[n];
        double[] oldLogProbs = new double[n];
        double[] advantages = new double[n];
        double[] returns = new double[n];
        int row = 0;
        for (Trajectory t : trajectories) {
            AdvantageEstimator.Result est = AdvantageEstimator.compute(t, gamma, lambda);
            for (int i = 0; i < t.size(); i++, row++) {
                Trajectory.Step s = t.get(i);
                states[row] = s.getState();
                actions[row] = s.getAction();
                oldLogProbs[row] = s.getLogProb();
                advantages[row] = est.getAdvantages()[i];
                returns[row] = est.getReturns()[i];
            }
        }
        return new Batch(states, actions, oldLogProbs, advantages, returns);
    }

    public int size() {
        return states.length;
    }

    public double[] getState(int row) { return states[row]; }
    public int getAction(int row) { return actions[row]; }
    public double getOldLogProb(int row) { return oldLogProbs[row]; }
    public double getAdvantage(int row) { return advantages[row]; }
    public double getReturn(int row) { return returns[row]; }

    /**
     * Per-batch standardized copy of the advantages (zero mean, unit variance).
     * Batches of fewer than two rows are returned unchanged.
     */
    public double[] normalizedAdvantages() {
        double[] out = advantages.clone();
        if (out.length < 2) {
            return out;
        }
        double mean = 0.0;
        for (double a : out) {
            mean += a;
        }
        mean /= out.length;
        double var = 0.0;
        for (double a : out) {
            var += (a - mean) * (a - mean);
        }
        double std = Math.sqrt(var / out.length);
        for (int i = 0; i < out.length; i++) {
            out[i] = (out[i] - mean) / (std + 1e-8);
        }
        return out;
    }

    double[] rawAdvantages() {
        return advantages;
    }
}
