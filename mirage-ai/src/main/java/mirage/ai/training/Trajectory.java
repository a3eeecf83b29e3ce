package mirage.ai.training;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One participant's ordered rollout records. Built by a single collector,
 * consumed once by advantage estimation and the optimizer.
 */
public final class Trajectory {

    public static final class Step {
        private final double[] state;
        private final int action;
        private final double logProb;
        private final double value;
        private final double reward;
        private final boolean done;

        public Step(double[] state, int action, double logProb, double value, double reward, boolean done) {
            this.state = state;
            this.action = action;
            this.logProb = logProb;
            this.value = value;
            this.reward = reward;
            this.done = done;
        }

        public double[] getState() { return state; }
        public int getAction() { return action; }
        public double getLogProb() { return logProb; }
        public double getValue() { return value; }
        public double getReward() { return reward; }
        public boolean isDone() { return done; }
    }

    private final List<Step> steps = new ArrayList<>();
    private double bootstrapValue;

    public void add(Step step) {
        steps.add(step);
    }

    public int size() {
        return steps.size();
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }

    public Step get(int index) {
        return steps.get(index);
    }

    public List<Step> getSteps() {
        return Collections.unmodifiableList(steps);
    }

    /**
     * Value estimate of the state after the last step; 0 when the episode
     * ended rather than being cut off at the horizon.
     */
    public double getBootstrapValue() {
        return bootstrapValue;
    }

    public void setBootstrapValue(double bootstrapValue) {
        this.bootstrapValue = bootstrapValue;
    }

    public double[] rewards() {
        double[] out = new double[steps.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = steps.get(i).reward;
        }
        return out;
    }

    public double[] values() {
        double[] out = new double[steps.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = steps.get(i).value;
        }
        return out;
    }

    public boolean[] dones() {
        boolean[] out = new boolean[steps.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = steps.get(i).done;
        }
        return out;
    }

    public double totalReward() {
        double sum = 0.0;
        for (Step s : steps) {
            sum += s.reward;
        }
        return sum;
    }
}
