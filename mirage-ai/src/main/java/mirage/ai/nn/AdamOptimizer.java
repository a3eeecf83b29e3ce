package mirage.ai.nn;

import java.util.Arrays;

import com.google.common.base.Preconditions;

/**
 * Adam with bias correction over a flat parameter array. The moment
 * estimates and step counter are part of the agent's persisted state.
 */
public class AdamOptimizer {
    private final double learningRate;
    private final double beta1;
    private final double beta2;
    private final double epsilon;

    private final double[] m;
    private final double[] v;
    private long t;

    public AdamOptimizer(int size, double learningRate) {
        this(size, learningRate, NNConstants.ADAM_BETA1, NNConstants.ADAM_BETA2, NNConstants.ADAM_EPSILON);
    }

    public AdamOptimizer(int size, double learningRate, double beta1, double beta2, double epsilon) {
        Preconditions.checkArgument(size > 0, "size must be positive");
        Preconditions.checkArgument(learningRate > 0, "learningRate must be positive");
        this.learningRate = learningRate;
        this.beta1 = beta1;
        this.beta2 = beta2;
        this.epsilon = epsilon;
        this.m = new double[size];
        this.v = new double[size];
        this.t = 0;
    }

    /**
     * Restore from a snapshot taken with {@link #snapshot()}.
     */
    public static AdamOptimizer restore(State state) {
        Preconditions.checkArgument(state.m.length == state.v.length, "moment arrays differ in length");
        AdamOptimizer adam = new AdamOptimizer(state.m.length, state.learningRate,
                state.beta1, state.beta2, state.epsilon);
        System.arraycopy(state.m, 0, adam.m, 0, state.m.length);
        System.arraycopy(state.v, 0, adam.v, 0, state.v.length);
        adam.t = state.step;
        return adam;
    }

    /**
     * Apply one update: {@code params -= lr * mHat / (sqrt(vHat) + eps)}.
     */
    public void step(double[] params, double[] grad) {
        Preconditions.checkArgument(params.length == m.length && grad.length == m.length,
                "optimizer sized for %s parameters", m.length);
        t++;
        double correction1 = 1.0 - Math.pow(beta1, t);
        double correction2 = 1.0 - Math.pow(beta2, t);
        for (int i = 0; i < params.length; i++) {
            double g = grad[i];
            m[i] = beta1 * m[i] + (1.0 - beta1) * g;
            v[i] = beta2 * v[i] + (1.0 - beta2) * g * g;
            double mHat = m[i] / correction1;
            double vHat = v[i] / correction2;
            params[i] -= learningRate * mHat / (Math.sqrt(vHat) + epsilon);
        }
    }

    /**
     * {@link #step} that leaves both the parameters and the moment estimates
     * untouched when it would produce a non-finite parameter.
     *
     * @return false if the step was rolled back
     */
    public boolean stepIfFinite(double[] params, double[] grad) {
        double[] before = Arrays.copyOf(params, params.length);
        State saved = snapshot();
        step(params, grad);
        if (Gradients.allFinite(params)) {
            return true;
        }
        System.arraycopy(before, 0, params, 0, params.length);
        System.arraycopy(saved.m, 0, m, 0, m.length);
        System.arraycopy(saved.v, 0, v, 0, v.length);
        t = saved.step;
        return false;
    }

    public long getStepCount() {
        return t;
    }

    public double getLearningRate() {
        return learningRate;
    }

    public int size() {
        return m.length;
    }

    public State snapshot() {
        State s = new State();
        s.learningRate = learningRate;
        s.beta1 = beta1;
        s.beta2 = beta2;
        s.epsilon = epsilon;
        s.step = t;
        s.m = Arrays.copyOf(m, m.length);
        s.v = Arrays.copyOf(v, v.length);
        return s;
    }

    /**
     * Serializable optimizer state (Gson-friendly field layout).
     */
    public static class State {
        public double learningRate;
        public double beta1;
        public double beta2;
        public double epsilon;
        public long step;
        public double[] m;
        public double[] v;
    }
}
