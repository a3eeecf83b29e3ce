package mirage.ai.nn;

import java.util.Arrays;
import java.util.Random;

import com.google.common.base.Preconditions;

/**
 * Two-layer tanh trunk shared by a softmax policy head and a linear value head.
 *
 * <pre>
 *   h1     = tanh(W1 * x  + b1)        [H]
 *   h2     = tanh(W2 * h1 + b2)        [H]
 *   logits = Wa * h2 + ba              [A]
 *   probs  = (1 - A*floor) * softmax(logits) + floor
 *   value  = wv . h2 + bv
 * </pre>
 *
 * The floor keeps every probability strictly positive and the distribution
 * summing to one. All parameters live in one flat array so the optimizer,
 * gradient clipping and persistence can treat them uniformly:
 * <pre>
 *   [W1 (H*D) | b1 (H) | W2 (H*H) | b2 (H) | Wa (A*H) | ba (A) | wv (H) | bv (1)]
 * </pre>
 *
 * <p>Evaluation allocates its own buffers, so concurrent {@link #forward}
 * calls are safe as long as no thread is mutating {@link #parameters()}.
 */
public class ActorCriticNetwork implements PolicyValueModel {
    private final int stateDim;
    private final int hiddenDim;
    private final int actionDim;
    private final double probabilityFloor;

    private final int offW1;
    private final int offB1;
    private final int offW2;
    private final int offB2;
    private final int offWa;
    private final int offBa;
    private final int offWv;
    private final int offBv;

    private final double[] params;

    public ActorCriticNetwork(int stateDim, int hiddenDim, int actionDim, double probabilityFloor, long seed) {
        this(stateDim, hiddenDim, actionDim, probabilityFloor, null);
        initXavier(new Random(seed));
    }

    private ActorCriticNetwork(int stateDim, int hiddenDim, int actionDim, double probabilityFloor, double[] params) {
        Preconditions.checkArgument(stateDim > 0, "stateDim must be positive: %s", stateDim);
        Preconditions.checkArgument(hiddenDim > 0, "hiddenDim must be positive: %s", hiddenDim);
        Preconditions.checkArgument(actionDim >= NNConstants.MIN_ACTIONS, "actionDim must be >= %s: %s",
                NNConstants.MIN_ACTIONS, actionDim);
        Preconditions.checkArgument(probabilityFloor > 0 && probabilityFloor * actionDim < 1.0,
                "probabilityFloor out of range: %s", probabilityFloor);
        this.stateDim = stateDim;
        this.hiddenDim = hiddenDim;
        this.actionDim = actionDim;
        this.probabilityFloor = probabilityFloor;

        this.offW1 = 0;
        this.offB1 = offW1 + hiddenDim * stateDim;
        this.offW2 = offB1 + hiddenDim;
        this.offB2 = offW2 + hiddenDim * hiddenDim;
        this.offWa = offB2 + hiddenDim;
        this.offBa = offWa + actionDim * hiddenDim;
        this.offWv = offBa + actionDim;
        this.offBv = offWv + hiddenDim;
        int size = offBv + 1;

        if (params == null) {
            this.params = new double[size];
        } else {
            Preconditions.checkArgument(params.length == size,
                    "parameter count %s does not match layout %s", params.length, size);
            this.params = Arrays.copyOf(params, size);
        }
    }

    /**
     * Rebuild a network from a flat parameter snapshot (see {@link #copyParameters()}).
     */
    public static ActorCriticNetwork fromParameters(int stateDim, int hiddenDim, int actionDim,
                                                    double probabilityFloor, double[] params) {
        Preconditions.checkNotNull(params, "params");
        return new ActorCriticNetwork(stateDim, hiddenDim, actionDim, probabilityFloor, params);
    }

    public static int parameterCount(int stateDim, int hiddenDim, int actionDim) {
        return hiddenDim * stateDim + hiddenDim + hiddenDim * hiddenDim + hiddenDim
                + actionDim * hiddenDim + actionDim + hiddenDim + 1;
    }

    private void initXavier(Random rng) {
        double limit1 = Math.sqrt(6.0 / (stateDim + hiddenDim));
        for (int i = offW1; i < offB1; i++) {
            params[i] = uniform(rng, limit1);
        }
        double limit2 = Math.sqrt(6.0 / (hiddenDim + hiddenDim));
        for (int i = offW2; i < offB2; i++) {
            params[i] = uniform(rng, limit2);
        }
        double limitA = Math.sqrt(6.0 / (hiddenDim + actionDim));
        for (int i = offWa; i < offBa; i++) {
            params[i] = uniform(rng, limitA);
        }
        double limitV = Math.sqrt(6.0 / (hiddenDim + 1.0));
        for (int i = offWv; i < offBv; i++) {
            params[i] = uniform(rng, limitV);
        }
        // biases stay zero
    }

    private static double uniform(Random rng, double limit) {
        return (rng.nextDouble() * 2.0 - 1.0) * limit;
    }

    @Override
    public int getStateDim() {
        return stateDim;
    }

    @Override
    public int getActionDim() {
        return actionDim;
    }

    public int getHiddenDim() {
        return hiddenDim;
    }

    public double getProbabilityFloor() {
        return probabilityFloor;
    }

    public int parameterCount() {
        return params.length;
    }

    /**
     * Live parameter array. Mutating it changes the model; callers must hold
     * exclusive access to the owning agent.
     */
    public double[] parameters() {
        return params;
    }

    public double[] copyParameters() {
        return Arrays.copyOf(params, params.length);
    }

    @Override
    public Evaluation forward(double[] state) {
        Trace t = trace(state);
        return new Evaluation(t.probs, t.value);
    }

    /**
     * Forward pass that keeps the intermediate activations needed by {@link #backward}.
     */
    public Trace trace(double[] state) {
        Preconditions.checkArgument(state.length == stateDim,
                "state vector has %s features, model expects %s", state.length, stateDim);
        double[] h1 = new double[hiddenDim];
        for (int h = 0; h < hiddenDim; h++) {
            double z = params[offB1 + h];
            int row = offW1 + h * stateDim;
            for (int d = 0; d < stateDim; d++) {
                z += params[row + d] * state[d];
            }
            h1[h] = Math.tanh(z);
        }

        double[] h2 = new double[hiddenDim];
        for (int i = 0; i < hiddenDim; i++) {
            double z = params[offB2 + i];
            int row = offW2 + i * hiddenDim;
            for (int j = 0; j < hiddenDim; j++) {
                z += params[row + j] * h1[j];
            }
            h2[i] = Math.tanh(z);
        }

        double[] logits = new double[actionDim];
        for (int a = 0; a < actionDim; a++) {
            double z = params[offBa + a];
            int row = offWa + a * hiddenDim;
            for (int h = 0; h < hiddenDim; h++) {
                z += params[row + h] * h2[h];
            }
            logits[a] = z;
        }

        double[] softmax = softmax(logits);
        double scale = 1.0 - actionDim * probabilityFloor;
        double[] probs = new double[actionDim];
        for (int a = 0; a < actionDim; a++) {
            probs[a] = scale * softmax[a] + probabilityFloor;
        }

        double value = params[offBv];
        for (int h = 0; h < hiddenDim; h++) {
            value += params[offWv + h] * h2[h];
        }

        return new Trace(state, h1, h2, softmax, probs, value);
    }

    /**
     * Accumulate the gradient of a scalar loss into {@code grad}.
     *
     * @param t         trace of the forward pass the loss was computed on
     * @param dLdProbs  partial derivative of the loss w.r.t. each output probability
     * @param dLdValue  partial derivative of the loss w.r.t. the value estimate
     * @param grad      accumulator, same layout as {@link #parameters()}
     */
    public void backward(Trace t, double[] dLdProbs, double dLdValue, double[] grad) {
        Preconditions.checkArgument(grad.length == params.length, "gradient buffer size mismatch");

        // through the floored softmax: dL/dz_k = c * s_k * (u_k - sum_j s_j u_j)
        double scale = 1.0 - actionDim * probabilityFloor;
        double weighted = 0.0;
        for (int j = 0; j < actionDim; j++) {
            weighted += t.softmax[j] * dLdProbs[j];
        }
        double[] dLogits = new double[actionDim];
        for (int k = 0; k < actionDim; k++) {
            dLogits[k] = scale * t.softmax[k] * (dLdProbs[k] - weighted);
        }

        double[] dh2 = new double[hiddenDim];
        for (int a = 0; a < actionDim; a++) {
            int row = offWa + a * hiddenDim;
            double g = dLogits[a];
            for (int h = 0; h < hiddenDim; h++) {
                grad[row + h] += g * t.h2[h];
                dh2[h] += g * params[row + h];
            }
            grad[offBa + a] += g;
        }
        for (int h = 0; h < hiddenDim; h++) {
            grad[offWv + h] += dLdValue * t.h2[h];
            dh2[h] += dLdValue * params[offWv + h];
        }
        grad[offBv] += dLdValue;

        double[] dh1 = new double[hiddenDim];
        for (int i = 0; i < hiddenDim; i++) {
            double da = dh2[i] * (1.0 - t.h2[i] * t.h2[i]);
            int row = offW2 + i * hiddenDim;
            for (int j = 0; j < hiddenDim; j++) {
                grad[row + j] += da * t.h1[j];
                dh1[j] += da * params[row + j];
            }
            grad[offB2 + i] += da;
        }

        for (int h = 0; h < hiddenDim; h++) {
            double da = dh1[h] * (1.0 - t.h1[h] * t.h1[h]);
            int row = offW1 + h * stateDim;
            for (int d = 0; d < stateDim; d++) {
                grad[row + d] += da * t.input[d];
            }
            grad[offB1 + h] += da;
        }
    }

    private static double[] softmax(double[] logits) {
        double max = logits[0];
        for (int i = 1; i < logits.length; i++) {
            max = Math.max(max, logits[i]);
        }
        double[] out = new double[logits.length];
        double sum = 0.0;
        for (int i = 0; i < logits.length; i++) {
            out[i] = Math.exp(logits[i] - max);
            sum += out[i];
        }
        for (int i = 0; i < out.length; i++) {
            out[i] /= sum;
        }
        return out;
    }

    /**
     * Activations of one forward pass.
     */
    public static final class Trace {
        private final double[] input;
        private final double[] h1;
        private final double[] h2;
        private final double[] softmax;
        private final double[] probs;
        private final double value;

        Trace(double[] input, double[] h1, double[] h2, double[] softmax, double[] probs, double value) {
            this.input = input;
            this.h1 = h1;
            this.h2 = h2;
            this.softmax = softmax;
            this.probs = probs;
            this.value = value;
        }

        public double probability(int action) {
            return probs[action];
        }

        public double[] probabilities() {
            return Arrays.copyOf(probs, probs.length);
        }

        public double logProb(int action) {
            return Math.log(probs[action]);
        }

        public double entropy() {
            double h = 0.0;
            for (double p : probs) {
                h -= p * Math.log(p);
            }
            return h;
        }

        public double getValue() {
            return value;
        }

        /** Shared trunk output, fed to both heads. */
        public double[] features() {
            return Arrays.copyOf(h2, h2.length);
        }
    }
}
