package mirage.ai.nn;

import java.util.Arrays;

/**
 * An action picked by a policy together with its log-probability, the value
 * estimate of the state it was picked in, and the full distribution.
 */
public final class ActionChoice {
    private final int action;
    private final double logProb;
    private final double value;
    private final double[] probabilities;

    public ActionChoice(int action, double logProb, double value, double[] probabilities) {
        this.action = action;
        this.logProb = logProb;
        this.value = value;
        this.probabilities = probabilities;
    }

    public int getAction() {
        return action;
    }

    public double getLogProb() {
        return logProb;
    }

    public double getValue() {
        return value;
    }

    public double[] getProbabilities() {
        return Arrays.copyOf(probabilities, probabilities.length);
    }
}
