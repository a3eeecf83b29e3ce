package mirage.ai.nn;

import java.util.Arrays;
import java.util.Random;

/**
 * Result of one model evaluation: action probabilities and value estimate.
 */
public final class Evaluation {
    private final double[] probabilities;
    private final double value;

    public Evaluation(double[] probabilities, double value) {
        this.probabilities = probabilities;
        this.value = value;
    }

    /** Defensive copy. */
    public double[] getProbabilities() {
        return Arrays.copyOf(probabilities, probabilities.length);
    }

    public double probability(int action) {
        return probabilities[action];
    }

    public int size() {
        return probabilities.length;
    }

    public double getValue() {
        return value;
    }

    public double logProb(int action) {
        return Math.log(probabilities[action]);
    }

    public double entropy() {
        double h = 0.0;
        for (double p : probabilities) {
            h -= p * Math.log(p);
        }
        return h;
    }

    /** Lowest index wins ties. */
    public int argmax() {
        int best = 0;
        for (int i = 1; i < probabilities.length; i++) {
            if (probabilities[i] > probabilities[best]) {
                best = i;
            }
        }
        return best;
    }

    public int sample(Random rng) {
        double r = rng.nextDouble();
        double cdf = 0.0;
        for (int a = 0; a < probabilities.length; a++) {
            cdf += probabilities[a];
            if (r < cdf) {
                return a;
            }
        }
        return probabilities.length - 1; // rounding left a sliver above the last bucket
    }
}
