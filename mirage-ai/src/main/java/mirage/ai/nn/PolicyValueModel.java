package mirage.ai.nn;

import java.util.Random;

/**
 * Maps a state vector to a categorical action distribution and a scalar
 * value estimate. Implementations must return a distribution that sums to 1
 * and is strictly positive everywhere, so log-probabilities stay finite.
 */
public interface PolicyValueModel {

    int getStateDim();

    int getActionDim();

    /**
     * Evaluate the model. No side effects.
     *
     * @param state encoded state, length {@link #getStateDim()}
     */
    Evaluation forward(double[] state);

    /**
     * Pick an action for the given state.
     *
     * @param deterministic true = highest-probability action, false = sample from the distribution
     * @param rng source of randomness for sampling; unused when deterministic
     */
    default ActionChoice selectAction(double[] state, boolean deterministic, Random rng) {
        Evaluation eval = forward(state);
        int action = deterministic ? eval.argmax() : eval.sample(rng);
        return new ActionChoice(action, eval.logProb(action), eval.getValue(), eval.getProbabilities());
    }
}
