package mirage.ai.training;

import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

import mirage.ai.config.PpoConfig;
import mirage.ai.nn.ActorCriticNetwork;
import mirage.ai.nn.AdamOptimizer;
import mirage.ai.nn.Gradients;
import mirage.ai.registry.Agent;

/**
 * Clipped-objective update over one collected batch.
 *
 * <p>Each epoch re-evaluates the current network on every row, computes
 * <pre>
 *   L = -mean(min(r*A, clip(r, 1-e, 1+e)*A)) + c_v * mean((v - R)^2) - c_h * mean(H)
 * </pre>
 * and takes one Adam step on the full-batch gradient after global-norm
 * clipping. An epoch whose loss, gradient or resulting parameters are not
 * finite is rolled back and counted as skipped; the agent is flagged.
 */
public class PolicyOptimizer {
    private static final Logger log = LoggerFactory.getLogger(PolicyOptimizer.class);

    private final PpoConfig config;

    public PolicyOptimizer(PpoConfig config) {
        this.config = Preconditions.checkNotNull(config, "config");
    }

    public PpoConfig getConfig() {
        return config;
    }

    public UpdateStats update(Agent agent, Batch batch) {
        return update(agent, batch, config.getUpdateEpochs(), config.getClipRatio());
    }

    /**
     * Run {@code epochs} gradient steps on the same batch while holding the
     * agent's write lock.
     */
    public UpdateStats update(Agent agent, Batch batch, int epochs, double clipRatio) {
        Preconditions.checkArgument(epochs >= 1, "epochs must be >= 1: %s", epochs);
        Preconditions.checkArgument(clipRatio > 0 && clipRatio < 1, "clipRatio must be in (0, 1): %s", clipRatio);
        if (batch.size() == 0) {
            return UpdateStats.empty();
        }
        double[] advantages = config.isNormalizeAdvantages() ? batch.normalizedAdvantages() : batch.rawAdvantages();
        UpdateStats stats = agent.update((network, adam) -> runEpochs(network, adam, batch, advantages, epochs, clipRatio));
        if (stats.getSkippedSteps() > 0) {
            agent.markUnstable();
            log.warn("Agent {}: skipped {} of {} update steps on non-finite loss or gradient",
                    agent.getKey(), stats.getSkippedSteps(), epochs);
        }
        return stats;
    }

    private UpdateStats runEpochs(ActorCriticNetwork network, AdamOptimizer adam, Batch batch,
                                  double[] advantages, int epochs, double clipRatio) {
        double[] params = network.parameters();
        double[] grad = new double[params.length];
        double sumPolicy = 0, sumValue = 0, sumEntropy = 0, sumTotal = 0, sumClip = 0;
        int applied = 0;
        int skipped = 0;

        for (int epoch = 0; epoch < epochs; epoch++) {
            Arrays.fill(grad, 0.0);
            EpochLoss loss = accumulate(network, batch, advantages, clipRatio, grad);

            if (!Double.isFinite(loss.total()) || !Gradients.allFinite(grad)) {
                skipped++;
                continue;
            }
            Gradients.clipByGlobalNorm(grad, config.getMaxGradNorm());
            if (!adam.stepIfFinite(params, grad)) {
                skipped++;
                continue;
            }
            applied++;
            sumPolicy += loss.policy;
            sumValue += loss.value;
            sumEntropy += loss.entropy;
            sumTotal += loss.total();
            sumClip += loss.clipFraction;
        }

        if (applied == 0) {
            return new UpdateStats(Double.NaN, Double.NaN, Double.NaN, Double.NaN, 0.0, 0, skipped);
        }
        return new UpdateStats(sumPolicy / applied, sumValue / applied, sumEntropy / applied,
                sumTotal / applied, sumClip / applied, applied, skipped);
    }

    /**
     * Full-batch loss of the current parameters; accumulates its gradient into {@code grad}.
     */
    private EpochLoss accumulate(ActorCriticNetwork network, Batch batch, double[] advantages,
                                 double clipRatio, double[] grad) {
        int n = batch.size();
        int actionDim = network.getActionDim();
        double entropyCoef = config.getEntropyCoef();
        double valueCoef = config.getValueCoef();
        EpochLoss loss = new EpochLoss(valueCoef, entropyCoef);
        int clipped = 0;

        for (int i = 0; i < n; i++) {
            ActorCriticNetwork.Trace trace = network.trace(batch.getState(i));
            int action = batch.getAction(i);
            double adv = advantages[i];
            double ratio = Math.exp(trace.logProb(action) - batch.getOldLogProb(i));

            SurrogateTerm term = clippedSurrogate(ratio, adv, clipRatio);
            loss.policy -= term.getValue() / n;
            if (ratio < 1.0 - clipRatio || ratio > 1.0 + clipRatio) {
                clipped++;
            }

            double value = trace.getValue();
            double ret = batch.getReturn(i);
            loss.value += (value - ret) * (value - ret) / n;
            loss.entropy += trace.entropy() / n;

            double[] dLdProbs = new double[actionDim];
            if (!term.isClipped()) {
                // d(-r*A)/dp_a = -A * r / p_a
                dLdProbs[action] += -adv * ratio / n / trace.probability(action);
            }
            for (int j = 0; j < actionDim; j++) {
                dLdProbs[j] += entropyCoef / n * (Math.log(trace.probability(j)) + 1.0);
            }
            double dLdValue = valueCoef * 2.0 * (value - ret) / n;
            network.backward(trace, dLdProbs, dLdValue, grad);
        }
        loss.clipFraction = (double) clipped / n;
        return loss;
    }

    /**
     * Per-step surrogate {@code min(r*A, clip(r, 1-e, 1+e)*A)}. The clipped
     * branch is active when the ratio has reached the bound in the direction
     * the advantage pushes it: {@code A > 0} and {@code r >= 1+e}, or
     * {@code A < 0} and {@code r <= 1-e}. In that case the term carries no
     * policy gradient.
     */
    public static SurrogateTerm clippedSurrogate(double ratio, double advantage, double clipRatio) {
        boolean clipped = (advantage > 0 && ratio >= 1.0 + clipRatio)
                || (advantage < 0 && ratio <= 1.0 - clipRatio);
        if (clipped) {
            double bounded = Math.max(1.0 - clipRatio, Math.min(1.0 + clipRatio, ratio));
            return new SurrogateTerm(bounded * advantage, true);
        }
        return new SurrogateTerm(ratio * advantage, false);
    }

    public static final class SurrogateTerm {
        private final double value;
        private final boolean clipped;

        SurrogateTerm(double value, boolean clipped) {
            this.value = value;
            this.clipped = clipped;
        }

        public double getValue() {
            return value;
        }

        public boolean isClipped() {
            return clipped;
        }
    }

    private static final class EpochLoss {
        private final double valueCoef;
        private final double entropyCoef;
        double policy;
        double value;
        double entropy;
        double clipFraction;

        EpochLoss(double valueCoef, double entropyCoef) {
            this.valueCoef = valueCoef;
            this.entropyCoef = entropyCoef;
        }

        double total() {
            return policy + valueCoef * value - entropyCoef * entropy;
        }
    }
}
