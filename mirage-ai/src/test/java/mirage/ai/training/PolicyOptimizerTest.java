package mirage.ai.training;

import java.util.Arrays;

import org.testng.Assert;
import org.testng.annotations.Test;

import mirage.ai.config.PpoConfig;
import mirage.ai.nn.ActorCriticNetwork;
import mirage.ai.nn.AdamOptimizer;
import mirage.ai.registry.Agent;

public class PolicyOptimizerTest {
    private static final double CLIP = 0.2;
    private static final double[] STATE = {0.3, -0.2, 0.8, 0.1};

    private static Agent newAgent(double lr) {
        ActorCriticNetwork net = new ActorCriticNetwork(STATE.length, 8, 3, 1e-6, 11L);
        return new Agent("test", net, new AdamOptimizer(net.parameterCount(), lr));
    }

    private static Batch singleRow(Agent agent, int action, double advantage, double ret) {
        double logProb = agent.evaluate(STATE).logProb(action);
        return new Batch(new double[][] {STATE}, new int[] {action}, new double[] {logProb},
                new double[] {advantage}, new double[] {ret});
    }

    private static double[] params(Agent agent) {
        return agent.snapshot().policy;
    }

    @Test
    public void testSurrogateAtUpperBound() {
        double upper = 1.0 + CLIP;
        PolicyOptimizer.SurrogateTerm pos = PolicyOptimizer.clippedSurrogate(upper, 1.0, CLIP);
        Assert.assertTrue(pos.isClipped());
        Assert.assertEquals(pos.getValue(), upper, 1e-12);

        PolicyOptimizer.SurrogateTerm neg = PolicyOptimizer.clippedSurrogate(upper, -1.0, CLIP);
        Assert.assertFalse(neg.isClipped());
        Assert.assertEquals(neg.getValue(), -upper, 1e-12);
    }

    @Test
    public void testSurrogateAtLowerBound() {
        double lower = 1.0 - CLIP;
        Assert.assertTrue(PolicyOptimizer.clippedSurrogate(lower, -1.0, CLIP).isClipped());
        Assert.assertFalse(PolicyOptimizer.clippedSurrogate(lower, 1.0, CLIP).isClipped());
    }

    @Test
    public void testSurrogateTakesPessimisticTerm() {
        Assert.assertEquals(PolicyOptimizer.clippedSurrogate(1.5, 2.0, CLIP).getValue(), 2.4, 1e-12);
        Assert.assertEquals(PolicyOptimizer.clippedSurrogate(0.5, 2.0, CLIP).getValue(), 1.0, 1e-12);
        Assert.assertEquals(PolicyOptimizer.clippedSurrogate(0.5, -2.0, CLIP).getValue(), -1.6, 1e-12);
        Assert.assertEquals(PolicyOptimizer.clippedSurrogate(1.0, 0.0, CLIP).getValue(), 0.0, 0.0);
    }

    @Test
    public void testPositiveAdvantageRaisesProbability() {
        PpoConfig config = PpoConfig.builder().learningRate(0.01).entropyCoef(0).valueCoef(0).build();
        Agent agent = newAgent(config.getLearningRate());
        double before = agent.evaluate(STATE).probability(1);

        UpdateStats stats = new PolicyOptimizer(config).update(agent, singleRow(agent, 1, 1.0, 0.0), 5, CLIP);

        Assert.assertTrue(agent.evaluate(STATE).probability(1) > before);
        Assert.assertEquals(stats.getAppliedSteps(), 5);
        Assert.assertEquals(stats.getSkippedSteps(), 0);
        Assert.assertFalse(agent.isUnstable());
        Assert.assertEquals(agent.getUpdateCount(), 5L);
    }

    @Test
    public void testValueLossDecreases() {
        PpoConfig config = PpoConfig.builder().learningRate(0.01).entropyCoef(0).maxGradNorm(10).build();
        Agent agent = newAgent(config.getLearningRate());
        Batch batch = singleRow(agent, 0, 0.0, 2.0);
        PolicyOptimizer optimizer = new PolicyOptimizer(config);

        UpdateStats first = optimizer.update(agent, batch, 1, CLIP);
        UpdateStats later = null;
        for (int i = 0; i < 50; i++) {
            later = optimizer.update(agent, batch, 1, CLIP);
        }
        Assert.assertTrue(later.getValueLoss() < first.getValueLoss(),
                later.getValueLoss() + " should be below " + first.getValueLoss());
    }

    @Test
    public void testNonFiniteAdvantageSkipsEveryEpoch() {
        PpoConfig config = PpoConfig.builder().updateEpochs(4).build();
        Agent agent = newAgent(config.getLearningRate());
        double[] before = params(agent);

        UpdateStats stats = new PolicyOptimizer(config).update(agent, singleRow(agent, 0, Double.NaN, 1.0));

        Assert.assertEquals(stats.getSkippedSteps(), 4);
        Assert.assertEquals(stats.getAppliedSteps(), 0);
        Assert.assertTrue(Double.isNaN(stats.getPolicyLoss()));
        Assert.assertTrue(agent.isUnstable());
        Assert.assertTrue(Arrays.equals(params(agent), before), "parameters must be left untouched");
        Assert.assertEquals(agent.getUpdateCount(), 0L);
    }

    @Test
    public void testNormalizationFlag() {
        // two rows with the same advantage normalize to zero, so only the zeroed heads would move
        PpoConfig normalized = PpoConfig.builder().entropyCoef(0).valueCoef(0).normalizeAdvantages(true).build();
        Agent agent = newAgent(normalized.getLearningRate());
        double logProb = agent.evaluate(STATE).logProb(2);
        Batch batch = new Batch(new double[][] {STATE, STATE}, new int[] {2, 2}, new double[] {logProb, logProb},
                new double[] {5.0, 5.0}, new double[] {0.0, 0.0});
        double[] before = params(agent);

        new PolicyOptimizer(normalized).update(agent, batch, 2, CLIP);
        Assert.assertTrue(Arrays.equals(params(agent), before));

        PpoConfig raw = normalized.toBuilder().normalizeAdvantages(false).build();
        new PolicyOptimizer(raw).update(agent, batch, 2, CLIP);
        Assert.assertFalse(Arrays.equals(params(agent), before));
    }

    @Test
    public void testEmptyBatch() {
        Agent agent = newAgent(1e-3);
        UpdateStats stats = new PolicyOptimizer(PpoConfig.defaults()).update(agent,
                new Batch(new double[0][], new int[0], new double[0], new double[0], new double[0]));
        Assert.assertEquals(stats.getAppliedSteps(), 0);
        Assert.assertFalse(agent.isUnstable());
    }

    @Test
    public void testClipFractionCountsRatiosOutsideBand() {
        PpoConfig config = PpoConfig.builder().build();
        Agent agent = newAgent(config.getLearningRate());
        double logProb = agent.evaluate(STATE).logProb(0);
        // old log-prob far below the current one: ratio e^2 is outside the band
        Batch batch = new Batch(new double[][] {STATE, STATE}, new int[] {0, 0},
                new double[] {logProb - 2.0, logProb}, new double[] {1.0, 1.0}, new double[] {0.0, 0.0});
        UpdateStats stats = new PolicyOptimizer(config).update(agent, batch, 1, CLIP);
        Assert.assertEquals(stats.getClipFraction(), 0.5, 1e-12);
    }
}
