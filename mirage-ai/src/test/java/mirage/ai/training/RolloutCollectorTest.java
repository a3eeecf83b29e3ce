package mirage.ai.training;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import org.testng.Assert;
import org.testng.annotations.Test;

import mirage.ai.config.ConfigurationException;
import mirage.ai.env.CharacterEnvironment;
import mirage.ai.env.CharacterProfile;
import mirage.ai.env.EpisodicStateEncoder;
import mirage.ai.env.InteractionEnvironment;
import mirage.ai.env.StepResult;
import mirage.ai.nn.ActorCriticNetwork;
import mirage.ai.nn.AdamOptimizer;
import mirage.ai.registry.Agent;

public class RolloutCollectorTest {
    private final CharacterProfile profile = CharacterProfile.builder("rollout").build();

    private static Agent agent(int stateDim, int actionDim) {
        ActorCriticNetwork net = new ActorCriticNetwork(stateDim, 16, actionDim, 1e-6, 3L);
        return new Agent("rollout", net, new AdamOptimizer(net.parameterCount(), 1e-3));
    }

    @Test
    public void testStopsAtEnvironmentDone() {
        CharacterEnvironment env = new CharacterEnvironment(profile, 5, 1L);
        Trajectory t = new RolloutCollector().collect(agent(20, 10), env, 10, false, new Random(1));
        Assert.assertEquals(t.size(), 5);
        Assert.assertTrue(t.get(4).isDone());
        Assert.assertEquals(t.getBootstrapValue(), 0.0, 0.0);
    }

    @Test
    public void testStopsAtHorizonAndBootstraps() {
        Agent agent = agent(20, 10);
        CharacterEnvironment env = new CharacterEnvironment(profile, 50, 1L);
        Trajectory t = new RolloutCollector().collect(agent, env, 3, false, new Random(1));
        Assert.assertEquals(t.size(), 3);
        for (Trajectory.Step s : t.getSteps()) {
            Assert.assertFalse(s.isDone());
        }
        Assert.assertEquals(t.getBootstrapValue(), agent.evaluate(env.observe(0)).getValue(), 1e-12);
    }

    @Test
    public void testRecordsAgentOutputsAndLeavesAgentUnchanged() {
        Agent agent = agent(20, 10);
        double[] before = agent.snapshot().policy;
        List<StepResult> seen = new ArrayList<>();
        Trajectory t = new RolloutCollector().collect(agent, new CharacterEnvironment(profile, 8, 2L), 8,
                true, new Random(2), seen::add);

        Assert.assertEquals(seen.size(), t.size());
        for (int i = 0; i < t.size(); i++) {
            Trajectory.Step s = t.get(i);
            Assert.assertEquals(s.getAction(), seen.get(i).getActionIndex());
            Assert.assertEquals(s.getReward(), seen.get(i).getReward(), 0.0);
            Assert.assertEquals(s.getLogProb(), agent.evaluate(s.getState()).logProb(s.getAction()), 1e-12);
            Assert.assertEquals(s.getState().length, EpisodicStateEncoder.DIMENSION);
        }
        Assert.assertTrue(Arrays.equals(agent.snapshot().policy, before));
    }

    @Test(expectedExceptions = ConfigurationException.class)
    public void testDimensionMismatch() {
        new RolloutCollector().collect(agent(18, 10), new CharacterEnvironment(profile, 5, 1L), 5, false, new Random());
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testRejectsTwoParticipants() {
        InteractionEnvironment env = new InteractionEnvironment(profile, profile, 4, 1L);
        new RolloutCollector().collect(agent(20, 12), env, 4, false, new Random());
    }
}
