package mirage.ai.training;

import java.util.Random;

import org.testng.Assert;
import org.testng.annotations.Test;

import mirage.ai.env.CharacterEnvironment;
import mirage.ai.env.CharacterProfile;
import mirage.ai.env.DuelEnvironment;
import mirage.ai.env.InteractionEnvironment;
import mirage.ai.env.StepResult;
import mirage.ai.env.Trait;
import mirage.ai.nn.ActorCriticNetwork;
import mirage.ai.nn.AdamOptimizer;
import mirage.ai.registry.Agent;

public class MatchRunnerTest {
    private final CharacterProfile warm = CharacterProfile.builder("warm").trait(Trait.AGREEABLENESS, 0.9).build();
    private final CharacterProfile cold = CharacterProfile.builder("cold").trait(Trait.AGREEABLENESS, 0.1).build();

    private static Agent agent(String key, int stateDim, int actionDim, long seed) {
        ActorCriticNetwork net = new ActorCriticNetwork(stateDim, 16, actionDim, 1e-6, seed);
        return new Agent(key, net, new AdamOptimizer(net.parameterCount(), 1e-3));
    }

    @Test
    public void testFullMatchEndsAtEnvironmentHorizon() {
        InteractionEnvironment env = new InteractionEnvironment(warm, cold, 6, 4L);
        MatchRunner.Match match = new MatchRunner().run(agent("warm", 20, 12, 1L), agent("cold", 20, 12, 2L),
                env, 3, false, new Random(4));

        Assert.assertTrue(match.isTerminated());
        Assert.assertEquals(match.getTurns(), 6);
        for (int p = 0; p < 2; p++) {
            Assert.assertEquals(match.getLog(p).size(), 3);
            Trajectory t = match.getTrajectory(p);
            Assert.assertEquals(t.size(), 3);
            Assert.assertFalse(t.get(0).isDone());
            Assert.assertFalse(t.get(1).isDone());
            Assert.assertTrue(t.get(2).isDone());
            Assert.assertEquals(t.getBootstrapValue(), 0.0, 0.0);

            double sum = 0;
            for (StepResult r : match.getLog(p)) {
                Assert.assertEquals(r.getActorIndex(), p);
                sum += r.getReward();
            }
            Assert.assertEquals(match.getTotal(p), sum, 1e-9);
        }
    }

    @Test
    public void testRoundLimitBeforeHorizon() {
        Agent first = agent("a", 18, 5, 1L);
        Agent second = agent("b", 18, 5, 2L);
        DuelEnvironment env = new DuelEnvironment(warm, cold, 20, 4L);
        MatchRunner.Match match = new MatchRunner().run(first, second, env, 2, true, new Random(4));

        Assert.assertFalse(match.isTerminated());
        Assert.assertEquals(match.getTurns(), 4);
        Assert.assertFalse(match.getTrajectory(1).get(1).isDone());
        Assert.assertEquals(match.getTrajectory(1).getBootstrapValue(),
                second.evaluate(env.observe(1)).getValue(), 1e-12);
    }

    @Test
    public void testWinnerFollowsTotals() {
        MatchRunner.Match match = new MatchRunner().run(agent("a", 18, 5, 1L), agent("b", 18, 5, 2L),
                new DuelEnvironment(warm, cold, 10, 8L), 5, false, new Random(8));
        int cmp = Double.compare(match.getTotal(0), match.getTotal(1));
        Assert.assertEquals(match.getWinner(), cmp == 0 ? -1 : (cmp > 0 ? 0 : 1));
        Assert.assertEquals(match.getVerdict(), Verdict.of(match.getTotal(0), match.getTotal(1)));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testRejectsSingleParticipant() {
        new MatchRunner().run(agent("a", 20, 10, 1L), agent("b", 20, 10, 2L),
                new CharacterEnvironment(warm, 5, 1L), 2, false, new Random());
    }

    @Test
    public void testVerdicts() {
        Assert.assertEquals(Verdict.of(10, 2), Verdict.FIRST_DOMINATES);
        Assert.assertEquals(Verdict.of(2, -4), Verdict.FIRST_DOMINATES);
        Assert.assertEquals(Verdict.of(1, 10), Verdict.SECOND_DOMINATES);
        Assert.assertEquals(Verdict.of(3, 2.5), Verdict.MUTUAL_BENEFIT);
        Assert.assertEquals(Verdict.of(-1, -2), Verdict.MUTUAL_LOSS);
        Assert.assertEquals(Verdict.of(0, 0), Verdict.UNDETERMINED);
    }

    @Test
    public void testRelationshipChanges() {
        Assert.assertEquals(RelationshipChange.of(6, 6), RelationshipChange.SIGNIFICANTLY_IMPROVED);
        Assert.assertEquals(RelationshipChange.of(3, 2), RelationshipChange.SLIGHTLY_IMPROVED);
        Assert.assertEquals(RelationshipChange.of(2, 2), RelationshipChange.UNCHANGED);
        Assert.assertEquals(RelationshipChange.of(-3, -2), RelationshipChange.SLIGHTLY_WORSENED);
        Assert.assertEquals(RelationshipChange.of(-8, -4), RelationshipChange.SIGNIFICANTLY_WORSENED);
    }
}
