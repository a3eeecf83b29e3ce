package mirage.ai.env;

import org.apache.commons.lang3.tuple.Pair;
import org.testng.Assert;
import org.testng.annotations.Test;

public class TwoPartyEnvironmentTest {

    private static CharacterProfile withA(String key, double a) {
        return CharacterProfile.builder(key).trait(Trait.AGREEABLENESS, a).build();
    }

    @Test
    public void testTurnsAlternate() {
        InteractionEnvironment env = new InteractionEnvironment(withA("a", 0.5), withA("b", 0.5), 6, 1L);
        env.reset();
        Assert.assertEquals(env.getActiveIndex(), 0);
        Assert.assertEquals(env.step(0).getActorIndex(), 0);
        Assert.assertEquals(env.getActiveIndex(), 1);
        Assert.assertEquals(env.step(0).getActorIndex(), 1);
        Assert.assertEquals(env.getActiveIndex(), 0);
        Assert.assertEquals(env.snapshot(0).getHistory().size(), 1);
        Assert.assertEquals(env.snapshot(1).getHistory().size(), 1);
    }

    @Test
    public void testProsocialRewardScalesWithPartnerAgreeableness() {
        int share = ActionCatalog.INTERACTION.indexOf("share");
        CharacterProfile actor = withA("actor", 0.5);
        double neutral = firstReward(new InteractionEnvironment(actor, withA("p", 0.45), 4, 77L), share);
        double warm = firstReward(new InteractionEnvironment(actor, withA("p", 0.9), 4, 77L), share);
        double cold = firstReward(new InteractionEnvironment(actor, withA("p", 0.1), 4, 77L), share);
        Assert.assertEquals(warm, neutral * 1.2, 1e-12);
        Assert.assertEquals(cold, neutral * 0.8, 1e-12);
    }

    @Test
    public void testNonProsocialRewardIgnoresPartner() {
        int defend = ActionCatalog.INTERACTION.indexOf("defend");
        CharacterProfile actor = withA("actor", 0.5);
        double a = firstReward(new InteractionEnvironment(actor, withA("p", 0.9), 4, 5L), defend);
        double b = firstReward(new InteractionEnvironment(actor, withA("p", 0.1), 4, 5L), defend);
        Assert.assertEquals(a, b, 0.0);
    }

    private static double firstReward(AbstractEnvironment env, int action) {
        env.reset();
        return env.step(action).getReward();
    }

    @Test
    public void testInteractionCouplingTouchesOnlyPartnerCopy() {
        CharacterProfile p = withA("a", 0.5);
        EpisodicState actor = EpisodicState.initial(p);
        EpisodicState partner = EpisodicState.initial(p);
        String actorBefore = actor.toString();
        String partnerBefore = partner.toString();

        ActionSpec help = ActionCatalog.INTERACTION.get(ActionCatalog.INTERACTION.indexOf("help"));
        Pair<EpisodicState, EpisodicState> out = new InteractionCoupling()
                .apply(new Outcome(help, true, 0.6, 1.0), actor, partner);

        Assert.assertEquals(actor.toString(), actorBefore, "inputs must not be mutated");
        Assert.assertEquals(partner.toString(), partnerBefore, "inputs must not be mutated");
        Assert.assertEquals(out.getLeft().toString(), actorBefore);
        Assert.assertEquals(out.getRight().getTrust(), partner.getTrust() + 0.05, 1e-12);
        Assert.assertEquals(out.getRight().emotion(Emotion.JOY), partner.emotion(Emotion.JOY) + 0.05, 1e-12);
    }

    @Test
    public void testInteractionAttackCoupling() {
        CharacterProfile p = withA("a", 0.5);
        EpisodicState partner = EpisodicState.initial(p);
        ActionSpec attack = ActionCatalog.INTERACTION.get(ActionCatalog.INTERACTION.indexOf("attack"));
        InteractionCoupling coupling = new InteractionCoupling();

        EpisodicState hit = coupling.apply(new Outcome(attack, true, 0.5, 1.5), EpisodicState.initial(p), partner).getRight();
        Assert.assertEquals(hit.getHealth(), 0.9, 1e-12);
        Assert.assertEquals(hit.emotion(Emotion.FEAR), partner.emotion(Emotion.FEAR) + 0.1, 1e-12);

        EpisodicState missed = coupling.apply(new Outcome(attack, false, 0.5, -1.5), EpisodicState.initial(p), partner).getRight();
        Assert.assertEquals(missed.getHealth(), 1.0, 1e-12);
        Assert.assertEquals(missed.emotion(Emotion.ANGER), partner.emotion(Emotion.ANGER) + 0.05, 1e-12);
    }

    @Test
    public void testDuelClashCoupling() {
        CharacterProfile p = withA("a", 0.5);
        EpisodicState partner = EpisodicState.initial(p);
        ActionSpec clash = ActionCatalog.DUEL.get(ActionCatalog.DUEL.indexOf("clash"));
        EpisodicState out = new DuelCoupling()
                .apply(new Outcome(clash, true, 0.5, 1.5), EpisodicState.initial(p), partner).getRight();
        Assert.assertEquals(out.getHealth(), 0.85, 1e-12);
        Assert.assertEquals(out.emotion(Emotion.ANGER), partner.emotion(Emotion.ANGER) + 0.05, 1e-12);
    }

    @Test
    public void testDuelUsesProfileEncoding() {
        DuelEnvironment env = new DuelEnvironment(withA("a", 0.2), withA("b", 0.8), 10, 3L);
        Assert.assertEquals(env.getStateDim(), ProfileStateEncoder.DIMENSION);
        Assert.assertEquals(env.getActionDim(), 5);
        double[] first = env.reset();
        Assert.assertEquals(first[3], 0.2, 1e-12, "observation belongs to the first participant");
        double[] second = env.step(0).getState();
        Assert.assertEquals(second[3], 0.8, 1e-12, "after one turn the second participant observes");
    }

    @Test
    public void testDuelEndsAtHorizon() {
        DuelEnvironment env = new DuelEnvironment(withA("a", 0.5), withA("b", 0.5), 4, 3L);
        env.reset();
        int compromise = ActionCatalog.DUEL.indexOf("compromise");
        for (int i = 0; i < 3; i++) {
            Assert.assertFalse(env.step(compromise).isDone());
        }
        Assert.assertTrue(env.step(compromise).isDone());
        Assert.assertEquals(env.getPhase(), Phase.TERMINATED);
    }
}
