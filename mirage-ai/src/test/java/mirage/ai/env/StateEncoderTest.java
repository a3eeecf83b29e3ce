package mirage.ai.env;

import org.testng.Assert;
import org.testng.annotations.Test;

public class StateEncoderTest {

    @Test
    public void testNeutralDefaults() {
        CharacterProfile p = CharacterProfile.builder("blank").build();
        double[] v = new EpisodicStateEncoder().encode(p, EpisodicState.initial(p));
        Assert.assertEquals(v.length, 20);
        for (int i = 7; i < 12; i++) {
            Assert.assertEquals(v[i], Trait.NEUTRAL, 0.0, "personality feature " + i);
        }
        for (int i = 12; i < 16; i++) {
            Assert.assertEquals(v[i], Emotion.NEUTRAL, 0.0, "emotion feature " + i);
        }
        Assert.assertEquals(v[0], 1.0, 0.0, "health starts full");
    }

    @Test
    public void testEncodingIsPure() {
        CharacterProfile p = CharacterProfile.builder("x").trait(Trait.OPENNESS, 0.9)
                .emotion(Emotion.ANGER, 0.7).social(Social.WEALTH, 0.3).build();
        EpisodicState s = EpisodicState.initial(p);
        String before = s.toString();
        EpisodicStateEncoder enc = new EpisodicStateEncoder();
        double[] a = enc.encode(p, s);
        double[] b = enc.encode(p, s);
        Assert.assertEquals(b, a);
        Assert.assertEquals(s.toString(), before);
        Assert.assertEquals(a[2], 0.3, 0.0);
        Assert.assertEquals(a[7], 0.9, 0.0);
        Assert.assertEquals(a[13], 0.7, 0.0);
    }

    @Test
    public void testProfileEncoderNormalizesElementCounts() {
        CharacterProfile p = CharacterProfile.builder("x")
                .element(Element.METAL, 2).element(Element.WOOD, 1).element(Element.WATER, 1)
                .element(Element.FIRE, 0).element(Element.EARTH, 0)
                .social(Social.STATUS, 0.9).build();
        double[] v = new ProfileStateEncoder().encode(p, EpisodicState.initial(p));
        Assert.assertEquals(v.length, 18);
        Assert.assertEquals(v[5], 0.5, 1e-12);
        Assert.assertEquals(v[6], 0.25, 1e-12);
        Assert.assertEquals(v[9], 0.0, 1e-12);
        Assert.assertEquals(v[17], 0.9, 1e-12);
    }

    @Test
    public void testProfileEncoderKeepsProportions() {
        CharacterProfile p = CharacterProfile.builder("x").build();
        double[] v = new ProfileStateEncoder().encode(p, EpisodicState.initial(p));
        for (int i = 5; i < 10; i++) {
            Assert.assertEquals(v[i], Element.NEUTRAL, 1e-12);
        }
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testProfileRejectsOutOfRangeTrait() {
        CharacterProfile.builder("x").trait(Trait.AGREEABLENESS, 1.5).build();
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testProfileRejectsBlankKey() {
        CharacterProfile.builder(" ").build();
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testProfileRejectsVariantSeparatorInKey() {
        CharacterProfile.builder("bob#duel").build();
    }

    @Test
    public void testScenarioParsing() {
        Assert.assertTrue(Scenario.parse("").isEmpty());
        Assert.assertTrue(Scenario.parse(null).isEmpty());
        Assert.assertEquals(Scenario.parse("a lucky DISCOVERY"), java.util.EnumSet.of(Scenario.OPPORTUNITY));
        Assert.assertTrue(Scenario.parse("betrayed and in mourning").containsAll(
                java.util.EnumSet.of(Scenario.BETRAYAL, Scenario.LOSS)));
    }
}
