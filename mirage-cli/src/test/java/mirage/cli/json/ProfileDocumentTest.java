package mirage.cli.json;

import org.testng.Assert;
import org.testng.annotations.Test;

import mirage.ai.env.CharacterProfile;
import mirage.ai.env.Emotion;
import mirage.ai.env.Social;
import mirage.ai.env.Trait;
import mirage.cli.ProfileException;

public class ProfileDocumentTest {

    @Test
    public void testFullDocument() {
        CharacterProfile p = ProfileDocument.parse("{"
                + "\"key\": \"li-wei\", \"name\": \"Li Wei\","
                + "\"personality\": {\"openness\": 0.7, \"A\": 0.9},"
                + "\"emotions\": {\"joy\": 0.6},"
                + "\"social\": {\"reputation\": 0.8}"
                + "}").toProfile();
        Assert.assertEquals(p.getIdentityKey(), "li-wei");
        Assert.assertEquals(p.getName(), "Li Wei");
        Assert.assertEquals(p.openness(), 0.7, 0.0);
        Assert.assertEquals(p.agreeableness(), 0.9, 0.0);
        Assert.assertEquals(p.extraversion(), Trait.NEUTRAL, 0.0);
        Assert.assertEquals(p.emotion(Emotion.JOY), 0.6, 0.0);
        Assert.assertEquals(p.emotion(Emotion.FEAR), Emotion.NEUTRAL, 0.0);
        Assert.assertEquals(p.social(Social.REPUTATION), 0.8, 0.0);
    }

    @Test
    public void testKeyOnly() {
        CharacterProfile p = ProfileDocument.parse("{\"key\": \"plain\"}").toProfile();
        Assert.assertEquals(p.getName(), "plain");
        Assert.assertEquals(p.social(Social.WEALTH), Social.NEUTRAL, 0.0);
    }

    @Test(expectedExceptions = ProfileException.class)
    public void testMissingKey() {
        ProfileDocument.parse("{\"name\": \"nobody\"}").toProfile();
    }

    @Test(expectedExceptions = ProfileException.class)
    public void testUnknownEmotion() {
        ProfileDocument.parse("{\"key\": \"k\", \"emotions\": {\"envy\": 0.3}}").toProfile();
    }

    @Test(expectedExceptions = ProfileException.class)
    public void testNullValue() {
        ProfileDocument.parse("{\"key\": \"k\", \"personality\": {\"C\": null}}").toProfile();
    }

    @Test(expectedExceptions = ProfileException.class)
    public void testInvalidJson() {
        ProfileDocument.parse("{\"key\": ");
    }
}
