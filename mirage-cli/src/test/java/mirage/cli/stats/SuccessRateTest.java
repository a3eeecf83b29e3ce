package mirage.cli.stats;

import org.testng.Assert;
import org.testng.annotations.Test;

public class SuccessRateTest {

    @Test
    public void testHalfSuccesses() {
        SuccessRate rate = new SuccessRate(5, 10);
        double[] ci = rate.interval95();
        Assert.assertEquals(rate.fraction(), 0.5, 0.0);
        Assert.assertEquals(ci[0], 0.2366, 1e-3);
        Assert.assertEquals(ci[1], 0.7634, 1e-3);
        Assert.assertEquals(ci[0] + ci[1], 1.0, 1e-12, "symmetric around one half");
    }

    @Test
    public void testBoundsStayInUnitInterval() {
        double[] all = new SuccessRate(10, 10).interval95();
        Assert.assertTrue(all[0] > 0.6 && all[0] < 1.0);
        Assert.assertEquals(all[1], 1.0, 1e-12);
        double[] none = new SuccessRate(0, 10).interval95();
        Assert.assertEquals(none[0], 0.0, 1e-12);
        Assert.assertTrue(none[1] > 0.0 && none[1] < 0.4);
    }

    @Test
    public void testNoAttempts() {
        SuccessRate rate = new SuccessRate(0, 0);
        Assert.assertEquals(rate.fraction(), 0.0, 0.0);
        Assert.assertEquals(rate.interval95(), new double[] {0.0, 1.0});
    }

    @Test
    public void testWiderWithFewerSteps() {
        double[] small = new SuccessRate(3, 6).interval95();
        double[] large = new SuccessRate(30, 60).interval95();
        Assert.assertTrue(small[1] - small[0] > large[1] - large[0]);
    }

    @Test
    public void testToString() {
        Assert.assertEquals(new SuccessRate(5, 10).toString(), "5/10 = 50.0% [23.7%, 76.3%]");
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testMoreSuccessesThanAttempts() {
        new SuccessRate(4, 3);
    }
}
