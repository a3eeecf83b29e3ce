package mirage.ai.nn;

import org.testng.Assert;
import org.testng.annotations.Test;

public class GradientsTest {

    @Test
    public void testClipScalesToMaxNorm() {
        double[] g = {3.0, 4.0};
        double before = Gradients.clipByGlobalNorm(g, 0.5);
        Assert.assertEquals(before, 5.0, 1e-12);
        Assert.assertEquals(Gradients.l2Norm(g), 0.5, 1e-6);
        Assert.assertEquals(g[0] / g[1], 0.75, 1e-12);
    }

    @Test
    public void testClipLeavesSmallGradientAlone() {
        double[] g = {0.1, -0.2};
        Gradients.clipByGlobalNorm(g, 0.5);
        Assert.assertEquals(g, new double[] {0.1, -0.2});
    }

    @Test
    public void testAllFinite() {
        Assert.assertTrue(Gradients.allFinite(new double[] {0, 1, -2}));
        Assert.assertFalse(Gradients.allFinite(new double[] {0, Double.NaN}));
        Assert.assertFalse(Gradients.allFinite(new double[] {Double.NEGATIVE_INFINITY}));
    }
}
