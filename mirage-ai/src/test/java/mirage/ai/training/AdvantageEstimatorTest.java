package mirage.ai.training;

import org.testng.Assert;
import org.testng.annotations.Test;

public class AdvantageEstimatorTest {

    @Test
    public void testUndiscountedEpisodeEndingInDone() {
        AdvantageEstimator.Result r = AdvantageEstimator.compute(
                new double[] {1, 1, 1}, new double[] {0, 0, 0}, 0.0,
                new boolean[] {false, false, true}, 1.0, 1.0);
        Assert.assertEquals(r.getAdvantages(), new double[] {3, 2, 1}, 1e-12);
        Assert.assertEquals(r.getReturns(), new double[] {3, 2, 1}, 1e-12);
    }

    @Test
    public void testBootstrapOnlyAtLastIndex() {
        // t=1: delta = 0 + 0.9*1.0 - 0.2 = 0.7
        // t=0: delta = 1 + 0.9*0.2 - 0.5 = 0.68, gae = 0.68 + 0.9*0.5*0.7 = 0.995
        AdvantageEstimator.Result r = AdvantageEstimator.compute(
                new double[] {1, 0}, new double[] {0.5, 0.2}, 1.0,
                new boolean[] {false, false}, 0.9, 0.5);
        Assert.assertEquals(r.getAdvantages()[1], 0.7, 1e-12);
        Assert.assertEquals(r.getAdvantages()[0], 0.995, 1e-12);
        Assert.assertEquals(r.getReturns()[1], 0.9, 1e-12);
        Assert.assertEquals(r.getReturns()[0], 1.495, 1e-12);
    }

    @Test
    public void testDoneCutsTrace() {
        AdvantageEstimator.Result r = AdvantageEstimator.compute(
                new double[] {1, 1}, new double[] {0, 0}, 5.0,
                new boolean[] {true, false}, 1.0, 1.0);
        Assert.assertEquals(r.getAdvantages()[1], 6.0, 1e-12);
        Assert.assertEquals(r.getAdvantages()[0], 1.0, 1e-12);
    }

    @Test
    public void testTrajectoryOverload() {
        Trajectory t = new Trajectory();
        t.add(new Trajectory.Step(new double[] {0}, 0, -0.1, 0.0, 2.0, false));
        t.add(new Trajectory.Step(new double[] {0}, 0, -0.1, 0.0, 1.0, true));
        AdvantageEstimator.Result r = AdvantageEstimator.compute(t, 1.0, 1.0);
        Assert.assertEquals(r.getReturns(), new double[] {3, 1}, 1e-12);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testLengthMismatch() {
        AdvantageEstimator.compute(new double[] {1, 2}, new double[] {0}, 0.0,
                new boolean[] {false, false}, 0.99, 0.95);
    }

    @Test
    public void testNormalizedAdvantages() {
        Batch b = new Batch(new double[3][], new int[3], new double[3],
                new double[] {1, 2, 3}, new double[3]);
        double[] n = b.normalizedAdvantages();
        double std = Math.sqrt(2.0 / 3.0);
        Assert.assertEquals(n[0], -1.0 / std, 1e-6);
        Assert.assertEquals(n[1], 0.0, 1e-12);
        Assert.assertEquals(n[2], 1.0 / std, 1e-6);
        Assert.assertEquals(b.getAdvantage(0), 1.0, 0.0, "normalization returns a copy");

        Batch single = new Batch(new double[1][], new int[1], new double[1], new double[] {4}, new double[1]);
        Assert.assertEquals(single.normalizedAdvantages()[0], 4.0, 0.0);
    }
}
