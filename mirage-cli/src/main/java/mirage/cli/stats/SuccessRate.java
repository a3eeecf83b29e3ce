package mirage.cli.stats;

import java.util.Locale;

/**
 * Share of successful steps in a rollout, with a Wilson score interval.
 * The Wilson bounds stay inside [0, 1] and remain usable for the few dozen
 * steps of a typical simulation, where most outcomes can sit near 0 or 1.
 */
public final class SuccessRate {
    /** z-score of a two-sided 95% interval. */
    public static final double Z_95 = 1.96;

    private final int successes;
    private final int attempts;

    public SuccessRate(int successes, int attempts) {
        if (attempts < 0 || successes < 0 || successes > attempts) {
            throw new IllegalArgumentException("need 0 <= successes <= attempts: " + successes + "/" + attempts);
        }
        this.successes = successes;
        this.attempts = attempts;
    }

    public int getSuccesses() {
        return successes;
    }

    public int getAttempts() {
        return attempts;
    }

    /** Observed fraction, 0 when nothing was attempted. */
    public double fraction() {
        return attempts == 0 ? 0.0 : (double) successes / attempts;
    }

    /**
     * Wilson bounds as fractions; {0, 1} when nothing was attempted.
     */
    public double[] interval(double z) {
        if (attempts == 0) {
            return new double[] {0.0, 1.0};
        }
        double n = attempts;
        double p = fraction();
        double zz = z * z;
        double scale = 1.0 + zz / n;
        double mid = (p + zz / (2 * n)) / scale;
        double half = z / scale * Math.sqrt(p * (1 - p) / n + zz / (4 * n * n));
        return new double[] {Math.max(0.0, mid - half), Math.min(1.0, mid + half)};
    }

    public double[] interval95() {
        return interval(Z_95);
    }

    /** e.g. {@code 7/12 = 58.3% [32.0%, 80.7%]} */
    @Override
    public String toString() {
        double[] ci = interval95();
        return String.format(Locale.ROOT, "%d/%d = %.1f%% [%.1f%%, %.1f%%]",
                successes, attempts, fraction() * 100, ci[0] * 100, ci[1] * 100);
    }
}
