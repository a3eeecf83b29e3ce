package mirage.ai.nn;

/**
 * Helpers over flat gradient buffers.
 */
public final class Gradients {

    private Gradients() { }

    public static double l2Norm(double[] grad) {
        double sum = 0.0;
        for (double g : grad) {
            sum += g * g;
        }
        return Math.sqrt(sum);
    }

    /**
     * Rescale {@code grad} in place so its global L2 norm is at most {@code maxNorm}.
     *
     * @return the norm before clipping
     */
    public static double clipByGlobalNorm(double[] grad, double maxNorm) {
        double norm = l2Norm(grad);
        if (norm > maxNorm) {
            double scale = maxNorm / (norm + 1e-6);
            for (int i = 0; i < grad.length; i++) {
                grad[i] *= scale;
            }
        }
        return norm;
    }

    public static boolean allFinite(double[] values) {
        for (double v : values) {
            if (!Double.isFinite(v)) {
                return false;
            }
        }
        return true;
    }
}
