package mirage.ai.training;

/**
 * Diagnostics of one {@link PolicyOptimizer#update} call, averaged over the
 * epochs whose gradient step was applied. Losses are NaN when every epoch
 * was skipped.
 */
public final class UpdateStats {
    private final double policyLoss;
    private final double valueLoss;
    private final double entropy;
    private final double totalLoss;
    private final double clipFraction;
    private final int appliedSteps;
    private final int skippedSteps;

    public UpdateStats(double policyLoss, double valueLoss, double entropy, double totalLoss,
                       double clipFraction, int appliedSteps, int skippedSteps) {
        this.policyLoss = policyLoss;
        this.valueLoss = valueLoss;
        this.entropy = entropy;
        this.totalLoss = totalLoss;
        this.clipFraction = clipFraction;
        this.appliedSteps = appliedSteps;
        this.skippedSteps = skippedSteps;
    }

    public static UpdateStats empty() {
        return new UpdateStats(Double.NaN, Double.NaN, Double.NaN, Double.NaN, 0.0, 0, 0);
    }

    public double getPolicyLoss() { return policyLoss; }
    public double getValueLoss() { return valueLoss; }
    public double getEntropy() { return entropy; }
    public double getTotalLoss() { return totalLoss; }
    public double getClipFraction() { return clipFraction; }
    public int getAppliedSteps() { return appliedSteps; }
    public int getSkippedSteps() { return skippedSteps; }

    @Override
    public String toString() {
        return String.format("policy=%.4f value=%.4f entropy=%.4f total=%.4f clip=%.3f applied=%d skipped=%d",
                policyLoss, valueLoss, entropy, totalLoss, clipFraction, appliedSteps, skippedSteps);
    }
}
