package mirage.ai.config;

/**
 * Validated training hyper-parameters. Built from an {@link EngineConfig}
 * or, in tests, from {@link #builder()}.
 */
public final class PpoConfig {
    private final double gamma;
    private final double gaeLambda;
    private final double learningRate;
    private final double clipRatio;
    private final int updateEpochs;
    private final double valueCoef;
    private final double entropyCoef;
    private final double maxGradNorm;
    private final int hiddenDim;
    private final boolean normalizeAdvantages;
    private final double probabilityFloor;

    private PpoConfig(Builder b) {
        this.gamma = b.gamma;
        this.gaeLambda = b.gaeLambda;
        this.learningRate = b.learningRate;
        this.clipRatio = b.clipRatio;
        this.updateEpochs = b.updateEpochs;
        this.valueCoef = b.valueCoef;
        this.entropyCoef = b.entropyCoef;
        this.maxGradNorm = b.maxGradNorm;
        this.hiddenDim = b.hiddenDim;
        this.normalizeAdvantages = b.normalizeAdvantages;
        this.probabilityFloor = b.probabilityFloor;
    }

    public static PpoConfig defaults() {
        return builder().build();
    }

    public static PpoConfig from(EngineConfig config) {
        return builder()
                .gamma(config.getDouble(EngineProps.GAMMA))
                .gaeLambda(config.getDouble(EngineProps.GAE_LAMBDA))
                .learningRate(config.getDouble(EngineProps.LEARNING_RATE))
                .clipRatio(config.getDouble(EngineProps.CLIP_RATIO))
                .updateEpochs(config.getInt(EngineProps.UPDATE_EPOCHS))
                .valueCoef(config.getDouble(EngineProps.VALUE_COEF))
                .entropyCoef(config.getDouble(EngineProps.ENTROPY_COEF))
                .maxGradNorm(config.getDouble(EngineProps.MAX_GRAD_NORM))
                .hiddenDim(config.getInt(EngineProps.HIDDEN_DIM))
                .normalizeAdvantages(config.getBoolean(EngineProps.NORMALIZE_ADVANTAGES))
                .probabilityFloor(config.getDouble(EngineProps.PROBABILITY_FLOOR))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .gamma(gamma).gaeLambda(gaeLambda).learningRate(learningRate)
                .clipRatio(clipRatio).updateEpochs(updateEpochs)
                .valueCoef(valueCoef).entropyCoef(entropyCoef)
                .maxGradNorm(maxGradNorm).hiddenDim(hiddenDim)
                .normalizeAdvantages(normalizeAdvantages)
                .probabilityFloor(probabilityFloor);
    }

    public double getGamma() { return gamma; }
    public double getGaeLambda() { return gaeLambda; }
    public double getLearningRate() { return learningRate; }
    public double getClipRatio() { return clipRatio; }
    public int getUpdateEpochs() { return updateEpochs; }
    public double getValueCoef() { return valueCoef; }
    public double getEntropyCoef() { return entropyCoef; }
    public double getMaxGradNorm() { return maxGradNorm; }
    public int getHiddenDim() { return hiddenDim; }
    public boolean isNormalizeAdvantages() { return normalizeAdvantages; }
    public double getProbabilityFloor() { return probabilityFloor; }

    @Override
    public String toString() {
        return "PpoConfig{gamma=" + gamma + ", lambda=" + gaeLambda + ", lr=" + learningRate
                + ", clip=" + clipRatio + ", epochs=" + updateEpochs + ", valueCoef=" + valueCoef
                + ", entropyCoef=" + entropyCoef + ", maxGradNorm=" + maxGradNorm
                + ", hidden=" + hiddenDim + ", normalizeAdvantages=" + normalizeAdvantages + "}";
    }

    public static final class Builder {
        private double gamma = 0.99;
        private double gaeLambda = 0.95;
        private double learningRate = 3e-4;
        private double clipRatio = 0.2;
        private int updateEpochs = 10;
        private double valueCoef = 0.5;
        private double entropyCoef = 0.01;
        private double maxGradNorm = 0.5;
        private int hiddenDim = 64;
        private boolean normalizeAdvantages = false;
        private double probabilityFloor = 1e-6;

        private Builder() { }

        public Builder gamma(double v) { this.gamma = v; return this; }
        public Builder gaeLambda(double v) { this.gaeLambda = v; return this; }
        public Builder learningRate(double v) { this.learningRate = v; return this; }
        public Builder clipRatio(double v) { this.clipRatio = v; return this; }
        public Builder updateEpochs(int v) { this.updateEpochs = v; return this; }
        public Builder valueCoef(double v) { this.valueCoef = v; return this; }
        public Builder entropyCoef(double v) { this.entropyCoef = v; return this; }
        public Builder maxGradNorm(double v) { this.maxGradNorm = v; return this; }
        public Builder hiddenDim(int v) { this.hiddenDim = v; return this; }
        public Builder normalizeAdvantages(boolean v) { this.normalizeAdvantages = v; return this; }
        public Builder probabilityFloor(double v) { this.probabilityFloor = v; return this; }

        public PpoConfig build() {
            check(gamma >= 0 && gamma <= 1, "gamma must be in [0, 1]: " + gamma);
            check(gaeLambda >= 0 && gaeLambda <= 1, "gaeLambda must be in [0, 1]: " + gaeLambda);
            check(learningRate > 0 && Double.isFinite(learningRate), "learningRate must be positive: " + learningRate);
            check(clipRatio > 0 && clipRatio < 1, "clipRatio must be in (0, 1): " + clipRatio);
            check(updateEpochs >= 1, "updateEpochs must be >= 1: " + updateEpochs);
            check(valueCoef >= 0, "valueCoef must be >= 0: " + valueCoef);
            check(entropyCoef >= 0, "entropyCoef must be >= 0: " + entropyCoef);
            check(maxGradNorm > 0, "maxGradNorm must be positive: " + maxGradNorm);
            check(hiddenDim >= 1, "hiddenDim must be >= 1: " + hiddenDim);
            // floor * actionDim must stay well below 1; 12 actions is the widest catalog
            check(probabilityFloor > 0 && probabilityFloor < 0.01, "probabilityFloor must be in (0, 0.01): " + probabilityFloor);
            return new PpoConfig(this);
        }

        private static void check(boolean ok, String message) {
            if (!ok) {
                throw new ConfigurationException(message);
            }
        }
    }
}
