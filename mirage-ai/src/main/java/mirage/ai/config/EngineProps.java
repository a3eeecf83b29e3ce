package mirage.ai.config;

/**
 * Engine property keys and their built-in defaults.
 * Each key is read as {@code mirage.<key>} from system properties and
 * as {@code <key>} from properties files.
 */
public enum EngineProps {
    GAMMA("gamma", "0.99"),
    GAE_LAMBDA("gaeLambda", "0.95"),
    LEARNING_RATE("learningRate", "3e-4"),
    CLIP_RATIO("clipRatio", "0.2"),
    UPDATE_EPOCHS("updateEpochs", "10"),
    VALUE_COEF("valueCoef", "0.5"),
    ENTROPY_COEF("entropyCoef", "0.01"),
    MAX_GRAD_NORM("maxGradNorm", "0.5"),
    HIDDEN_DIM("hiddenDim", "64"),
    NORMALIZE_ADVANTAGES("normalizeAdvantages", "false"),
    PROBABILITY_FLOOR("probabilityFloor", "1e-6"),
    MAX_STEPS("maxSteps", "100"),
    STORAGE_DIR("storageDir", ""),
    SEED("seed", "");

    private final String key;
    private final String defaultValue;

    EngineProps(String key, String defaultValue) {
        this.key = key;
        this.defaultValue = defaultValue;
    }

    public String getKey() {
        return key;
    }

    public String getDefaultValue() {
        return defaultValue;
    }

    public String getSystemPropertyName() {
        return "mirage." + key;
    }
}
