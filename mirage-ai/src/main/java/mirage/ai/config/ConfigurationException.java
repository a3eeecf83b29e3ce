package mirage.ai.config;

/**
 * Fatal configuration problem: an invalid engine setting, or a state/action
 * dimension mismatch between a stored model and the environment requesting it.
 * Never retried.
 */
public class ConfigurationException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
