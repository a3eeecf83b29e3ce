package mirage.cli;

/**
 * A profile file or inline assignment could not be turned into a character profile.
 */
public class ProfileException extends RuntimeException {
    public ProfileException(String message) {
        super(message);
    }

    public ProfileException(String message, Throwable cause) {
        super(message, cause);
    }
}
