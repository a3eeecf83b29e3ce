package mirage.cli;

/**
 * Exit codes of the mirage CLI.
 */
public final class ExitCode {
    /** Successful execution */
    public static final int SUCCESS = 0;

    /** Invalid arguments or usage error */
    public static final int ARGS_ERROR = 1;

    /** Character profile could not be read or is invalid */
    public static final int PROFILE_ERROR = 2;

    /** Runtime/execution error */
    public static final int RUNTIME_ERROR = 3;

    private ExitCode() {
    }
}
