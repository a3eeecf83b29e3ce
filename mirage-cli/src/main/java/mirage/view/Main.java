package mirage.view;

import picocli.CommandLine;

import mirage.ai.config.ConfigurationException;
import mirage.cli.ExitCode;
import mirage.cli.MirageCli;
import mirage.cli.ProfileException;

/**
 * Command-line entry point.
 */
public final class Main {

    public static void main(final String[] args) {
        System.exit(run(args));
    }

    /**
     * Parse and execute; returns the exit code instead of exiting.
     */
    public static int run(String... args) {
        return new CommandLine(new MirageCli())
            .setExecutionExceptionHandler(new ExecutionExceptionHandler())
            .setParameterExceptionHandler(new ParameterExceptionHandler())
            .execute(args);
    }

    /**
     * Handle execution exceptions (runtime errors during command execution).
     */
    private static class ExecutionExceptionHandler implements CommandLine.IExecutionExceptionHandler {
        @Override
        public int handleExecutionException(Exception ex, CommandLine cmd,
                CommandLine.ParseResult parseResult) {
            System.err.println("Error: " + ex.getMessage());
            if (System.getProperty("mirage.debug") != null) {
                ex.printStackTrace(System.err);
            }
            if (ex instanceof ProfileException) {
                return ExitCode.PROFILE_ERROR;
            }
            if (ex instanceof ConfigurationException) {
                return ExitCode.ARGS_ERROR;
            }
            return ExitCode.RUNTIME_ERROR;
        }
    }

    /**
     * Handle parameter/parsing exceptions (invalid arguments).
     */
    private static class ParameterExceptionHandler implements CommandLine.IParameterExceptionHandler {
        @Override
        public int handleParseException(CommandLine.ParameterException ex, String[] args) {
            CommandLine cmd = ex.getCommandLine();
            System.err.println("Error: " + ex.getMessage());
            System.err.println();
            cmd.usage(System.err);
            return ExitCode.ARGS_ERROR;
        }
    }

    private Main() {
    }
}
