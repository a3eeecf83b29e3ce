package mirage.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.IVersionProvider;

/**
 * Root command. Subcommands run the character engine.
 */
@Command(
    name = "mirage",
    description = "Mirage: train and run character decision policies",
    mixinStandardHelpOptions = true,
    versionProvider = MirageCli.VersionProvider.class,
    subcommands = {
        CommandLine.HelpCommand.class,
        SimCommand.class,
        TrainCommand.class,
        InteractCommand.class,
        DuelCommand.class
    }
)
public class MirageCli implements Runnable {

    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }

    public static class VersionProvider implements IVersionProvider {
        @Override
        public String[] getVersion() {
            String version = MirageCli.class.getPackage().getImplementationVersion();
            return new String[] {
                "Mirage " + (version != null ? version : "development build"),
                "Java: " + System.getProperty("java.version"),
                "OS: " + System.getProperty("os.name") + " " + System.getProperty("os.version")
            };
        }
    }
}
