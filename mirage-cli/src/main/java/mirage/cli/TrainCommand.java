package mirage.cli;

import java.io.File;
import java.util.concurrent.Callable;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import mirage.view.RunCharacter;

/**
 * PPO training of one character's policy; the agent is saved afterwards.
 */
@Command(
    name = "train",
    description = "Train one character's policy and save it",
    mixinStandardHelpOptions = true,
    sortOptions = false
)
public class TrainCommand implements Callable<Integer> {

    @Mixin
    private ProfileOptions profiles = new ProfileOptions();

    @Option(
        names = {"-e", "--episodes"},
        description = "Number of training episodes. Default: ${DEFAULT-VALUE}",
        defaultValue = "100",
        paramLabel = "N"
    )
    private int episodes;

    @Option(
        names = {"-n", "--steps"},
        description = "Steps per episode. Default: ${DEFAULT-VALUE}",
        defaultValue = "50",
        paramLabel = "N"
    )
    private int stepsPerEpisode;

    @Option(
        names = {"-c", "--clock"},
        description = "Stop after this many seconds; the episodes finished so far are kept.",
        paramLabel = "SECS"
    )
    private Integer timeoutSeconds;

    @Option(
        names = {"--export"},
        description = "Write every collected step as JSONL to this file.",
        paramLabel = "FILE"
    )
    private File exportFile;

    @Option(
        names = {"-q", "--quiet"},
        description = "No progress bar."
    )
    private boolean quiet;

    @Mixin
    private EngineOptions engine = new EngineOptions();

    public ProfileOptions getProfiles() {
        return profiles;
    }

    public EngineOptions getEngine() {
        return engine;
    }

    public int getEpisodes() {
        return episodes;
    }

    public int getStepsPerEpisode() {
        return stepsPerEpisode;
    }

    public Integer getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public File getExportFile() {
        return exportFile;
    }

    public boolean isQuiet() {
        return quiet;
    }

    @Override
    public Integer call() {
        return RunCharacter.train(this);
    }
}
