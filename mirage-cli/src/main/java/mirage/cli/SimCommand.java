package mirage.cli;

import java.util.concurrent.Callable;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import mirage.view.RunCharacter;

/**
 * Inference rollout of one character's policy.
 */
@Command(
    name = "sim",
    description = "Run one character's current policy through an episode",
    mixinStandardHelpOptions = true,
    sortOptions = false
)
public class SimCommand implements Callable<Integer> {

    @Mixin
    private ProfileOptions profiles = new ProfileOptions();

    @Option(
        names = {"-n", "--steps"},
        description = "Number of steps. Default: ${DEFAULT-VALUE}",
        defaultValue = "30",
        paramLabel = "N"
    )
    private int steps;

    @Option(
        names = {"--stochastic"},
        description = "Sample actions from the policy instead of taking the most likely one."
    )
    private boolean stochastic;

    @Mixin
    private EngineOptions engine = new EngineOptions();

    public ProfileOptions getProfiles() {
        return profiles;
    }

    public EngineOptions getEngine() {
        return engine;
    }

    public int getSteps() {
        return steps;
    }

    public boolean isDeterministic() {
        return !stochastic;
    }

    @Override
    public Integer call() {
        return RunCharacter.simulate(this);
    }
}
