package mirage.cli;

import java.util.concurrent.Callable;

import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import mirage.ai.MatchResult;
import mirage.view.RunCharacter;

/**
 * Options and execution shared by the two-character commands.
 */
public abstract class AbstractMatchCommand implements Callable<Integer> {

    @Mixin
    private ProfileOptions profiles = new ProfileOptions();

    @Option(
        names = {"-r", "--rounds"},
        description = "Rounds to play; each character acts once per round. Default: ${DEFAULT-VALUE}",
        defaultValue = "10",
        paramLabel = "N"
    )
    private int rounds;

    @Option(
        names = {"--stochastic"},
        description = "Sample actions from the policies instead of taking the most likely one."
    )
    private boolean stochastic;

    @Mixin
    private EngineOptions engine = new EngineOptions();

    public abstract MatchResult.Kind getKind();

    public ProfileOptions getProfiles() {
        return profiles;
    }

    public EngineOptions getEngine() {
        return engine;
    }

    public int getRounds() {
        return rounds;
    }

    public boolean isDeterministic() {
        return !stochastic;
    }

    @Override
    public Integer call() {
        return RunCharacter.match(this);
    }
}
