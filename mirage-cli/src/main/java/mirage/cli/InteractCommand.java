package mirage.cli;

import picocli.CommandLine.Command;

import mirage.ai.MatchResult;

/**
 * Two characters taking turns in the 12-action interaction environment.
 */
@Command(
    name = "interact",
    description = "Let two characters interact and report how the relationship changed",
    mixinStandardHelpOptions = true,
    sortOptions = false
)
public class InteractCommand extends AbstractMatchCommand {

    @Override
    public MatchResult.Kind getKind() {
        return MatchResult.Kind.INTERACTION;
    }
}
