package mirage.cli;

import picocli.CommandLine.Command;

import mirage.ai.MatchResult;

/**
 * Two characters in the adversarial duel arena.
 */
@Command(
    name = "duel",
    description = "Pit two characters against each other in a duel",
    mixinStandardHelpOptions = true,
    sortOptions = false
)
public class DuelCommand extends AbstractMatchCommand {

    @Override
    public MatchResult.Kind getKind() {
        return MatchResult.Kind.DUEL;
    }
}
