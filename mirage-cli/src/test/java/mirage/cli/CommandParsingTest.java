package mirage.cli;

import org.testng.Assert;
import org.testng.annotations.Test;
import picocli.CommandLine;

import mirage.ai.MatchResult;

/**
 * Option parsing of the engine subcommands.
 */
public class CommandParsingTest {

    private static <T> T parseArgs(T cmd, String... args) {
        new CommandLine(cmd).parseArgs(args);
        return cmd;
    }

    @Test
    public void testSimDefaults() {
        SimCommand cmd = parseArgs(new SimCommand(), "-k", "lin");
        Assert.assertEquals(cmd.getSteps(), 30, "Default step count should be 30");
        Assert.assertTrue(cmd.isDeterministic(), "Simulation should be greedy by default");
        Assert.assertFalse(cmd.getEngine().isJsonOutput());
        Assert.assertNull(cmd.getEngine().getSeed());
        Assert.assertTrue(cmd.getEngine().getScenarios().isEmpty());
    }

    @Test
    public void testSimOptions() {
        SimCommand cmd = parseArgs(new SimCommand(), "-k", "lin", "-n", "12", "--stochastic", "--json",
                "--seed", "42", "--scenario", "an urgent fight");
        Assert.assertEquals(cmd.getSteps(), 12);
        Assert.assertFalse(cmd.isDeterministic(), "--stochastic should sample actions");
        Assert.assertTrue(cmd.getEngine().isJsonOutput());
        Assert.assertEquals(cmd.getEngine().getSeed(), Long.valueOf(42));
        Assert.assertEquals(cmd.getEngine().getScenarios().size(), 2);
    }

    @Test
    public void testTrainDefaults() {
        TrainCommand cmd = parseArgs(new TrainCommand(), "-k", "lin");
        Assert.assertEquals(cmd.getEpisodes(), 100);
        Assert.assertEquals(cmd.getStepsPerEpisode(), 50);
        Assert.assertNull(cmd.getTimeoutSeconds());
        Assert.assertNull(cmd.getExportFile());
        Assert.assertFalse(cmd.isQuiet());
    }

    @Test
    public void testTrainOptions() {
        TrainCommand cmd = parseArgs(new TrainCommand(), "-k", "lin", "-e", "5", "-n", "20", "-c", "60",
                "--export", "out/rollouts.jsonl", "-q", "--storage", "agents");
        Assert.assertEquals(cmd.getEpisodes(), 5);
        Assert.assertEquals(cmd.getStepsPerEpisode(), 20);
        Assert.assertEquals(cmd.getTimeoutSeconds(), Integer.valueOf(60));
        Assert.assertEquals(cmd.getExportFile().getName(), "rollouts.jsonl");
        Assert.assertTrue(cmd.isQuiet(), "-q should disable the progress bar");
        Assert.assertEquals(cmd.getEngine().getStorageDir().getName(), "agents");
    }

    @Test
    public void testMatchCommands() {
        InteractCommand interact = parseArgs(new InteractCommand(), "-k", "a", "-k", "b");
        Assert.assertEquals(interact.getRounds(), 10, "Default round count should be 10");
        Assert.assertEquals(interact.getKind(), MatchResult.Kind.INTERACTION);
        Assert.assertEquals(interact.getProfiles().getKeys().size(), 2);

        DuelCommand duel = parseArgs(new DuelCommand(), "-k", "a", "-k", "b", "-r", "3", "--stochastic");
        Assert.assertEquals(duel.getRounds(), 3);
        Assert.assertFalse(duel.isDeterministic());
        Assert.assertEquals(duel.getKind(), MatchResult.Kind.DUEL);
    }

    @Test
    public void testTraitAssignmentsAreCollected() {
        SimCommand cmd = parseArgs(new SimCommand(), "-k", "lin", "-t", "A=0.9", "--trait", "N=0.1");
        Assert.assertEquals(cmd.getProfiles().getTraitAssignments().size(), 2);
    }

    @Test(expectedExceptions = CommandLine.ParameterException.class)
    public void testNonNumericSteps() {
        parseArgs(new SimCommand(), "-k", "lin", "-n", "many");
    }

    @Test(expectedExceptions = CommandLine.ParameterException.class)
    public void testUnknownOption() {
        parseArgs(new TrainCommand(), "-k", "lin", "--turbo");
    }
}
