package mirage.view;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.testng.Assert;
import org.testng.annotations.Test;

import mirage.ai.registry.FileAgentStore;
import mirage.cli.ExitCode;

/**
 * End-to-end exit codes of the command-line entry point.
 */
public class MainTest {

    @Test
    public void testSimulationSucceeds() {
        Assert.assertEquals(Main.run("sim", "-k", "tester", "-n", "3", "--seed", "1"), ExitCode.SUCCESS);
    }

    @Test
    public void testJsonMatch() {
        Assert.assertEquals(Main.run("duel", "-k", "a", "-k", "b", "-r", "2", "--seed", "3", "--json"),
                ExitCode.SUCCESS);
    }

    @Test
    public void testTrainingSavesToStorage() throws IOException {
        Path storage = Files.createTempDirectory("mirage-cli");
        Assert.assertEquals(Main.run("train", "-k", "trainee", "-e", "2", "-n", "4", "-q",
                "--seed", "5", "--storage", storage.toString()), ExitCode.SUCCESS);
        Assert.assertTrue(Files.isRegularFile(new FileAgentStore(storage).fileFor("trainee")));
    }

    @Test
    public void testMissingProfileIsProfileError() {
        Assert.assertEquals(Main.run("sim"), ExitCode.PROFILE_ERROR);
        Assert.assertEquals(Main.run("interact", "-k", "only-one"), ExitCode.PROFILE_ERROR);
        Assert.assertEquals(Main.run("sim", "-p", "no/such/profile.json"), ExitCode.PROFILE_ERROR);
        Assert.assertEquals(Main.run("sim", "-k", "bob#duel"), ExitCode.PROFILE_ERROR);
    }

    @Test
    public void testBadArgumentsAreArgsError() throws IOException {
        Assert.assertEquals(Main.run("sim", "-k", "x", "--bogus"), ExitCode.ARGS_ERROR);
        Assert.assertEquals(Main.run("sim", "-k", "x", "-n", "0"), ExitCode.ARGS_ERROR);
        Assert.assertEquals(Main.run("sim", "-k", "x", "--config", "no/such/engine.properties"), ExitCode.ARGS_ERROR);

        Path config = Files.createTempFile("engine", ".properties");
        Files.write(config, "clipRatio=2\n".getBytes(StandardCharsets.UTF_8));
        Assert.assertEquals(Main.run("sim", "-k", "x", "--config", config.toString()), ExitCode.ARGS_ERROR);
    }
}
