package mirage.cli;

import java.io.File;
import java.util.Set;

import picocli.CommandLine.Option;

import mirage.ai.CharacterEngine;
import mirage.ai.config.EngineConfig;
import mirage.ai.config.EngineProps;
import mirage.ai.env.Scenario;

/**
 * Options shared by every engine subcommand: where agents live, engine
 * configuration, seeding, scenario presets and output format.
 */
public class EngineOptions {

    @Option(
        names = {"--config"},
        description = "Engine properties file (overrides the built-in defaults).",
        paramLabel = "FILE"
    )
    private File configFile;

    @Option(
        names = {"--storage"},
        description = "Directory for saved agents. Default: keep agents in memory for this run only.",
        paramLabel = "DIR"
    )
    private File storageDir;

    @Option(
        names = {"--seed"},
        description = "Fixed random seed for reproducible runs.",
        paramLabel = "N"
    )
    private Long seed;

    @Option(
        names = {"--scenario"},
        description = "Free-text situation, e.g. \"a dangerous urgent opportunity\". Matching presets are applied at reset.",
        paramLabel = "TEXT"
    )
    private String scenario;

    @Option(
        names = {"--json"},
        description = "Print the result as JSON to stdout."
    )
    private boolean jsonOutput;

    public File getConfigFile() {
        return configFile;
    }

    public File getStorageDir() {
        return storageDir;
    }

    public Long getSeed() {
        return seed;
    }

    public String getScenario() {
        return scenario;
    }

    public Set<Scenario> getScenarios() {
        return Scenario.parse(scenario);
    }

    public boolean isJsonOutput() {
        return jsonOutput;
    }

    /**
     * Resolve engine configuration with command-line values on top.
     */
    public EngineConfig toEngineConfig() {
        EngineConfig config = EngineConfig.load(configFile != null ? configFile.toPath() : null);
        if (storageDir != null) {
            config = config.with(EngineProps.STORAGE_DIR, storageDir.getPath());
        }
        if (seed != null) {
            config = config.with(EngineProps.SEED, seed.toString());
        }
        return config;
    }

    public CharacterEngine createEngine() {
        return new CharacterEngine(toEngineConfig());
    }
}
