package mirage.view;

import java.io.PrintStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import mirage.ai.CharacterEngine;
import mirage.ai.MatchResult;
import mirage.ai.SimulationResult;
import mirage.ai.env.ActionCatalog;
import mirage.ai.env.CharacterProfile;
import mirage.ai.env.Emotion;
import mirage.ai.env.EpisodicState;
import mirage.ai.env.Pressure;
import mirage.ai.env.Scenario;
import mirage.ai.env.StepResult;
import mirage.ai.registry.Agent;
import mirage.ai.training.TrainingOptions;
import mirage.ai.training.TrainingResult;
import mirage.ai.training.TrajectoryWriter;
import mirage.cli.AbstractMatchCommand;
import mirage.cli.EngineOptions;
import mirage.cli.ExitCode;
import mirage.cli.MirageCli;
import mirage.cli.ProfileException;
import mirage.cli.ProgressBar;
import mirage.cli.SimCommand;
import mirage.cli.TrainCommand;
import mirage.cli.json.RunReport;
import mirage.cli.stats.SuccessRate;

/**
 * Executes the engine subcommands and prints their results, as a text
 * summary or as a {@link RunReport} JSON document.
 */
public final class RunCharacter {

    private RunCharacter() {
    }

    public static int simulate(SimCommand cmd) {
        if (cmd.getSteps() < 1) {
            System.err.println("Error: --steps must be at least 1");
            return ExitCode.ARGS_ERROR;
        }
        CharacterProfile profile;
        try {
            profile = cmd.getProfiles().resolve(1).get(0);
        } catch (ProfileException e) {
            System.err.println("Error: " + e.getMessage());
            return ExitCode.PROFILE_ERROR;
        }

        EngineOptions opts = cmd.getEngine();
        CharacterEngine engine = opts.createEngine();
        SimulationResult result = engine.simulate(profile, cmd.getSteps(), cmd.isDeterministic(), opts.getScenarios());

        int steps = result.getActionHistory().size();
        SuccessRate rate = new SuccessRate(result.getSuccessCount(), steps);

        if (opts.isJsonOutput()) {
            RunReport report = newReport("sim", opts, cmd.isDeterministic(), List.of(profile.getIdentityKey()));
            RunReport.SimulationReport sim = new RunReport.SimulationReport();
            sim.key = result.getKey();
            sim.steps = steps;
            sim.totalReward = result.getTotalReward();
            sim.fateDelta = result.getFateDelta();
            sim.successes = rate.getSuccesses();
            sim.successRate = rate.fraction();
            sim.successRateCi95 = rate.interval95();
            for (EpisodicState.HistoryEntry e : result.getActionHistory()) {
                sim.actionHistory.add(toEntry(e));
            }
            sim.finalState = toEntry(result.getFinalState());
            report.simulation = sim;
            printJson(report);
            return ExitCode.SUCCESS;
        }

        PrintStream out = System.out;
        out.printf("=== Simulation: %s ===%n", profile.getName());
        for (EpisodicState.HistoryEntry e : result.getActionHistory()) {
            out.printf("%3d  %-14s %-8s %+6.2f  %s%n", e.getStep(), e.getAction(),
                    e.isSuccess() ? "success" : "failure", e.getReward(), e.getOutcome());
        }
        out.printf("Total reward: %.2f (fate delta %+.3f)%n", result.getTotalReward(), result.getFateDelta());
        out.println("Successes: " + rate);
        for (Map.Entry<String, int[]> t : result.getActionTallies().entrySet()) {
            out.printf("  %-14s %d/%d%n", t.getKey(), t.getValue()[1], t.getValue()[0]);
        }
        out.println("Final state: " + result.getFinalState());
        out.flush();
        return ExitCode.SUCCESS;
    }

    public static int train(TrainCommand cmd) {
        if (cmd.getEpisodes() < 1 || cmd.getStepsPerEpisode() < 1) {
            System.err.println("Error: --episodes and --steps must be at least 1");
            return ExitCode.ARGS_ERROR;
        }
        CharacterProfile profile;
        try {
            profile = cmd.getProfiles().resolve(1).get(0);
        } catch (ProfileException e) {
            System.err.println("Error: " + e.getMessage());
            return ExitCode.PROFILE_ERROR;
        }

        EngineOptions opts = cmd.getEngine();
        CharacterEngine engine = opts.createEngine();
        ProgressBar progress = cmd.isQuiet() ? null : new ProgressBar(System.err, cmd.getEpisodes());

        TrainingOptions.Builder options = TrainingOptions.builder();
        if (cmd.getTimeoutSeconds() != null) {
            options.timeout(Duration.ofSeconds(cmd.getTimeoutSeconds()));
        }
        if (progress != null) {
            options.listener((episode, total, reward, stats) -> progress.update(episode + 1, reward));
        }

        TrainingResult result;
        TrajectoryWriter writer = cmd.getExportFile() == null ? null
                : new TrajectoryWriter(cmd.getExportFile().toPath(), ActionCatalog.CHARACTER);
        try {
            options.writer(writer);
            result = engine.train(profile, cmd.getEpisodes(), cmd.getStepsPerEpisode(), opts.getScenarios(),
                    options.build());
        } finally {
            if (writer != null) {
                writer.close();
            }
        }
        if (progress != null) {
            progress.finish();
        }

        boolean saved = !engine.getRegistry().get(profile.getIdentityKey()).map(Agent::isUnstable).orElse(true);

        if (opts.isJsonOutput()) {
            RunReport report = newReport("train", opts, false, List.of(profile.getIdentityKey()));
            RunReport.TrainingReport tr = new RunReport.TrainingReport();
            tr.key = result.getKey();
            tr.episodesRequested = cmd.getEpisodes();
            tr.episodesCompleted = result.getEpisodesCompleted();
            tr.cancelled = result.isCancelled();
            tr.saved = saved;
            tr.durationMs = result.getElapsedMillis();
            tr.avgEpisodeLength = result.getAvgEpisodeLength();
            tr.finalReward = result.getFinalReward();
            tr.finalPolicyLoss = finiteOrNull(result.getFinalPolicyLoss());
            tr.finalValueLoss = finiteOrNull(result.getFinalValueLoss());
            tr.finalEntropy = finiteOrNull(result.getFinalEntropy());
            tr.skippedSteps = result.getSkippedSteps();
            tr.rewardHistory.addAll(result.getRewardHistory());
            report.training = tr;
            printJson(report);
            return ExitCode.SUCCESS;
        }

        PrintStream out = System.out;
        out.printf("=== Training: %s ===%n", profile.getName());
        out.printf("Episodes: %d/%d%s in %d ms%n", result.getEpisodesCompleted(), cmd.getEpisodes(),
                result.isCancelled() ? " (stopped early)" : "", result.getElapsedMillis());
        out.printf("Average episode length: %.1f%n", result.getAvgEpisodeLength());
        out.printf("Final episode reward: %.2f%n", result.getFinalReward());
        out.printf("Final losses: policy %.4f, value %.4f, entropy %.4f%n", result.getFinalPolicyLoss(),
                result.getFinalValueLoss(), result.getFinalEntropy());
        if (result.getSkippedSteps() > 0) {
            out.printf("Skipped %d unstable update steps%n", result.getSkippedSteps());
        }
        out.println(saved ? "Agent saved." : "Agent NOT saved: an update was numerically unstable.");
        if (cmd.getExportFile() != null) {
            out.println("Trajectories written to " + cmd.getExportFile());
        }
        out.flush();
        return ExitCode.SUCCESS;
    }

    public static int match(AbstractMatchCommand cmd) {
        if (cmd.getRounds() < 1) {
            System.err.println("Error: --rounds must be at least 1");
            return ExitCode.ARGS_ERROR;
        }
        List<CharacterProfile> profiles;
        try {
            profiles = cmd.getProfiles().resolve(2);
        } catch (ProfileException e) {
            System.err.println("Error: " + e.getMessage());
            return ExitCode.PROFILE_ERROR;
        }

        EngineOptions opts = cmd.getEngine();
        CharacterEngine engine = opts.createEngine();
        boolean duel = cmd.getKind() == MatchResult.Kind.DUEL;
        MatchResult result = duel
                ? engine.duel(profiles.get(0), profiles.get(1), cmd.getRounds(), cmd.isDeterministic())
                : engine.interact(profiles.get(0), profiles.get(1), cmd.getRounds(), cmd.isDeterministic());

        if (opts.isJsonOutput()) {
            List<String> keys = List.of(profiles.get(0).getIdentityKey(), profiles.get(1).getIdentityKey());
            RunReport report = newReport(duel ? "duel" : "interact", opts, cmd.isDeterministic(), keys);
            RunReport.MatchReport mr = new RunReport.MatchReport();
            mr.kind = result.getKind().name();
            mr.turns = result.getTurns();
            mr.verdict = result.getVerdict().getDescription();
            if (duel) {
                mr.winner = result.getWinner() < 0 ? null : profiles.get(result.getWinner()).getIdentityKey();
            } else {
                mr.relationshipChange = result.getRelationshipChange().getDescription();
            }
            for (int p = 0; p < 2; p++) {
                RunReport.ParticipantEntry pe = new RunReport.ParticipantEntry();
                pe.key = result.getKey(p);
                pe.totalReward = result.getTotal(p);
                List<StepResult> log = result.getLog(p);
                for (int r = 0; r < log.size(); r++) {
                    pe.actions.add(toEntry(log.get(r), r + 1));
                }
                pe.finalState = toEntry(result.getFinalState(p));
                mr.participants.add(pe);
            }
            report.match = mr;
            printJson(report);
            return ExitCode.SUCCESS;
        }

        PrintStream out = System.out;
        out.printf("=== %s: %s vs %s ===%n", duel ? "Duel" : "Interaction",
                profiles.get(0).getName(), profiles.get(1).getName());
        List<StepResult> first = result.getLog(0);
        List<StepResult> second = result.getLog(1);
        for (int r = 0; r < Math.max(first.size(), second.size()); r++) {
            out.printf("Round %d%n", r + 1);
            if (r < first.size()) {
                printTurn(out, profiles.get(0).getName(), first.get(r));
            }
            if (r < second.size()) {
                printTurn(out, profiles.get(1).getName(), second.get(r));
            }
        }
        out.printf("Totals: %s %.2f, %s %.2f%n", profiles.get(0).getName(), result.getTotal(0),
                profiles.get(1).getName(), result.getTotal(1));
        out.println("Verdict: " + result.getVerdict().getDescription());
        if (duel) {
            out.println("Winner: " + (result.getWinner() < 0 ? "draw" : profiles.get(result.getWinner()).getName()));
        } else {
            out.println("Relationship: " + result.getRelationshipChange().getDescription());
        }
        out.flush();
        return ExitCode.SUCCESS;
    }

    private static void printTurn(PrintStream out, String name, StepResult s) {
        out.printf("  %-12s %-14s %+6.2f  %s%n", name, s.getActionLabel(), s.getReward(), s.getOutcomeLabel());
    }

    private static RunReport newReport(String command, EngineOptions opts, boolean deterministic, List<String> keys) {
        RunReport report = new RunReport();
        report.version = new MirageCli.VersionProvider().getVersion()[0];
        report.command = command;
        report.config = new RunReport.RunConfig();
        report.config.characters.addAll(keys);
        Set<Scenario> scenarios = opts.getScenarios();
        List<String> names = new ArrayList<>();
        for (Scenario s : scenarios) {
            names.add(s.name());
        }
        report.config.scenarios = names;
        report.config.seed = opts.getSeed();
        report.config.storage = opts.getStorageDir() != null ? opts.getStorageDir().getPath() : null;
        report.config.deterministic = deterministic;
        return report;
    }

    private static RunReport.ActionEntry toEntry(EpisodicState.HistoryEntry e) {
        RunReport.ActionEntry a = new RunReport.ActionEntry();
        a.step = e.getStep();
        a.action = e.getAction();
        a.outcome = e.getOutcome();
        a.success = e.isSuccess();
        a.reward = e.getReward();
        return a;
    }

    private static RunReport.ActionEntry toEntry(StepResult s, int round) {
        RunReport.ActionEntry a = new RunReport.ActionEntry();
        a.step = round;
        a.action = s.getActionLabel();
        a.outcome = s.getOutcomeLabel();
        a.success = s.getOutcome().isSuccess();
        a.reward = s.getReward();
        return a;
    }

    static RunReport.StateEntry toEntry(EpisodicState s) {
        RunReport.StateEntry e = new RunReport.StateEntry();
        e.health = s.getHealth();
        e.energy = s.getEnergy();
        e.wealth = s.getWealth();
        e.reputation = s.getReputation();
        e.happiness = s.getHappiness();
        e.stress = s.getStress();
        e.trust = s.getTrust();
        for (Emotion em : Emotion.values()) {
            e.emotions.put(em.name().toLowerCase(Locale.ROOT), s.emotion(em));
        }
        for (Pressure p : Pressure.values()) {
            e.pressures.put(p.name().toLowerCase(Locale.ROOT), s.pressure(p));
        }
        return e;
    }

    private static Double finiteOrNull(double v) {
        return Double.isFinite(v) ? v : null;
    }

    private static void printJson(RunReport report) {
        Gson gson = new GsonBuilder()
            .setPrettyPrinting()
            .serializeNulls()
            .create();
        System.out.println(gson.toJson(report));
        System.out.flush();
    }
}
