package mirage.cli.json;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON output model of a CLI run. Exactly one of {@link #simulation},
 * {@link #training} and {@link #match} is set, according to the command.
 * Serialized with Gson.
 */
public class RunReport {
    /** Mirage version string */
    public String version;

    /** Subcommand that produced this report */
    public String command;

    public RunConfig config;

    public SimulationReport simulation;

    public TrainingReport training;

    public MatchReport match;

    /**
     * Settings the run used.
     */
    public static class RunConfig {
        public List<String> characters = new ArrayList<>();
        public List<String> scenarios = new ArrayList<>();
        public Long seed;
        public String storage;
        public boolean deterministic;
    }

    public static class SimulationReport {
        public String key;
        public int steps;
        public double totalReward;
        public double fateDelta;
        public int successes;
        public double successRate;
        public double[] successRateCi95;
        public List<ActionEntry> actionHistory = new ArrayList<>();
        public StateEntry finalState;
    }

    public static class TrainingReport {
        public String key;
        public int episodesRequested;
        public int episodesCompleted;
        public boolean cancelled;
        public boolean saved;
        public long durationMs;
        public double avgEpisodeLength;
        public double finalReward;
        public Double finalPolicyLoss;
        public Double finalValueLoss;
        public Double finalEntropy;
        public int skippedSteps;
        public List<Double> rewardHistory = new ArrayList<>();
    }

    public static class MatchReport {
        public String kind;
        public int turns;
        public String verdict;
        /** Interaction only */
        public String relationshipChange;
        /** Duel only; null on a tie */
        public String winner;
        public List<ParticipantEntry> participants = new ArrayList<>();
    }

    public static class ParticipantEntry {
        public String key;
        public double totalReward;
        public List<ActionEntry> actions = new ArrayList<>();
        public StateEntry finalState;
    }

    /**
     * One step of an action history.
     */
    public static class ActionEntry {
        public int step;
        public String action;
        public String outcome;
        public boolean success;
        public double reward;
    }

    /**
     * Episodic state at the end of a run.
     */
    public static class StateEntry {
        public double health;
        public double energy;
        public double wealth;
        public double reputation;
        public double happiness;
        public double stress;
        public double trust;
        public Map<String, Double> emotions = new LinkedHashMap<>();
        public Map<String, Double> pressures = new LinkedHashMap<>();
    }
}
