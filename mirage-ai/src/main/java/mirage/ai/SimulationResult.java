package mirage.ai;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import mirage.ai.env.EpisodicState;

/**
 * Inference rollout of one character: the step-by-step history, the reward
 * total and the episodic state the character ended in.
 */
public final class SimulationResult {
    /** Reward total is reported to the fate layer scaled down by this factor. */
    public static final double FATE_SCALE = 10.0;

    private final String key;
    private final EpisodicState finalState;
    private final double totalReward;

    SimulationResult(String key, EpisodicState finalState) {
        this.key = key;
        this.finalState = finalState;
        double sum = 0.0;
        for (EpisodicState.HistoryEntry e : finalState.getHistory()) {
            sum += e.getReward();
        }
        this.totalReward = sum;
    }

    public String getKey() {
        return key;
    }

    public List<EpisodicState.HistoryEntry> getActionHistory() {
        return finalState.getHistory();
    }

    public double getTotalReward() {
        return totalReward;
    }

    public EpisodicState getFinalState() {
        return finalState;
    }

    public double getFateDelta() {
        return totalReward / FATE_SCALE;
    }

    public int getSuccessCount() {
        int n = 0;
        for (EpisodicState.HistoryEntry e : finalState.getHistory()) {
            if (e.isSuccess()) {
                n++;
            }
        }
        return n;
    }

    /** Attempts per action label, in first-use order. */
    public Map<String, int[]> getActionTallies() {
        Map<String, int[]> tallies = new LinkedHashMap<>();
        for (EpisodicState.HistoryEntry e : finalState.getHistory()) {
            int[] t = tallies.computeIfAbsent(e.getAction(), k -> new int[2]);
            t[0]++;
            if (e.isSuccess()) {
                t[1]++;
            }
        }
        return tallies;
    }
}
