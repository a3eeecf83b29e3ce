package mirage.ai.training;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of a training run. The {@code final*} figures come from the last
 * completed episode's update.
 */
public final class TrainingResult {
    private final String key;
    private final List<Double> rewardHistory;
    private final List<Integer> episodeLengths;
    private final UpdateStats lastUpdate;
    private final int skippedSteps;
    private final boolean cancelled;
    private final long elapsedMillis;

    public TrainingResult(String key, List<Double> rewardHistory, List<Integer> episodeLengths,
                          UpdateStats lastUpdate, int skippedSteps, boolean cancelled, long elapsedMillis) {
        this.key = key;
        this.rewardHistory = Collections.unmodifiableList(rewardHistory);
        this.episodeLengths = Collections.unmodifiableList(episodeLengths);
        this.lastUpdate = lastUpdate;
        this.skippedSteps = skippedSteps;
        this.cancelled = cancelled;
        this.elapsedMillis = elapsedMillis;
    }

    public String getKey() { return key; }
    public List<Double> getRewardHistory() { return rewardHistory; }
    public List<Integer> getEpisodeLengths() { return episodeLengths; }
    public int getEpisodesCompleted() { return rewardHistory.size(); }
    public double getFinalPolicyLoss() { return lastUpdate.getPolicyLoss(); }
    public double getFinalValueLoss() { return lastUpdate.getValueLoss(); }
    public double getFinalEntropy() { return lastUpdate.getEntropy(); }
    public UpdateStats getLastUpdate() { return lastUpdate; }
    public int getSkippedSteps() { return skippedSteps; }
    /** True when the run stopped early on timeout or interruption. */
    public boolean isCancelled() { return cancelled; }
    public long getElapsedMillis() { return elapsedMillis; }

    public double getFinalReward() {
        return rewardHistory.isEmpty() ? 0.0 : rewardHistory.get(rewardHistory.size() - 1);
    }

    public double getAvgEpisodeLength() {
        if (episodeLengths.isEmpty()) {
            return 0.0;
        }
        double sum = 0;
        for (int len : episodeLengths) {
            sum += len;
        }
        return sum / episodeLengths.size();
    }
}
