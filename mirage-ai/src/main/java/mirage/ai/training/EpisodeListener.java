package mirage.ai.training;

/** Progress callback, invoked after each completed training episode. */
@FunctionalInterface
public interface EpisodeListener {
    EpisodeListener NONE = (episode, total, reward, stats) -> { };

    /**
     * @param episode zero-based index of the episode just finished
     * @param total   number of episodes requested
     */
    void onEpisode(int episode, int total, double reward, UpdateStats stats);
}
