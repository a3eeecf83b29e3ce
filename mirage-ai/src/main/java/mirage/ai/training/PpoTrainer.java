package mirage.ai.training;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;

import org.apache.commons.lang3.time.StopWatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

import mirage.ai.config.PpoConfig;
import mirage.ai.env.Environment;
import mirage.ai.registry.Agent;

/**
 * Episode loop: collect one stochastic rollout, estimate advantages, run
 * the clipped update, repeat. Cancellation (timeout or thread interrupt)
 * is checked between episodes only; an update in progress always finishes.
 */
public class PpoTrainer {
    private static final Logger log = LoggerFactory.getLogger(PpoTrainer.class);

    private final PpoConfig config;
    private final RolloutCollector collector;
    private final PolicyOptimizer optimizer;

    public PpoTrainer(PpoConfig config) {
        this(config, new RolloutCollector(), new PolicyOptimizer(config));
    }

    public PpoTrainer(PpoConfig config, RolloutCollector collector, PolicyOptimizer optimizer) {
        this.config = config;
        this.collector = collector;
        this.optimizer = optimizer;
    }

    public TrainingResult train(Agent agent, Environment env, int episodes, int stepsPerEpisode, Random rng) {
        return train(agent, env, episodes, stepsPerEpisode, rng, TrainingOptions.defaults());
    }

    public TrainingResult train(Agent agent, Environment env, int episodes, int stepsPerEpisode,
                                Random rng, TrainingOptions options) {
        Preconditions.checkArgument(episodes >= 1, "episodes must be >= 1: %s", episodes);
        Preconditions.checkArgument(stepsPerEpisode >= 1, "stepsPerEpisode must be >= 1: %s", stepsPerEpisode);

        StopWatch watch = StopWatch.createStarted();
        long deadlineMillis = options.getTimeout() == null ? Long.MAX_VALUE : options.getTimeout().toMillis();
        List<Double> rewards = new ArrayList<>(episodes);
        List<Integer> lengths = new ArrayList<>(episodes);
        UpdateStats last = UpdateStats.empty();
        int skipped = 0;
        boolean cancelled = false;

        for (int episode = 0; episode < episodes; episode++) {
            if (Thread.currentThread().isInterrupted() || watch.getTime(TimeUnit.MILLISECONDS) >= deadlineMillis) {
                cancelled = true;
                log.info("Training {} cancelled after {} of {} episodes", agent.getKey(), episode, episodes);
                break;
            }

            Trajectory trajectory = collector.collect(agent, env, stepsPerEpisode, false, rng);
            Batch batch = Batch.of(trajectory, config.getGamma(), config.getGaeLambda());
            last = optimizer.update(agent, batch);
            skipped += last.getSkippedSteps();

            double reward = trajectory.totalReward();
            rewards.add(reward);
            lengths.add(trajectory.size());
            if (options.getWriter() != null) {
                options.getWriter().recordEpisode(episode, trajectory, last);
            }
            log.debug("{} episode {}/{}: reward={} length={} {}", agent.getKey(), episode + 1, episodes,
                    reward, trajectory.size(), last);
            options.getListener().onEpisode(episode, episodes, reward, last);
        }

        watch.stop();
        TrainingResult result = new TrainingResult(agent.getKey(), rewards, lengths, last, skipped,
                cancelled, watch.getTime(TimeUnit.MILLISECONDS));
        log.info("Trained {} for {} episodes in {} ms (avg length {}, skipped steps {})", agent.getKey(),
                result.getEpisodesCompleted(), result.getElapsedMillis(), result.getAvgEpisodeLength(), skipped);
        return result;
    }
}
