package mirage.ai;

import java.nio.file.Paths;
import java.util.Collections;
import java.util.Random;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

import mirage.ai.config.EngineConfig;
import mirage.ai.config.EngineProps;
import mirage.ai.config.PpoConfig;
import mirage.ai.env.AbstractEnvironment;
import mirage.ai.env.CharacterEnvironment;
import mirage.ai.env.CharacterProfile;
import mirage.ai.env.DuelEnvironment;
import mirage.ai.env.InteractionEnvironment;
import mirage.ai.env.Scenario;
import mirage.ai.registry.Agent;
import mirage.ai.registry.AgentRegistry;
import mirage.ai.registry.AgentStore;
import mirage.ai.registry.FileAgentStore;
import mirage.ai.registry.InMemoryAgentStore;
import mirage.ai.training.MatchRunner;
import mirage.ai.training.PpoTrainer;
import mirage.ai.training.RolloutCollector;
import mirage.ai.training.TrainingOptions;
import mirage.ai.training.TrainingResult;

/**
 * Entry point for the layers around the engine: hand it a profile, get
 * back an action history, a training summary or a match outcome.
 *
 * <p>Agents are kept per variant: the solo agent lives under the profile's
 * identity key, the interaction and duel agents under
 * {@code key#interaction} and {@code key#duel}, since their state and
 * action spaces differ. Identity keys cannot contain
 * {@link CharacterProfile#VARIANT_SEPARATOR}, so a variant key never names
 * another character's solo agent.
 */
public class CharacterEngine {
    private static final Logger log = LoggerFactory.getLogger(CharacterEngine.class);

    public static final String INTERACTION_SUFFIX = CharacterProfile.VARIANT_SEPARATOR + "interaction";
    public static final String DUEL_SUFFIX = CharacterProfile.VARIANT_SEPARATOR + "duel";

    private final PpoConfig ppo;
    private final AgentRegistry registry;
    private final PpoTrainer trainer;
    private final RolloutCollector collector = new RolloutCollector();
    private final MatchRunner matchRunner = new MatchRunner();
    private final Long seed;

    public CharacterEngine(EngineConfig config) {
        this(PpoConfig.from(config), new AgentRegistry(storeFor(config), PpoConfig.from(config)),
                config.isSet(EngineProps.SEED) ? config.getLong(EngineProps.SEED) : null);
    }

    /**
     * @param seed fixed seed for every call's random source, or null for fresh randomness per call
     */
    public CharacterEngine(PpoConfig ppo, AgentRegistry registry, Long seed) {
        this.ppo = Preconditions.checkNotNull(ppo, "ppo");
        this.registry = Preconditions.checkNotNull(registry, "registry");
        this.trainer = new PpoTrainer(ppo);
        this.seed = seed;
    }

    private static AgentStore storeFor(EngineConfig config) {
        if (config.isSet(EngineProps.STORAGE_DIR)) {
            return new FileAgentStore(Paths.get(config.getString(EngineProps.STORAGE_DIR)));
        }
        return new InMemoryAgentStore();
    }

    public AgentRegistry getRegistry() {
        return registry;
    }

    public PpoConfig getPpoConfig() {
        return ppo;
    }

    private Random newRandom() {
        return seed != null ? new Random(seed) : new Random();
    }

    public SimulationResult simulate(CharacterProfile profile, int steps, boolean deterministic) {
        return simulate(profile, steps, deterministic, Collections.emptySet());
    }

    /**
     * Inference-only rollout of {@code steps} steps (fewer if the character's
     * health runs out). The agent is not updated.
     */
    public SimulationResult simulate(CharacterProfile profile, int steps, boolean deterministic,
                                     Set<Scenario> scenarios) {
        Random rng = newRandom();
        CharacterEnvironment env = new CharacterEnvironment(profile, steps, rng);
        env.setScenarios(scenarios);
        Agent agent = registry.getOrCreate(profile.getIdentityKey(), env.getStateDim(), env.getActionDim());
        collector.collect(agent, env, steps, deterministic, rng);
        SimulationResult result = new SimulationResult(agent.getKey(), env.snapshot(0));
        log.debug("Simulated {} for {} steps, total reward {}", agent.getKey(),
                result.getActionHistory().size(), result.getTotalReward());
        return result;
    }

    public TrainingResult train(CharacterProfile profile, int episodes, int stepsPerEpisode) {
        return train(profile, episodes, stepsPerEpisode, Collections.emptySet(), TrainingOptions.defaults());
    }

    /**
     * Train the solo agent, then save it unless an update was skipped as
     * numerically unstable.
     */
    public TrainingResult train(CharacterProfile profile, int episodes, int stepsPerEpisode,
                                Set<Scenario> scenarios, TrainingOptions options) {
        Random rng = newRandom();
        CharacterEnvironment env = new CharacterEnvironment(profile, stepsPerEpisode, rng);
        env.setScenarios(scenarios);
        Agent agent = registry.getOrCreate(profile.getIdentityKey(), env.getStateDim(), env.getActionDim());
        TrainingResult result = trainer.train(agent, env, episodes, stepsPerEpisode, rng, options);
        registry.save(agent.getKey());
        return result;
    }

    public MatchResult interact(CharacterProfile first, CharacterProfile second, int rounds, boolean deterministic) {
        Random rng = newRandom();
        return runMatch(MatchResult.Kind.INTERACTION,
                new InteractionEnvironment(first, second, rounds * 2, rng), INTERACTION_SUFFIX,
                rounds, deterministic, rng);
    }

    public MatchResult duel(CharacterProfile first, CharacterProfile second, int rounds, boolean deterministic) {
        Random rng = newRandom();
        return runMatch(MatchResult.Kind.DUEL,
                new DuelEnvironment(first, second, rounds * 2, rng), DUEL_SUFFIX,
                rounds, deterministic, rng);
    }

    private MatchResult runMatch(MatchResult.Kind kind, AbstractEnvironment env, String suffix,
                                 int rounds, boolean deterministic, Random rng) {
        String firstKey = env.getProfile(0).getIdentityKey() + suffix;
        String secondKey = env.getProfile(1).getIdentityKey() + suffix;
        Agent first = registry.getOrCreate(firstKey, env.getStateDim(), env.getActionDim());
        Agent second = registry.getOrCreate(secondKey, env.getStateDim(), env.getActionDim());
        MatchRunner.Match match = matchRunner.run(first, second, env, rounds, deterministic, rng);
        MatchResult result = new MatchResult(kind, firstKey, secondKey, match, env.snapshot(0), env.snapshot(1));
        log.debug("{} {} vs {}: {} / {} -> {}", kind, firstKey, secondKey,
                result.getTotal(0), result.getTotal(1), result.getVerdict());
        return result;
    }
}
