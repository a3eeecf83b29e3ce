package mirage.ai.registry;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

import mirage.ai.config.ConfigurationException;
import mirage.ai.config.PpoConfig;
import mirage.ai.nn.ActorCriticNetwork;
import mirage.ai.nn.AdamOptimizer;

/**
 * Process-wide map of identity key to live {@link Agent}, backed by an
 * {@link AgentStore}.
 *
 * <p>{@link #getOrCreate} is atomic per key: concurrent callers for the same
 * key get the same instance, and the agent is loaded or initialized exactly
 * once. Different keys do not block each other.
 */
public class AgentRegistry {
    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    private final ConcurrentMap<String, Agent> agents = new ConcurrentHashMap<>();
    private final AgentStore store;
    private final PpoConfig config;
    private final SeedSource seeds;

    public AgentRegistry(AgentStore store, PpoConfig config) {
        this(store, config, key -> key.hashCode());
    }

    public AgentRegistry(AgentStore store, PpoConfig config, SeedSource seeds) {
        this.store = Preconditions.checkNotNull(store, "store");
        this.config = Preconditions.checkNotNull(config, "config");
        this.seeds = Preconditions.checkNotNull(seeds, "seeds");
    }

    /**
     * The live agent for {@code key}: cached, else loaded from the store,
     * else freshly initialized.
     *
     * @throws ConfigurationException if the agent's dimensions differ from the requested ones
     */
    public Agent getOrCreate(String key, int stateDim, int actionDim) {
        Preconditions.checkArgument(key != null && !key.isBlank(), "key must not be blank");
        Agent agent = agents.computeIfAbsent(key, k -> loadOrInit(k, stateDim, actionDim));
        checkDimensions(agent, stateDim, actionDim);
        return agent;
    }

    private Agent loadOrInit(String key, int stateDim, int actionDim) {
        Optional<Agent> stored = readStored(key);
        if (stored.isPresent()) {
            log.info("Loaded agent {} ({}x{}) from store", key, stored.get().getStateDim(), stored.get().getActionDim());
            return stored.get();
        }
        ActorCriticNetwork network = new ActorCriticNetwork(stateDim, config.getHiddenDim(), actionDim,
                config.getProbabilityFloor(), seeds.seedFor(key));
        Agent agent = new Agent(key, network, new AdamOptimizer(network.parameterCount(), config.getLearningRate()));
        log.info("Created agent {} ({}x{}, hidden {})", key, stateDim, actionDim, config.getHiddenDim());
        return agent;
    }

    private Optional<Agent> readStored(String key) {
        return store.read(key).map(s -> s.toAgent(key));
    }

    private static void checkDimensions(Agent agent, int stateDim, int actionDim) {
        if (agent.getStateDim() != stateDim || agent.getActionDim() != actionDim) {
            throw new ConfigurationException("agent " + agent.getKey() + " is " + agent.getStateDim() + "x"
                    + agent.getActionDim() + " but " + stateDim + "x" + actionDim + " was requested");
        }
    }

    /** Cached agent, if any, without touching the store. */
    public Optional<Agent> get(String key) {
        return Optional.ofNullable(agents.get(key));
    }

    /**
     * The live agent for {@code key}, loading it from the store only when
     * nothing is cached. A cached agent is never replaced, so updates made
     * through it are not lost. Empty when the key is neither cached nor
     * stored; the cache is then left as it was.
     */
    public Optional<Agent> load(String key) {
        return Optional.ofNullable(agents.computeIfAbsent(key, k -> {
            Agent stored = readStored(k).orElse(null);
            if (stored != null) {
                log.info("Loaded agent {} from store", k);
            }
            return stored;
        }));
    }

    /**
     * Persist the cached agent unless it is flagged unstable.
     *
     * @return true if the agent was written
     */
    public boolean save(String key) {
        return save(key, false);
    }

    /**
     * @param confirmUnstable persist even if an update on this agent was skipped as unstable
     * @return true if the agent was written
     * @throws IllegalArgumentException if no agent is cached under {@code key}
     */
    public boolean save(String key, boolean confirmUnstable) {
        Agent agent = agents.get(key);
        Preconditions.checkArgument(agent != null, "no agent cached under '%s'", key);
        if (agent.isUnstable() && !confirmUnstable) {
            log.warn("Refusing to save agent {}: it is flagged after a numerically unstable update", key);
            return false;
        }
        store.write(key, agent.snapshot());
        if (confirmUnstable) {
            agent.clearUnstable();
        }
        log.info("Saved agent {} (update steps {})", key, agent.getUpdateCount());
        return true;
    }

    /** Drop the cached instance; the store is untouched. */
    public void evict(String key) {
        agents.remove(key);
    }

    public int size() {
        return agents.size();
    }

    public AgentStore getStore() {
        return store;
    }

    /** Seed of the network initialization for a new key. */
    @FunctionalInterface
    public interface SeedSource {
        long seedFor(String key);
    }
}
