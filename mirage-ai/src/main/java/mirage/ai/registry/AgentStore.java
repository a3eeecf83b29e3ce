package mirage.ai.registry;

import java.util.Optional;

/**
 * Durable home of agent snapshots, keyed by identity key.
 */
public interface AgentStore {

    void write(String key, AgentSnapshot snapshot);

    /** Empty when nothing is stored under {@code key}. */
    Optional<AgentSnapshot> read(String key);

    boolean contains(String key);
}
