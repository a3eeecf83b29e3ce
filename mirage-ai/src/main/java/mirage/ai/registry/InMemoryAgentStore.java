package mirage.ai.registry;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import com.google.gson.Gson;

/**
 * Process-local store. Snapshots are held as JSON so a read never shares
 * arrays with the agent that was saved.
 */
public class InMemoryAgentStore implements AgentStore {
    private static final Gson GSON = new Gson();

    private final Map<String, String> blobs = new ConcurrentHashMap<>();

    @Override
    public void write(String key, AgentSnapshot snapshot) {
        blobs.put(key, GSON.toJson(snapshot));
    }

    @Override
    public Optional<AgentSnapshot> read(String key) {
        String json = blobs.get(key);
        return json == null ? Optional.empty() : Optional.of(GSON.fromJson(json, AgentSnapshot.class));
    }

    @Override
    public boolean contains(String key) {
        return blobs.containsKey(key);
    }
}
