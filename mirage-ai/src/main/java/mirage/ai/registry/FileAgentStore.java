package mirage.ai.registry;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.io.BaseEncoding;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import mirage.ai.config.ConfigurationException;

/**
 * One JSON file per identity key under a storage directory. The file name
 * is {@code agent_<name>.json}, where the name is the lower-case base32hex
 * encoding of the key's UTF-8 bytes, so distinct keys never share a file
 * even on case-insensitive file systems. Writes go to a temp file that is then moved over the
 * target, so readers never see a half-written blob.
 */
public class FileAgentStore implements AgentStore {
    private static final Logger log = LoggerFactory.getLogger(FileAgentStore.class);
    private static final Gson GSON = new Gson();
    private static final BaseEncoding FILE_NAMES = BaseEncoding.base32Hex().lowerCase().omitPadding();

    private final Path directory;

    public FileAgentStore(Path directory) {
        this.directory = directory;
    }

    public Path getDirectory() {
        return directory;
    }

    public Path fileFor(String key) {
        return directory.resolve("agent_" + fileName(key) + ".json");
    }

    static String fileName(String key) {
        return FILE_NAMES.encode(key.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public void write(String key, AgentSnapshot snapshot) {
        Path target = fileFor(key);
        try {
            Files.createDirectories(directory);
            Path tmp = Files.createTempFile(directory, "agent_", ".tmp");
            try (Writer w = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                GSON.toJson(snapshot, w);
            }
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            log.error("Failed to save agent {} to {}", key, target, e);
            throw new UncheckedIOException("failed to save agent " + key, e);
        }
    }

    @Override
    public Optional<AgentSnapshot> read(String key) {
        Path file = fileFor(key);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            AgentSnapshot snapshot = GSON.fromJson(r, AgentSnapshot.class);
            if (snapshot == null) {
                throw new ConfigurationException("stored agent file " + file + " is empty");
            }
            if (!key.equals(snapshot.key)) {
                throw new ConfigurationException("stored agent file " + file + " belongs to '"
                        + snapshot.key + "', not '" + key + "'");
            }
            return Optional.of(snapshot);
        } catch (JsonParseException e) {
            throw new ConfigurationException("stored agent file " + file + " is not valid JSON", e);
        } catch (IOException e) {
            log.error("Failed to read agent {} from {}", key, file, e);
            throw new UncheckedIOException("failed to load agent " + key, e);
        }
    }

    @Override
    public boolean contains(String key) {
        return Files.isRegularFile(fileFor(key));
    }
}
