package mirage.cli.json;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiConsumer;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import mirage.ai.env.CharacterProfile;
import mirage.ai.env.Element;
import mirage.ai.env.Emotion;
import mirage.ai.env.Social;
import mirage.ai.env.Trait;
import mirage.cli.ProfileException;

/**
 * Character profile as read from a JSON file:
 * <pre>
 * {
 *   "key": "li-wei",
 *   "name": "Li Wei",
 *   "personality": {"openness": 0.7, "A": 0.9},
 *   "elements": {"fire": 0.4, "water": 0.1},
 *   "emotions": {"joy": 0.6},
 *   "social": {"reputation": 0.8}
 * }
 * </pre>
 * Missing groups and fields take the neutral defaults.
 */
public class ProfileDocument {
    public String key;
    public String name;
    public Map<String, Double> personality = new LinkedHashMap<>();
    public Map<String, Double> elements = new LinkedHashMap<>();
    public Map<String, Double> emotions = new LinkedHashMap<>();
    public Map<String, Double> social = new LinkedHashMap<>();

    private static final Gson GSON = new Gson();

    public static ProfileDocument read(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new ProfileException("Profile file not found: " + file);
        }
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            ProfileDocument doc = GSON.fromJson(r, ProfileDocument.class);
            if (doc == null) {
                throw new ProfileException("Profile file is empty: " + file);
            }
            return doc;
        } catch (JsonParseException e) {
            throw new ProfileException("Profile file is not valid JSON: " + file, e);
        } catch (IOException e) {
            throw new ProfileException("Failed to read profile file " + file, e);
        }
    }

    public static ProfileDocument parse(String json) {
        try {
            ProfileDocument doc = GSON.fromJson(json, ProfileDocument.class);
            if (doc == null) {
                throw new ProfileException("Empty profile document");
            }
            return doc;
        } catch (JsonParseException e) {
            throw new ProfileException("Profile is not valid JSON", e);
        }
    }

    /**
     * @throws ProfileException if the key is missing, a field name is unknown or a value is out of range
     */
    public CharacterProfile toProfile() {
        if (key == null || key.isBlank()) {
            throw new ProfileException("Profile has no \"key\"");
        }
        try {
            CharacterProfile.Builder b = CharacterProfile.builder(key).name(name);
            each("personality", personality, (k, v) -> b.trait(Trait.parse(k), v));
            each("elements", elements, (k, v) -> b.element(Element.parse(k), v));
            each("emotions", emotions, (k, v) -> b.emotion(Emotion.parse(k), v));
            each("social", social, (k, v) -> b.social(Social.parse(k), v));
            return b.build();
        } catch (IllegalArgumentException e) {
            throw new ProfileException("Invalid profile '" + key + "': " + e.getMessage(), e);
        }
    }

    private static void each(String group, Map<String, Double> values, BiConsumer<String, Double> sink) {
        if (values == null) {
            return;
        }
        for (Map.Entry<String, Double> e : values.entrySet()) {
            if (e.getValue() == null) {
                throw new IllegalArgumentException(group + "." + e.getKey() + " has no value");
            }
            sink.accept(e.getKey(), e.getValue());
        }
    }
}
