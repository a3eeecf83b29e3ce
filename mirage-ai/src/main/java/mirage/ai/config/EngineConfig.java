package mirage.ai.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import java.util.Properties;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolved engine settings. Lookup order, lowest precedence first:
 * built-in defaults, classpath {@code mirage-engine.properties},
 * an optional external properties file, {@code mirage.*} system properties.
 */
public final class EngineConfig {
    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    public static final String CLASSPATH_RESOURCE = "/mirage-engine.properties";

    private final Map<EngineProps, String> values;

    private EngineConfig(Map<EngineProps, String> values) {
        this.values = values;
    }

    public static EngineConfig defaults() {
        Map<EngineProps, String> values = new EnumMap<>(EngineProps.class);
        for (EngineProps p : EngineProps.values()) {
            values.put(p, p.getDefaultValue());
        }
        return new EngineConfig(values);
    }

    /**
     * Load the full chain. {@code externalFile} may be null.
     */
    public static EngineConfig load(Path externalFile) {
        Map<EngineProps, String> values = defaults().values;

        try (InputStream in = EngineConfig.class.getResourceAsStream(CLASSPATH_RESOURCE)) {
            if (in != null) {
                Properties props = new Properties();
                props.load(in);
                apply(values, props);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + CLASSPATH_RESOURCE, e);
        }

        if (externalFile != null) {
            if (!Files.isRegularFile(externalFile)) {
                throw new ConfigurationException("Config file not found: " + externalFile);
            }
            try (Reader reader = Files.newBufferedReader(externalFile, StandardCharsets.UTF_8)) {
                Properties props = new Properties();
                props.load(reader);
                apply(values, props);
                log.info("Loaded engine config overrides from {}", externalFile);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read config file " + externalFile, e);
            }
        }

        for (EngineProps p : EngineProps.values()) {
            String sys = System.getProperty(p.getSystemPropertyName());
            if (sys != null) {
                values.put(p, sys.trim());
            }
        }
        return new EngineConfig(values);
    }

    private static void apply(Map<EngineProps, String> values, Properties props) {
        for (EngineProps p : EngineProps.values()) {
            String v = props.getProperty(p.getKey());
            if (v != null) {
                values.put(p, v.trim());
            }
        }
    }

    /** Copy with one property replaced. */
    public EngineConfig with(EngineProps prop, String value) {
        Map<EngineProps, String> copy = new EnumMap<>(values);
        copy.put(prop, value == null ? "" : value.trim());
        return new EngineConfig(copy);
    }

    public String getString(EngineProps prop) {
        return values.get(prop);
    }

    public boolean isSet(EngineProps prop) {
        return StringUtils.isNotBlank(values.get(prop));
    }

    public int getInt(EngineProps prop) {
        String raw = values.get(prop);
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Property " + prop.getKey() + " is not an integer: '" + raw + "'", e);
        }
    }

    public long getLong(EngineProps prop) {
        String raw = values.get(prop);
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Property " + prop.getKey() + " is not a long: '" + raw + "'", e);
        }
    }

    public double getDouble(EngineProps prop) {
        String raw = values.get(prop);
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Property " + prop.getKey() + " is not a number: '" + raw + "'", e);
        }
    }

    public boolean getBoolean(EngineProps prop) {
        String raw = values.get(prop);
        if ("true".equalsIgnoreCase(raw)) {
            return true;
        }
        if ("false".equalsIgnoreCase(raw)) {
            return false;
        }
        throw new ConfigurationException("Property " + prop.getKey() + " is not a boolean: '" + raw + "'");
    }
}
