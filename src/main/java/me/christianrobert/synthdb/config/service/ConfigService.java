package me.christianrobert.synthdb.config.service;

import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Runtime settings of the generator and of the PostgreSQL source, editable through
 * {@code /api/config}. Values keep whatever type the client sent; the typed getters
 * also accept numbers given as strings.
 */
@ApplicationScoped
public class ConfigService {

    private static final Logger log = LoggerFactory.getLogger(ConfigService.class);

    public static final String ROWS_PER_TABLE = "synth.rows-per-table";
    public static final String OUTPUT_PATH = "synth.output-path";
    public static final String SEED = "synth.seed";
    public static final String SOURCE_URL = "source.url";
    public static final String SOURCE_USERNAME = "source.username";
    public static final String SOURCE_PASSWORD = "source.password";
    public static final String SOURCE_SCHEMAS = "source.schemas";
    public static final String SOURCE_SAMPLE_LIMIT = "source.sample-limit";

    private static final Map<String, Object> DEFAULTS;

    static {
        Map<String, Object> defaults = new LinkedHashMap<>();
        defaults.put(ROWS_PER_TABLE, 100);
        defaults.put(OUTPUT_PATH, "dump.sql");
        // Blank: every run draws a seed and reports it in the dump header
        defaults.put(SEED, "");
        defaults.put(SOURCE_URL, "jdbc:postgresql://localhost:5432/postgres");
        defaults.put(SOURCE_USERNAME, "postgres");
        defaults.put(SOURCE_PASSWORD, "");
        defaults.put(SOURCE_SCHEMAS, "public");
        defaults.put(SOURCE_SAMPLE_LIMIT, 20);
        DEFAULTS = Collections.unmodifiableMap(defaults);
    }

    private final Map<String, Object> configuration = new ConcurrentHashMap<>(DEFAULTS);

    public Map<String, Object> getAllConfiguration() {
        return new HashMap<>(configuration);
    }

    public Object getConfigValue(String key) {
        return configuration.get(key);
    }

    public boolean hasConfigKey(String key) {
        return configuration.containsKey(key);
    }

    public String getConfigValueAsString(String key) {
        Object value = configuration.get(key);
        return value != null ? value.toString() : null;
    }

    /**
     * @return the number, or null when the value is missing, blank or not numeric
     */
    public Long getConfigValueAsLong(String key) {
        Object value = configuration.get(key);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        String text = value != null ? value.toString().trim() : "";
        if (text.isEmpty()) {
            return null;
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric value '{}' for {}", text, key);
            return null;
        }
    }

    public Integer getConfigValueAsInteger(String key) {
        Long value = getConfigValueAsLong(key);
        return value != null ? Math.toIntExact(value) : null;
    }

    /**
     * Comma-separated values such as "public, sales,hr", trimmed, blanks dropped.
     */
    public List<String> getConfigValueAsStringList(String key) {
        String value = getConfigValueAsString(key);
        if (value == null) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    public void setConfigValue(String key, Object value) {
        Object previous = configuration.put(key, value);
        if (!SOURCE_PASSWORD.equals(key)) {
            log.debug("{} = {} (was {})", key, value, previous);
        }
    }

    public void updateConfiguration(Map<String, Object> values) {
        values.forEach(this::setConfigValue);
        log.info("Updated {} configuration value(s)", values.size());
    }

    public void resetToDefaults() {
        configuration.clear();
        configuration.putAll(DEFAULTS);
        log.info("Configuration reset to defaults");
    }
}
