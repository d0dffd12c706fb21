package com.raditha.dictation.config;

import com.raditha.dictation.similarity.KeyboardLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

/**
 * Loads comparison configuration from dictation.yml with CLI overrides.
 *
 * Configuration priority: CLI arguments > dictation.yml > defaults
 */
public class ComparisonSettings {

    private static final Logger logger = LoggerFactory.getLogger(ComparisonSettings.class);

    public static final String DEFAULT_FILE_NAME = "dictation.yml";
    private static final String CONFIG_KEY = "dictation";

    private ComparisonSettings() {
    }

    /**
     * Read the {@code dictation} section of a YAML file.
     *
     * @param file     YAML file to read
     * @param required When false a missing file yields an empty section
     * @return The section, empty when the file or the key is absent
     * @throws IOException if the file cannot be read, or is required and missing
     */
    public static Map<String, Object> readSection(Path file, boolean required) throws IOException {
        if (file == null || !Files.exists(file)) {
            if (required) {
                throw new IOException("Configuration file not found: " + file);
            }
            return Map.of();
        }

        Object loaded;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            loaded = new Yaml().load(reader);
        }

        if (loaded instanceof Map<?, ?> root && root.get(CONFIG_KEY) instanceof Map<?, ?> section) {
            logger.info("Loaded comparison settings from {}", file);
            @SuppressWarnings("unchecked")
            Map<String, Object> config = (Map<String, Object>) section;
            return config;
        }
        logger.warn("No '{}' section in {}, using defaults", CONFIG_KEY, file);
        return Map.of();
    }

    /**
     * Build the configuration from the YAML section, applying the CLI preset
     * where provided.
     *
     * @param config    The {@code dictation} section (may be empty)
     * @param presetCLI CLI preset name (null = use YAML/default)
     * @return Complete comparison configuration
     */
    public static ComparisonConfig loadConfig(Map<String, Object> config, String presetCLI) {
        Map<String, Object> yaml = config == null ? Map.of() : config;

        // Determine preset (CLI > YAML)
        String preset = presetCLI != null ? presetCLI : getString(yaml, "preset", null);
        ComparisonConfig base = ComparisonConfig.preset(preset);
        if (presetCLI != null) {
            return base;
        }

        // Individual YAML values refine the chosen preset
        double caseSensitivePenalty = base.caseSensitivePositionPenalty();
        double caseInsensitivePenalty = base.caseInsensitivePositionPenalty();
        if (yaml.get("position_penalty") instanceof Map<?, ?> penalties) {
            @SuppressWarnings("unchecked")
            Map<String, Object> penaltyMap = (Map<String, Object>) penalties;
            caseSensitivePenalty = getDouble(penaltyMap, "case_sensitive", caseSensitivePenalty);
            caseInsensitivePenalty = getDouble(penaltyMap, "case_insensitive", caseInsensitivePenalty);
        }

        List<String> functionWords = getListString(yaml, "function_words");
        String layout = getString(yaml, "keyboard_layout", null);

        return new ComparisonConfig(
                getInt(yaml, "window_size", base.windowSize()),
                getDouble(yaml, "acceptance_threshold", base.acceptanceThreshold()),
                caseSensitivePenalty,
                caseInsensitivePenalty,
                getDouble(yaml, "penalty_floor", base.penaltyFloor()),
                getDouble(yaml, "early_exit_score", base.earlyExitScore()),
                getDouble(yaml, "compound_score", base.compoundScore()),
                getDouble(yaml, "umlaut_boost", base.umlautBoost()),
                functionWords.isEmpty() ? base.functionWords() : new HashSet<>(functionWords),
                layout != null ? KeyboardLayout.fromString(layout) : base.keyboardLayout());
    }

    /**
     * Capitalization checking: on when the CLI flag is set, else as configured.
     */
    public static boolean caseSensitive(Map<String, Object> config, boolean caseSensitiveCLI) {
        return caseSensitiveCLI || getBoolean(config == null ? Map.of() : config, "case_sensitive", false);
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return defaultValue;
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return defaultValue;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }

    private static List<String> getListString(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return List.of();
    }
}
