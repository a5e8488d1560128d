package com.pyformatter.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.pyformatter.api.FormatOptions;
import com.pyformatter.util.LoggerUtil;

/**
 * Reads a YAML configuration file, falling back to the bundled defaults.
 */
public class ConfigurationLoader {
    private static final Logger logger = LoggerUtil.getLogger(ConfigurationLoader.class);
    private static final String DEFAULT_CONFIG_RESOURCE = "/config/default-config.yml";

    private static FormatterConfig cachedDefaultConfig = null;

    /**
     * Loads configuration from a file with fallback to defaults.
     */
    public static FormatterConfig loadConfig(Path configPath) {
        if (configPath == null) {
            logger.warning("No config path provided, using default configuration");
            return loadDefaultConfig();
        }

        if (!Files.exists(configPath)) {
            logger.warning("Configuration file not found: " + configPath + ", using default configuration");
            return loadDefaultConfig();
        }

        try {
            logger.info("Loading configuration from: " + configPath);

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            @SuppressWarnings("unchecked")
            Map<String, Object> config = mapper.readValue(configPath.toFile(), Map.class);

            return createConfigFromMap(config == null ? new HashMap<>() : config);
        } catch (IOException e) {
            logger.log(Level.WARNING, "Error parsing configuration file: " + e.getMessage(), e);
            logger.info("Falling back to default configuration");
            return loadDefaultConfig();
        }
    }

    /**
     * Loads the embedded default configuration, once.
     */
    public static synchronized FormatterConfig loadDefaultConfig() {
        if (cachedDefaultConfig != null) {
            return cachedDefaultConfig;
        }

        try (InputStream defaultConfigStream =
                     ConfigurationLoader.class.getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {

            if (defaultConfigStream == null) {
                logger.severe("Default configuration resource not found: " + DEFAULT_CONFIG_RESOURCE);
                return createEmptyConfig();
            }

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            @SuppressWarnings("unchecked")
            Map<String, Object> config = mapper.readValue(defaultConfigStream, Map.class);

            cachedDefaultConfig = createConfigFromMap(config);
            logger.fine("Default configuration loaded");

            return cachedDefaultConfig;
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to load default configuration", e);
            return createEmptyConfig();
        }
    }

    @SuppressWarnings("unchecked")
    static FormatterConfig createConfigFromMap(Map<String, Object> config) {
        Map<String, Object> generalConfig = new HashMap<>();
        if (config.get("general") instanceof Map) {
            generalConfig = new HashMap<>((Map<String, Object>) config.get("general"));
        } else {
            logger.warning("Missing or invalid 'general' section in config, using defaults");
        }

        Map<String, Object> cacheConfig = new HashMap<>();
        if (config.get("cache") instanceof Map) {
            cacheConfig = new HashMap<>((Map<String, Object>) config.get("cache"));
        }

        validateIntRange(generalConfig, "lineLength", 1, 1000);
        validateIntRange(generalConfig, "threads", 1, 256);
        ensureDefaultGeneralConfig(generalConfig);
        ensureDefaultCacheConfig(cacheConfig);

        return new FormatterConfig(generalConfig, cacheConfig);
    }

    /**
     * Drops an integer value outside {@code [min, max]} so the default applies.
     */
    private static void validateIntRange(Map<String, Object> config, String key, int min, int max) {
        if (config.get(key) instanceof Number) {
            int value = ((Number) config.get(key)).intValue();
            if (value < min || value > max) {
                logger.warning("Configuration value '" + key + "' is outside acceptable range " +
                        "(" + min + "-" + max + "). Using default value.");
                config.remove(key);
            }
        }
    }

    private static FormatterConfig createEmptyConfig() {
        Map<String, Object> generalConfig = new HashMap<>();
        ensureDefaultGeneralConfig(generalConfig);
        Map<String, Object> cacheConfig = new HashMap<>();
        ensureDefaultCacheConfig(cacheConfig);
        return new FormatterConfig(generalConfig, cacheConfig);
    }

    private static void ensureDefaultGeneralConfig(Map<String, Object> generalConfig) {
        if (!(generalConfig.get("lineLength") instanceof Number)) {
            generalConfig.put("lineLength", FormatOptions.DEFAULT_LINE_LENGTH);
        }
        for (String flag : List.of("pyi", "skipStringNormalization", "skipMagicTrailingComma", "fast", "diff")) {
            if (!(generalConfig.get(flag) instanceof Boolean)) {
                generalConfig.put(flag, false);
            }
        }
        if (!(generalConfig.get("targetVersions") instanceof List)) {
            generalConfig.put("targetVersions", new ArrayList<String>());
        }
        if (!(generalConfig.get("preview") instanceof List)) {
            generalConfig.put("preview", new ArrayList<String>());
        }
        if (!(generalConfig.get("threads") instanceof Number)) {
            generalConfig.put("threads", Runtime.getRuntime().availableProcessors());
        }
    }

    private static void ensureDefaultCacheConfig(Map<String, Object> cacheConfig) {
        if (!(cacheConfig.get("enabled") instanceof Boolean)) {
            cacheConfig.put("enabled", true);
        }
        if (!(cacheConfig.get("file") instanceof String)) {
            cacheConfig.put("file", ".pyformatter-cache.json");
        }
    }

    /**
     * Saves configuration to a file.
     */
    public static void saveConfig(FormatterConfig config, Path configPath) throws IOException {
        try {
            Path parent = configPath.toAbsolutePath().getParent();
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
            }

            Map<String, Object> configMap = new HashMap<>();
            configMap.put("general", config.getGeneralConfigMap());
            configMap.put("cache", config.getCacheConfigMap());

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            mapper.writeValue(configPath.toFile(), configMap);

            logger.info("Configuration saved to: " + configPath);
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to save configuration to: " + configPath, e);
            throw e;
        }
    }
}
