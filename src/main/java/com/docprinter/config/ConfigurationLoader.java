package com.docprinter.config;

import com.docprinter.util.LoggerUtil;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads and writes {@link FormatterConfig} as YAML:
 *
 * <pre>
 * layout:
 *   printWidth: 100
 *   useTabs: false
 *   tabWidth: 4
 *   endOfLine: lf
 *   maxDepth: 1000
 * debug:
 *   includeDocTree: false
 * </pre>
 *
 * Missing, mistyped or out-of-range values fall back to defaults with a warning.
 */
public class ConfigurationLoader {
    private static final Logger logger = LoggerUtil.getLogger(ConfigurationLoader.class);
    private static final String DEFAULT_CONFIG_RESOURCE = "/config/default-config.yml";

    private static volatile FormatterConfig _cachedDefaultConfig = null;

    /**
     * Loads configuration from a file, falling back to the bundled defaults.
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

            FormatterConfig formatterConfig = _createConfigFromMap(config == null ? Map.of() : config);
            logger.info("Configuration loaded: " + formatterConfig.getLayout());

            return formatterConfig;
        } catch (Exception e) {
            logger.log(Level.WARNING, "Error parsing configuration file: " + e.getMessage(), e);
            logger.info("Falling back to default configuration");
            return loadDefaultConfig();
        }
    }

    /**
     * Loads the bundled default configuration, once.
     */
    public static FormatterConfig loadDefaultConfig() {
        FormatterConfig cached = _cachedDefaultConfig;
        if (cached != null) {
            return cached;
        }

        try (InputStream defaultConfigStream =
                     ConfigurationLoader.class.getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {

            if (defaultConfigStream == null) {
                logger.severe("Default configuration resource not found: " + DEFAULT_CONFIG_RESOURCE);
                return FormatterConfig.defaults();
            }

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            @SuppressWarnings("unchecked")
            Map<String, Object> config = mapper.readValue(defaultConfigStream, Map.class);

            cached = _createConfigFromMap(config == null ? Map.of() : config);
            _cachedDefaultConfig = cached;
            logger.fine("Default configuration loaded successfully");

            return cached;
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to load default configuration", e);
            return FormatterConfig.defaults();
        }
    }

    /**
     * Builds a configuration from parsed YAML, validating every value.
     */
    private static FormatterConfig _createConfigFromMap(Map<String, Object> config) {
        Map<String, Object> layout = _section(config, "layout");
        Map<String, Object> debug = _section(config, "debug");

        _validateIntRange(layout, "printWidth", 1, 1000);
        _validateIntRange(layout, "tabWidth", 1, 16);
        _validateIntRange(layout, "maxDepth", 16, 100_000);

        LayoutConfig.Builder builder = LayoutConfig.builder()
                .maxWidth(_intValue(layout, "printWidth", LayoutConfig.DEFAULT_MAX_WIDTH))
                .useTabs(_booleanValue(layout, "useTabs", false))
                .tabWidth(_intValue(layout, "tabWidth", LayoutConfig.DEFAULT_TAB_WIDTH))
                .endOfLine(_endOfLine(layout))
                .maxDepth(_intValue(layout, "maxDepth", LayoutConfig.DEFAULT_MAX_DEPTH));

        return new FormatterConfig(builder.build(), _booleanValue(debug, "includeDocTree", false));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> _section(Map<String, Object> config, String name) {
        Object value = config.get(name);
        if (value instanceof Map) {
            return new HashMap<>((Map<String, Object>) value);
        }
        if (value != null) {
            logger.warning("Invalid '" + name + "' section in config, using defaults");
        }
        return new HashMap<>();
    }

    /**
     * Drops an integer value outside {@code [min, max]} so that the default applies.
     */
    private static void _validateIntRange(Map<String, Object> config, String key, int min, int max) {
        if (config.containsKey(key) && config.get(key) instanceof Number) {
            int value = ((Number) config.get(key)).intValue();
            if (value < min || value > max) {
                logger.warning("Configuration value '" + key + "' is outside acceptable range " +
                        "(" + min + "-" + max + "). Using default value.");
                config.remove(key);
            }
        }
    }

    private static int _intValue(Map<String, Object> config, String key, int defaultValue) {
        Object value = config.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value != null) {
            logger.warning("Configuration value '" + key + "' is not a number, using " + defaultValue);
        }
        return defaultValue;
    }

    private static boolean _booleanValue(Map<String, Object> config, String key, boolean defaultValue) {
        Object value = config.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            String text = ((String) value).trim();
            if (text.equalsIgnoreCase("true") || text.equalsIgnoreCase("false")) {
                return Boolean.parseBoolean(text);
            }
        }
        if (value != null) {
            logger.warning("Configuration value '" + key + "' is not a boolean, using " + defaultValue);
        }
        return defaultValue;
    }

    private static EndOfLine _endOfLine(Map<String, Object> config) {
        Object value = config.get("endOfLine");
        if (value == null) {
            return EndOfLine.LF;
        }
        try {
            return EndOfLine.fromName(value.toString());
        } catch (IllegalArgumentException e) {
            logger.warning("Unknown endOfLine '" + value + "', using lf");
            return EndOfLine.LF;
        }
    }

    /**
     * Writes configuration as YAML, creating parent directories as needed.
     */
    public static void saveConfig(FormatterConfig config, Path configPath) throws IOException {
        try {
            Path parent = configPath.getParent();
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
            }

            LayoutConfig layout = config.getLayout();
            Map<String, Object> layoutMap = new LinkedHashMap<>();
            layoutMap.put("printWidth", layout.getMaxWidth());
            layoutMap.put("useTabs", layout.isUseTabs());
            layoutMap.put("tabWidth", layout.getTabWidth());
            layoutMap.put("endOfLine", layout.getEndOfLine().name().toLowerCase(Locale.ROOT));
            layoutMap.put("maxDepth", layout.getMaxDepth());

            Map<String, Object> configMap = new LinkedHashMap<>();
            configMap.put("layout", layoutMap);
            configMap.put("debug", Map.of("includeDocTree", config.isIncludeDocTree()));

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            mapper.writeValue(configPath.toFile(), configMap);

            logger.info("Configuration saved successfully to: " + configPath);
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to save configuration to: " + configPath, e);
            throw e;
        }
    }
}
