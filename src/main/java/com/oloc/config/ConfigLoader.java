package com.oloc.config;

import com.oloc.exception.ConfigurationException;
import com.oloc.function.FunctionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads oloc configuration (alias tables and defaults) from YAML files.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static OlocConfig load(String path) {
        log.info("Loading oloc configuration from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parseYaml(inputStream);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Load configuration from an already opened stream.
     */
    public static OlocConfig load(InputStream inputStream) {
        return parseYaml(inputStream);
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    private static OlocConfig parseYaml(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Map<String, Object> root = yaml.load(inputStream);

        if (root == null) {
            throw new ConfigurationException("Configuration file is empty");
        }

        // The oloc section may be at the root or under an 'oloc' key
        Map<String, Object> olocConfig = root.containsKey("oloc")
                ? (Map<String, Object>) root.get("oloc")
                : root;

        int decimalPlaces = getInt(olocConfig, "decimal-places", OlocConfig.DEFAULT_DECIMAL_PLACES);
        long timeLimitMillis = getLong(olocConfig, "time-limit-millis", -1);
        if (decimalPlaces < 0) {
            throw new ConfigurationException("decimal-places must not be negative: " + decimalPlaces);
        }

        MappingTable symbols = parseTable("symbols", (List<Map<String, Object>>) olocConfig.get("symbols"));
        MappingTable functions = parseTable("functions", (List<Map<String, Object>>) olocConfig.get("functions"));
        validateFunctions(functions);

        if (symbols.isEmpty()) {
            log.warn("No symbol aliases configured, input must use canonical symbols");
        }

        log.info("Loaded oloc configuration: {} symbol entries ({} aliases), {} function entries ({} aliases), "
                        + "decimal places: {}, time limit: {} ms",
                symbols.entries().size(), symbols.aliasCount(),
                functions.entries().size(), functions.aliasCount(),
                decimalPlaces, timeLimitMillis);

        return new OlocConfig(symbols, functions, decimalPlaces, timeLimitMillis);
    }

    @SuppressWarnings("unchecked")
    private static MappingTable parseTable(String section, List<Map<String, Object>> list) {
        if (list == null) {
            return MappingTable.empty();
        }
        List<MappingTable.Entry> entries = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < list.size(); i++) {
            Map<String, Object> entryMap = list.get(i);
            String canonical = getString(entryMap, "canonical", null);
            if (canonical == null) {
                throw new ConfigurationException("Entry " + i + " of '" + section + "' has no canonical form");
            }
            Object aliasesValue = entryMap.get("aliases");
            if (!(aliasesValue instanceof List)) {
                throw new ConfigurationException("Entry '" + canonical + "' of '" + section
                        + "' must list its aliases");
            }
            List<String> aliases = new ArrayList<>();
            for (Object alias : (List<Object>) aliasesValue) {
                String text = alias == null ? "" : alias.toString();
                if (text.isEmpty()) {
                    throw new ConfigurationException("Entry '" + canonical + "' of '" + section
                            + "' has an empty alias");
                }
                if (!seen.add(text)) {
                    log.warn("Alias '{}' of '{}' is listed more than once in '{}', the first entry wins",
                            text, canonical, section);
                }
                aliases.add(text);
            }
            log.debug("Parsed {} entry: canonical='{}', aliases={}", section, canonical, aliases);
            entries.add(new MappingTable.Entry(canonical, aliases));
        }
        return new MappingTable(entries);
    }

    private static void validateFunctions(MappingTable functions) {
        for (MappingTable.Entry entry : functions.entries()) {
            if (FunctionType.fromName(entry.canonical()).isEmpty()) {
                throw new ConfigurationException("Unknown canonical function name: " + entry.canonical());
            }
        }
    }

    // Helper methods

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        return Integer.parseInt(value.toString());
    }

    private static long getLong(Map<String, Object> map, String key, long defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).longValue();
        return Long.parseLong(value.toString());
    }
}
