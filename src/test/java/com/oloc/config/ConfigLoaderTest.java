package com.oloc.config;

import com.oloc.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConfigLoader.
 */
class ConfigLoaderTest {

    @Test
    @DisplayName("Should load the bundled default tables")
    void shouldLoadDefaults() {
        OlocConfig config = OlocConfig.defaults();

        assertEquals(OlocConfig.DEFAULT_DECIMAL_PLACES, config.decimalPlaces());
        assertEquals(-1, config.timeLimitMillis());
        assertEquals(Optional.of("π"), config.symbols().canonicalOf("pi"));
        assertEquals(Optional.of("asin"), config.functions().canonicalOf("arcsin"));
        assertEquals(Optional.of(""), config.symbols().canonicalOf(" "));
        assertTrue(config.symbols().canonicalOf("nothing").isEmpty());
    }

    @Test
    @DisplayName("Should load a table file without the oloc section")
    void shouldLoadRootLevelTables() {
        OlocConfig config = ConfigLoader.load("classpath:config/custom-tables.yaml");

        assertEquals(3, config.decimalPlaces());
        assertEquals(250, config.timeLimitMillis());
        assertEquals(2, config.symbols().entries().size());
        assertEquals(Optional.of("sqrt"), config.functions().canonicalOf("root"));
    }

    @Test
    @DisplayName("Should reject an unknown canonical function")
    void shouldRejectUnknownFunction() {
        ConfigurationException error = assertThrows(ConfigurationException.class,
                () -> ConfigLoader.load("classpath:config/unknown-function.yaml"));

        assertTrue(error.getMessage().contains("cbrt"));
    }

    @Test
    @DisplayName("Should fail for a missing file")
    void shouldFailForMissingFile() {
        assertThrows(ConfigurationException.class, () -> ConfigLoader.load("classpath:config/missing.yaml"));
        assertThrows(ConfigurationException.class, () -> ConfigLoader.load("/nonexistent/oloc.yaml"));
    }

    @Test
    @DisplayName("Should reject malformed entries")
    void shouldRejectMalformedEntries() {
        assertThrows(ConfigurationException.class, () -> load("symbols:\n  - aliases: [x]\n"));
        assertThrows(ConfigurationException.class, () -> load("symbols:\n  - canonical: \"+\"\n"));
        assertThrows(ConfigurationException.class, () -> load("symbols:\n  - canonical: \"+\"\n    aliases: [\"\"]\n"));
        assertThrows(ConfigurationException.class, () -> load("decimal-places: -1\n"));
        assertThrows(ConfigurationException.class, () -> load(""));
    }

    @Test
    @DisplayName("Missing sections fall back to empty tables")
    void shouldDefaultMissingSections() {
        OlocConfig config = load("decimal-places: 2\n");

        assertTrue(config.symbols().isEmpty());
        assertTrue(config.functions().isEmpty());
        assertEquals(2, config.decimalPlaces());
    }

    private static OlocConfig load(String yaml) {
        return ConfigLoader.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }
}
