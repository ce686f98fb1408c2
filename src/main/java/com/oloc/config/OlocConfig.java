package com.oloc.config;

/**
 * Immutable calculator configuration. Reconfiguring means building a new
 * calculator from a new instance; tables are never changed in place.
 *
 * @param symbols         Symbol alias table (operators, constants, brackets, whitespace)
 * @param functions       Function alias table; canonical names are built-in function names
 * @param decimalPlaces   Default places retained by decimal conversion
 * @param timeLimitMillis Supervised time limit per calculation (negative means unsupervised)
 */
public record OlocConfig(
        MappingTable symbols,
        MappingTable functions,
        int decimalPlaces,
        long timeLimitMillis
) {
    public static final String DEFAULT_TABLES = "classpath:oloc-tables.yaml";
    public static final int DEFAULT_DECIMAL_PLACES = 7;

    public OlocConfig {
        if (decimalPlaces < 0) {
            throw new IllegalArgumentException("decimalPlaces must not be negative: " + decimalPlaces);
        }
    }

    /**
     * Configuration from the bundled default tables.
     */
    public static OlocConfig defaults() {
        return ConfigLoader.load(DEFAULT_TABLES);
    }

    /**
     * Configuration with no aliases; input must already use canonical symbols.
     */
    public static OlocConfig canonicalOnly() {
        return new OlocConfig(MappingTable.empty(), MappingTable.empty(), DEFAULT_DECIMAL_PLACES, -1);
    }

    public OlocConfig withDecimalPlaces(int places) {
        return new OlocConfig(symbols, functions, places, timeLimitMillis);
    }

    public OlocConfig withTimeLimitMillis(long millis) {
        return new OlocConfig(symbols, functions, decimalPlaces, millis);
    }
}
