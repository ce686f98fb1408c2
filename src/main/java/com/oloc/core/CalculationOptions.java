package com.oloc.core;

import com.oloc.config.OlocConfig;

/**
 * Per-call overrides of the configured defaults.
 *
 * @param decimalPlaces   Places used by {@link Result#toDecimalString()}
 * @param timeLimitMillis Time limit applied by a supervisor; negative means none
 */
public record CalculationOptions(int decimalPlaces, long timeLimitMillis) {

    public CalculationOptions {
        if (decimalPlaces < 0) {
            throw new IllegalArgumentException("decimalPlaces must not be negative: " + decimalPlaces);
        }
    }

    public static CalculationOptions from(OlocConfig config) {
        return new CalculationOptions(config.decimalPlaces(), config.timeLimitMillis());
    }

    public CalculationOptions withDecimalPlaces(int places) {
        return new CalculationOptions(places, timeLimitMillis);
    }

    public CalculationOptions withTimeLimitMillis(long millis) {
        return new CalculationOptions(decimalPlaces, millis);
    }

    public boolean isSupervised() {
        return timeLimitMillis >= 0;
    }
}
