package com.oloc.core;

import com.oloc.adapter.executor.CalculationSupervisor;
import com.oloc.config.OlocConfig;

/**
 * Static entry point backed by a shared supervisor over the bundled default
 * configuration, created on first use.
 * <pre>
 * Result result = Oloc.calculate("3x/6xy");
 * result.formatted();   // "1/2y"
 * </pre>
 */
public final class Oloc {

    private Oloc() {
    }

    private static final class Holder {
        private static final OlocConfig CONFIG = OlocConfig.defaults();
        private static final CalculationSupervisor SUPERVISOR = new CalculationSupervisor(new Calculator(CONFIG));
    }

    public static Result calculate(String expression) {
        return Holder.SUPERVISOR.calculate(expression);
    }

    public static Result calculate(String expression, CalculationOptions options) {
        return Holder.SUPERVISOR.calculate(expression, options);
    }

    public static Result calculate(String expression, long timeLimitMillis) {
        return calculate(expression, CalculationOptions.from(Holder.CONFIG).withTimeLimitMillis(timeLimitMillis));
    }
}
