package com.oloc.function;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Built-in functions, keyed by canonical name, with their arity.
 * Canonical names double as lookup keys of the function mapping table.
 */
public enum FunctionType {
    // Algebraic
    POW("pow", 2, 2),
    SQRT("sqrt", 1, 1),
    SQ("sq", 1, 1),
    CUB("cub", 1, 1),
    REC("rec", 1, 1),
    EXP("exp", 1, 1),
    MOD("mod", 2, 2),
    FACT("fact", 1, 1),
    ABS("abs", 1, 1),
    SIGN("sign", 1, 1),
    GCD("gcd", 2, Integer.MAX_VALUE),
    LCM("lcm", 2, Integer.MAX_VALUE),

    // Transcendental
    SIN("sin", 1, 1),
    COS("cos", 1, 1),
    TAN("tan", 1, 1),
    ASIN("asin", 1, 1),
    ACOS("acos", 1, 1),
    ATAN("atan", 1, 1),
    LOG("log", 2, 2),
    LN("ln", 1, 1),
    LG("lg", 1, 1);

    private static final Map<String, FunctionType> BY_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(FunctionType::canonicalName, Function.identity()));

    private final String canonicalName;
    private final int minArity;
    private final int maxArity;

    FunctionType(String canonicalName, int minArity, int maxArity) {
        this.canonicalName = canonicalName;
        this.minArity = minArity;
        this.maxArity = maxArity;
    }

    public static Optional<FunctionType> fromName(String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }

    public String canonicalName() {
        return canonicalName;
    }

    public boolean acceptsArity(int count) {
        return count >= minArity && count <= maxArity;
    }

    /**
     * Human readable arity, e.g. "1", "2" or "at least 2".
     */
    public String arityDescription() {
        if (maxArity == Integer.MAX_VALUE) {
            return "at least " + minArity;
        }
        return minArity == maxArity ? String.valueOf(minArity) : minArity + "-" + maxArity;
    }
}
