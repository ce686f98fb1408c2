package com.oloc.exception;

import com.oloc.token.Span;

import java.util.List;

/**
 * Thrown by the calculation supervisor when a calculation outlives its time limit.
 * The span covers the whole expression.
 */
public class CalculationTimeoutException extends ExpressionException {

    private final long timeLimitMillis;

    public CalculationTimeoutException(String expression, long timeLimitMillis) {
        super(ErrorKind.TIMEOUT, expression, List.of(Span.of(0, expression.length())), timeLimitMillis);
        this.timeLimitMillis = timeLimitMillis;
    }

    public long getTimeLimitMillis() {
        return timeLimitMillis;
    }
}
