package com.oloc.function;

import com.oloc.exception.ConversionException;
import com.oloc.exception.DivideByZeroException;
import com.oloc.exception.DomainException;
import com.oloc.exception.ErrorKind;
import com.oloc.token.Span;

/**
 * Where a reduction happens: the original expression, the span of the node being
 * reduced and the declared signs and values of custom irrationals.
 */
public record CallSite(String expression, Span span, ParamResolver params) {

    public DomainException domainError(String function, String detail) {
        return new DomainException(ErrorKind.FUNCTION_DOMAIN, expression, span, function, detail);
    }

    public ConversionException missingValue(String symbol) {
        return new ConversionException(ErrorKind.MISSING_CONVERSION_VALUE, expression, span, symbol);
    }

    public DivideByZeroException divideByZero() {
        return new DivideByZeroException(ErrorKind.DIVIDE_BY_ZERO, expression, span, text());
    }

    public String text() {
        int end = Math.min(span.end(), expression.length());
        return expression.substring(Math.min(span.start(), end), end);
    }
}
