package com.oloc.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.oloc.exception.ExpressionException;
import com.oloc.exception.OlocException;
import com.oloc.token.Span;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON views of results and expression errors for external renderers.
 * <p>
 * A result becomes {@code {expression, value, steps, rational}}; an error becomes
 * {@code {kind, family, message, hint, expression, spans:[{start, end}]}}.
 */
public class ResultSerializer {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private ResultSerializer() {
    }

    public static String toJson(Result result) {
        return write(toMap(result));
    }

    public static String toJson(ExpressionException error) {
        return write(toMap(error));
    }

    public static Map<String, Object> toMap(Result result) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("expression", result.expression());
        map.put("value", result.formatted());
        map.put("steps", result.steps());
        map.put("rational", result.isRational());
        return map;
    }

    public static Map<String, Object> toMap(ExpressionException error) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("kind", error.getKind().name());
        map.put("family", familyOf(error));
        map.put("message", error.getMessage());
        map.put("hint", error.getHint());
        map.put("expression", error.getExpression());
        map.put("spans", error.getSpans().stream().map(ResultSerializer::toMap).toList());
        return map;
    }

    private static Map<String, Object> toMap(Span span) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("start", span.start());
        map.put("end", span.end());
        return map;
    }

    /**
     * Error family name, e.g. {@code DivideByZero} for a {@code DivideByZeroException}.
     */
    static String familyOf(ExpressionException error) {
        String name = error.getClass().getSimpleName();
        return name.endsWith("Exception") ? name.substring(0, name.length() - "Exception".length()) : name;
    }

    private static String write(Map<String, Object> map) {
        try {
            return objectMapper.writeValueAsString(map);
        } catch (JsonProcessingException e) {
            throw new OlocException("Cannot serialize " + map.keySet() + ": " + e.getMessage(), e);
        }
    }
}
