package com.oloc.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.oloc.config.OlocConfig;
import com.oloc.exception.DivideByZeroException;
import com.oloc.exception.ExpressionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ResultSerializer.
 */
class ResultSerializerTest {

    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final Calculator calculator = new Calculator(OlocConfig.canonicalOnly());

    @Test
    @DisplayName("Should serialize a result with its steps")
    void shouldSerializeResult() throws Exception {
        JsonNode json = objectMapper.readTree(ResultSerializer.toJson(calculator.calculate("-1/2+1/3")));

        assertEquals("-1/2+1/3", json.get("expression").asText());
        assertEquals("-1/6", json.get("value").asText());
        assertEquals(2, json.get("steps").size());
        assertEquals("-1/6", json.get("steps").get(1).asText());
        assertTrue(json.get("rational").asBoolean());
    }

    @Test
    @DisplayName("Irrational results are flagged")
    void shouldFlagIrrationalResult() {
        Map<String, Object> map = ResultSerializer.toMap(calculator.calculate("2π"));

        assertEquals("2π", map.get("value"));
        assertEquals(false, map.get("rational"));
    }

    @Test
    @DisplayName("Should serialize an error with kind, family and spans")
    void shouldSerializeError() throws Exception {
        ExpressionException error = assertThrows(DivideByZeroException.class, () -> calculator.calculate("5/0"));

        JsonNode json = objectMapper.readTree(ResultSerializer.toJson(error));

        assertEquals("DIVIDE_BY_ZERO", json.get("kind").asText());
        assertEquals("DivideByZero", json.get("family").asText());
        assertEquals("5/0", json.get("expression").asText());
        assertEquals(error.getHint(), json.get("hint").asText());
        assertEquals(1, json.get("spans").size());
        assertEquals(0, json.get("spans").get(0).get("start").asInt());
        assertEquals(3, json.get("spans").get(0).get("end").asInt());
    }

    @Test
    @DisplayName("Family is the exception name without its suffix")
    void shouldDeriveFamily() {
        ExpressionException error = assertThrows(ExpressionException.class, () -> calculator.calculate("1+"));

        assertEquals("Placement", ResultSerializer.familyOf(error));
        assertEquals(List.of("kind", "family", "message", "hint", "expression", "spans"),
                List.copyOf(ResultSerializer.toMap(error).keySet()));
    }
}
