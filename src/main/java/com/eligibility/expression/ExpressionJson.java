package com.eligibility.expression;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON helpers for raw requirement expressions.
 */
public final class ExpressionJson {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private ExpressionJson() {
    }

    /**
     * Parse JSON text into a raw expression (maps, lists and scalars).
     *
     * @param json JSON text, e.g. {@code {">=": [{"var": "age"}, 18]}}
     * @return Raw expression
     */
    public static Object parse(String json) {
        try {
            return objectMapper.readValue(json, Object.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON expression: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Render a raw expression as JSON text.
     */
    public static String toJson(Object expression) {
        try {
            return objectMapper.writeValueAsString(expression);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Expression cannot be rendered as JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Deep, unmodifiable copy of a raw expression.
     * Map key order is preserved; scalars are shared.
     */
    public static Object freeze(Object expression) {
        if (expression instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((key, value) -> copy.put(String.valueOf(key), freeze(value)));
            return Collections.unmodifiableMap(copy);
        }
        if (expression instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(item -> copy.add(freeze(item)));
            return Collections.unmodifiableList(copy);
        }
        return expression;
    }
}
