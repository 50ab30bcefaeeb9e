package com.eligibility.rule;

import com.eligibility.expression.ExpressionJson;

import java.util.Objects;

/**
 * One declarative condition of a rule version.
 *
 * @param code       Stable requirement code, unique within a version (e.g. "MIN_SALARY")
 * @param label      Human-readable description
 * @param expression JSON-logic expression (maps, lists and scalars); stored as a deep unmodifiable copy
 * @param mandatory  Whether a failure is absolute
 */
public record Requirement(String code, String label, Object expression, boolean mandatory) {

    public Requirement {
        Objects.requireNonNull(code, "code");
        if (label == null || label.isBlank()) {
            label = code;
        }
        expression = ExpressionJson.freeze(expression);
    }

    public static Requirement mandatory(String code, Object expression) {
        return new Requirement(code, code, expression, true);
    }

    public static Requirement optional(String code, Object expression) {
        return new Requirement(code, code, expression, false);
    }
}
