package com.eligibility.expression;

import java.util.Locale;

/**
 * Classification of a requirement that could not produce a boolean verdict.
 */
public enum EvaluationErrorKind {
    INVALID_EXPRESSION,
    DIVISION_BY_ZERO,
    TYPE_MISMATCH,
    NON_FINITE_RESULT,
    NULL_RESULT;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
