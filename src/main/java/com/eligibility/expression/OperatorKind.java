package com.eligibility.expression;

/**
 * Operator families accepted in requirement expressions.
 */
public enum OperatorKind {
    VARIABLE,
    LOGICAL,
    COMPARISON,
    ARITHMETIC,
    STRING
}
