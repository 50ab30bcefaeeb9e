package com.eligibility.expression.ast;

/**
 * Variants of the expression tree.
 */
public enum NodeType {
    CONSTANT,
    VARIABLE_REF,
    ARRAY_LITERAL,
    UNARY_OP,
    BINARY_OP,
    NARY_OP,
    NARY_LOGIC,
    CONDITIONAL
}
