package com.eligibility.expression;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Whitelist of operators supported in requirement expressions, with their arity.
 * Any token not listed here is rejected by {@link ExpressionValidator}.
 */
public enum Operator {
    // Variable reference
    VAR("var", OperatorKind.VARIABLE, 1, 1),

    // Logical
    AND("and", OperatorKind.LOGICAL, 1, Operator.UNBOUNDED),
    OR("or", OperatorKind.LOGICAL, 1, Operator.UNBOUNDED),
    NOT("!", OperatorKind.LOGICAL, 1, 1),
    TRUTHY("!!", OperatorKind.LOGICAL, 1, 1),
    IF("if", OperatorKind.LOGICAL, 1, Operator.UNBOUNDED),

    // Comparison
    EQUALS("==", OperatorKind.COMPARISON, 2, 2),
    STRICT_EQUALS("===", OperatorKind.COMPARISON, 2, 2),
    NOT_EQUALS("!=", OperatorKind.COMPARISON, 2, 2),
    STRICT_NOT_EQUALS("!==", OperatorKind.COMPARISON, 2, 2),
    GREATER_THAN(">", OperatorKind.COMPARISON, 2, 2),
    GREATER_THAN_OR_EQUALS(">=", OperatorKind.COMPARISON, 2, 2),
    LESS_THAN("<", OperatorKind.COMPARISON, 2, 2),
    LESS_THAN_OR_EQUALS("<=", OperatorKind.COMPARISON, 2, 2),
    IN("in", OperatorKind.COMPARISON, 2, 2),

    // Arithmetic
    ADD("+", OperatorKind.ARITHMETIC, 1, Operator.UNBOUNDED),
    SUBTRACT("-", OperatorKind.ARITHMETIC, 1, 2),
    MULTIPLY("*", OperatorKind.ARITHMETIC, 1, Operator.UNBOUNDED),
    DIVIDE("/", OperatorKind.ARITHMETIC, 2, 2),
    MODULO("%", OperatorKind.ARITHMETIC, 2, 2),
    MIN("min", OperatorKind.ARITHMETIC, 0, Operator.UNBOUNDED),
    MAX("max", OperatorKind.ARITHMETIC, 0, Operator.UNBOUNDED),
    ABS("abs", OperatorKind.ARITHMETIC, 1, 1),

    // String
    CONCAT("cat", OperatorKind.STRING, 1, Operator.UNBOUNDED);

    public static final int UNBOUNDED = Integer.MAX_VALUE;

    private static final Map<String, Operator> BY_SYMBOL = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(Operator::symbol, Function.identity()));

    private final String symbol;
    private final OperatorKind kind;
    private final int minArity;
    private final int maxArity;

    Operator(String symbol, OperatorKind kind, int minArity, int maxArity) {
        this.symbol = symbol;
        this.kind = kind;
        this.minArity = minArity;
        this.maxArity = maxArity;
    }

    public String symbol() {
        return symbol;
    }

    public OperatorKind kind() {
        return kind;
    }

    public int minArity() {
        return minArity;
    }

    public int maxArity() {
        return maxArity;
    }

    public boolean acceptsArity(int count) {
        return count >= minArity && count <= maxArity;
    }

    /**
     * True for the ordering comparisons {@code > >= < <=}.
     */
    public boolean isOrdering() {
        return this == GREATER_THAN || this == GREATER_THAN_OR_EQUALS
                || this == LESS_THAN || this == LESS_THAN_OR_EQUALS;
    }

    /**
     * True for the equality comparisons {@code == === != !==}.
     */
    public boolean isEquality() {
        return this == EQUALS || this == STRICT_EQUALS || this == NOT_EQUALS || this == STRICT_NOT_EQUALS;
    }

    public static Optional<Operator> fromSymbol(String symbol) {
        return Optional.ofNullable(BY_SYMBOL.get(symbol));
    }

    @Override
    public String toString() {
        return symbol;
    }
}
