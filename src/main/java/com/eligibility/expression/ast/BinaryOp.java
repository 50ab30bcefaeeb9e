package com.eligibility.expression.ast;

import com.eligibility.expression.EvaluationErrorKind;
import com.eligibility.expression.Operator;
import com.eligibility.fact.NormalizedFacts;

/**
 * Two-operand operator: comparisons, {@code in}, and binary {@code - / %}.
 */
public record BinaryOp(Operator operator, Expression left, Expression right) implements Expression {

    @Override
    public Object evaluate(NormalizedFacts facts) {
        Object l = left.evaluate(facts);
        Object r = right.evaluate(facts);
        return switch (operator) {
            case EQUALS, STRICT_EQUALS -> Values.equal(operator, l, r);
            case NOT_EQUALS, STRICT_NOT_EQUALS -> !Values.equal(operator, l, r);
            case GREATER_THAN -> Values.compare(operator, l, r) > 0;
            case GREATER_THAN_OR_EQUALS -> Values.compare(operator, l, r) >= 0;
            case LESS_THAN -> Values.compare(operator, l, r) < 0;
            case LESS_THAN_OR_EQUALS -> Values.compare(operator, l, r) <= 0;
            case IN -> Values.contains(operator, l, r);
            case SUBTRACT -> Values.finite(operator, Values.number(operator, l) - Values.number(operator, r));
            case DIVIDE -> Values.finite(operator, Values.number(operator, l) / divisor(Values.number(operator, r)));
            case MODULO -> Values.finite(operator, Values.number(operator, l) % divisor(Values.number(operator, r)));
            default -> throw new IllegalStateException("Invalid binary operator: " + operator);
        };
    }

    private double divisor(double value) {
        if (value == 0.0) {
            throw new EvaluationException(EvaluationErrorKind.DIVISION_BY_ZERO,
                    "Operator '" + operator.symbol() + "' divided by zero");
        }
        return value;
    }

    @Override
    public NodeType getType() {
        return NodeType.BINARY_OP;
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.symbol() + " " + right + ")";
    }
}
