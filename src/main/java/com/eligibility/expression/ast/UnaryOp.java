package com.eligibility.expression.ast;

import com.eligibility.expression.Operator;
import com.eligibility.fact.NormalizedFacts;

/**
 * Single-operand operator: {@code !}, {@code !!}, unary {@code -} and {@code abs}.
 */
public record UnaryOp(Operator operator, Expression operand) implements Expression {

    @Override
    public Object evaluate(NormalizedFacts facts) {
        Object value = operand.evaluate(facts);
        return switch (operator) {
            case NOT -> !Values.bool(operator, value);
            case TRUTHY -> Values.truthy(value);
            case SUBTRACT -> Values.finite(operator, -Values.number(operator, value));
            case ABS -> Values.finite(operator, Math.abs(Values.number(operator, value)));
            default -> throw new IllegalStateException("Invalid unary operator: " + operator);
        };
    }

    @Override
    public NodeType getType() {
        return NodeType.UNARY_OP;
    }

    @Override
    public String toString() {
        return operator.symbol() + "(" + operand + ")";
    }
}
