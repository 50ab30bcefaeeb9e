package com.eligibility.expression.ast;

import com.eligibility.expression.Operator;
import com.eligibility.fact.NormalizedFacts;

import java.util.List;
import java.util.Locale;

/**
 * Short-circuit {@code and} / {@code or} over boolean operands.
 */
public record NaryLogic(Operator operator, List<Expression> operands) implements Expression {

    public NaryLogic {
        if (operator != Operator.AND && operator != Operator.OR) {
            throw new IllegalArgumentException("Invalid logical operator: " + operator);
        }
        operands = List.copyOf(operands);
    }

    @Override
    public Object evaluate(NormalizedFacts facts) {
        boolean shortCircuit = operator == Operator.OR;
        for (Expression operand : operands) {
            if (Values.bool(operator, operand.evaluate(facts)) == shortCircuit) {
                return shortCircuit;
            }
        }
        return !shortCircuit;
    }

    @Override
    public NodeType getType() {
        return NodeType.NARY_LOGIC;
    }

    @Override
    public String toString() {
        return operator.symbol().toUpperCase(Locale.ROOT) + operands;
    }
}
