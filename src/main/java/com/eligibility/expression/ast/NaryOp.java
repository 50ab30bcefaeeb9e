package com.eligibility.expression.ast;

import com.eligibility.expression.Operator;
import com.eligibility.fact.NormalizedFacts;

import java.util.List;

/**
 * Variadic value operator: {@code + * min max cat}.
 */
public record NaryOp(Operator operator, List<Expression> operands) implements Expression {

    public NaryOp {
        operands = List.copyOf(operands);
    }

    @Override
    public Object evaluate(NormalizedFacts facts) {
        return switch (operator) {
            case ADD -> {
                double sum = 0.0;
                for (Expression operand : operands) {
                    sum = Values.finite(operator, sum + Values.number(operator, operand.evaluate(facts)));
                }
                yield sum;
            }
            case MULTIPLY -> {
                double product = 1.0;
                for (Expression operand : operands) {
                    product = Values.finite(operator, product * Values.number(operator, operand.evaluate(facts)));
                }
                yield product;
            }
            case MIN, MAX -> extreme(facts);
            case CONCAT -> {
                StringBuilder sb = new StringBuilder();
                for (Expression operand : operands) {
                    Object value = operand.evaluate(facts);
                    if (value instanceof Double d && d == Math.rint(d) && !Double.isInfinite(d)) {
                        sb.append(d.longValue());
                    } else if (value != null) {
                        sb.append(value);
                    }
                }
                yield sb.toString();
            }
            default -> throw new IllegalStateException("Invalid n-ary operator: " + operator);
        };
    }

    private Double extreme(NormalizedFacts facts) {
        Double best = null;
        for (Expression operand : operands) {
            double value = Values.number(operator, operand.evaluate(facts));
            if (best == null
                    || (operator == Operator.MIN ? value < best : value > best)) {
                best = value;
            }
        }
        return best;
    }

    @Override
    public NodeType getType() {
        return NodeType.NARY_OP;
    }

    @Override
    public String toString() {
        return operator.symbol() + operands;
    }
}
