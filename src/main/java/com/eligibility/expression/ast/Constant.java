package com.eligibility.expression.ast;

import com.eligibility.fact.NormalizedFacts;

/**
 * Literal value: boolean, number, string or null.
 */
public record Constant(Object value) implements Expression {

    public static final Constant TRUE = new Constant(Boolean.TRUE);
    public static final Constant FALSE = new Constant(Boolean.FALSE);

    @Override
    public Object evaluate(NormalizedFacts facts) {
        return value;
    }

    @Override
    public NodeType getType() {
        return NodeType.CONSTANT;
    }

    @Override
    public String toString() {
        return value instanceof String s ? "\"" + s + "\"" : String.valueOf(value);
    }
}
