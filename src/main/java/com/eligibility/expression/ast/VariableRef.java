package com.eligibility.expression.ast;

import com.eligibility.fact.NormalizedFacts;

/**
 * Reference to a fact by key.
 */
public record VariableRef(String name) implements Expression {

    @Override
    public Object evaluate(NormalizedFacts facts) {
        return facts.get(name).orElse(null);
    }

    @Override
    public NodeType getType() {
        return NodeType.VARIABLE_REF;
    }

    @Override
    public String toString() {
        return "var(" + name + ")";
    }
}
