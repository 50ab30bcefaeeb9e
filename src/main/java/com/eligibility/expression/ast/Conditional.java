package com.eligibility.expression.ast;

import com.eligibility.expression.Operator;
import com.eligibility.fact.NormalizedFacts;

import java.util.List;

/**
 * {@code if}: pairs of (condition, value) followed by an optional else value.
 * Evaluates to null when no condition holds and there is no else branch.
 */
public record Conditional(List<Expression> branches) implements Expression {

    public Conditional {
        branches = List.copyOf(branches);
    }

    @Override
    public Object evaluate(NormalizedFacts facts) {
        int i = 0;
        while (i + 1 < branches.size()) {
            if (Values.bool(Operator.IF, branches.get(i).evaluate(facts))) {
                return branches.get(i + 1).evaluate(facts);
            }
            i += 2;
        }
        return i < branches.size() ? branches.get(i).evaluate(facts) : null;
    }

    @Override
    public NodeType getType() {
        return NodeType.CONDITIONAL;
    }

    @Override
    public String toString() {
        return "IF" + branches;
    }
}
