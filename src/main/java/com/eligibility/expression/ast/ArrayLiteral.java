package com.eligibility.expression.ast;

import com.eligibility.fact.NormalizedFacts;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * List of expressions, evaluated element by element (e.g. the haystack of {@code in}).
 */
public record ArrayLiteral(List<Expression> items) implements Expression {

    public ArrayLiteral {
        items = List.copyOf(items);
    }

    @Override
    public Object evaluate(NormalizedFacts facts) {
        List<Object> values = new ArrayList<>(items.size());
        for (Expression item : items) {
            values.add(item.evaluate(facts));
        }
        return Collections.unmodifiableList(values);
    }

    @Override
    public NodeType getType() {
        return NodeType.ARRAY_LITERAL;
    }

    @Override
    public String toString() {
        return items.toString();
    }
}
