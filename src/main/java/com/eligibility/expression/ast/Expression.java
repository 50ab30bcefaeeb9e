package com.eligibility.expression.ast;

import com.eligibility.fact.NormalizedFacts;

/**
 * Node of a compiled requirement expression.
 * Trees are built once by {@link com.eligibility.expression.ExpressionValidator}
 * and are immutable, so one tree may be evaluated concurrently against any number
 * of fact sets.
 */
public interface Expression {

    /**
     * Evaluate this node against the given facts.
     *
     * @param facts Current, coerced fact values
     * @return Boolean, Number, String, List or null
     * @throws EvaluationException if the node cannot produce a value
     */
    Object evaluate(NormalizedFacts facts);

    /**
     * Get the node type.
     */
    NodeType getType();
}
