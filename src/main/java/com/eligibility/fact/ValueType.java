package com.eligibility.fact;

/**
 * Type a variable is expected to hold, as implied by how an expression uses it.
 */
public enum ValueType {
    NUMBER,
    BOOLEAN,
    ANY;

    /**
     * Merge two usages of the same variable. Disagreeing usages fall back to ANY.
     */
    public ValueType merge(ValueType other) {
        if (other == null || other == this) {
            return this;
        }
        return ANY;
    }
}
