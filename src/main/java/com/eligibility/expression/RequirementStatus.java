package com.eligibility.expression;

/**
 * Outcome of evaluating one requirement against a fact set.
 */
public enum RequirementStatus {
    PASSED,
    FAILED,
    MISSING_FACTS,
    ERROR;

    /**
     * Passed and failed requirements produced a verdict; the others did not.
     */
    public boolean isEvaluable() {
        return this == PASSED || this == FAILED;
    }
}
