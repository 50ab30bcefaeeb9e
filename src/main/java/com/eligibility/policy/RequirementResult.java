package com.eligibility.policy;

import com.eligibility.expression.RequirementOutcome;
import com.eligibility.rule.Requirement;

import java.util.Objects;

/**
 * A requirement paired with its evaluation outcome.
 */
public record RequirementResult(Requirement requirement, RequirementOutcome outcome) {

    public RequirementResult {
        Objects.requireNonNull(requirement, "requirement");
        Objects.requireNonNull(outcome, "outcome");
    }

    public boolean isMandatory() {
        return requirement.mandatory();
    }
}
