package com.eligibility.exception;

import com.eligibility.rule.version.Conflict;

import java.util.List;

/**
 * Exception thrown when publishing a rule version would overlap an already
 * published version of the same rule set.
 */
public class RuleVersionConflictException extends EligibilityException {

    private final List<Conflict> conflicts;

    public RuleVersionConflictException(String message, List<Conflict> conflicts) {
        super(message);
        this.conflicts = List.copyOf(conflicts);
    }

    public List<Conflict> getConflicts() {
        return conflicts;
    }
}
