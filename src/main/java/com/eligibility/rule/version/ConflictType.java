package com.eligibility.rule.version;

import java.util.Locale;

/**
 * Relation of one effective range to another.
 */
public enum ConflictType {
    NO_CONFLICT,
    /** Partial intersection, or identical ranges. */
    OVERLAP,
    /** The subject range encloses the other one. */
    CONTAINS,
    /** The subject range lies inside the other one. */
    CONTAINED_BY;

    /**
     * Relation seen from the other range.
     */
    public ConflictType inverse() {
        return switch (this) {
            case CONTAINS -> CONTAINED_BY;
            case CONTAINED_BY -> CONTAINS;
            default -> this;
        };
    }

    public boolean isConflict() {
        return this != NO_CONFLICT;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
