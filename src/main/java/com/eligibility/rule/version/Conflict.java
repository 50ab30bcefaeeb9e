package com.eligibility.rule.version;

import com.eligibility.rule.DateRange;

/**
 * An existing rule version whose range intersects a proposed one.
 *
 * @param versionId Existing version
 * @param range     Existing version's effective range
 * @param published Whether the existing version is published
 * @param type      How the proposed range relates to the existing one
 */
public record Conflict(String versionId, DateRange range, boolean published, ConflictType type) {

    @Override
    public String toString() {
        return type.label() + " with " + versionId + " " + range + (published ? " (published)" : " (draft)");
    }
}
