package com.eligibility.rule.version;

import java.util.List;

/**
 * Requirement-level differences between two rule versions, keyed by requirement code.
 *
 * @param fromVersionId Base version
 * @param toVersionId   Compared version
 * @param added         Codes only in the compared version
 * @param removed       Codes only in the base version
 * @param modified      Codes in both with at least one changed field
 * @param unchanged     Codes in both with no changes
 */
public record RuleVersionDiff(
        String fromVersionId,
        String toVersionId,
        List<String> added,
        List<String> removed,
        List<Modification> modified,
        List<String> unchanged
) {
    public RuleVersionDiff {
        added = List.copyOf(added);
        removed = List.copyOf(removed);
        modified = List.copyOf(modified);
        unchanged = List.copyOf(unchanged);
    }

    public boolean hasChanges() {
        return !added.isEmpty() || !removed.isEmpty() || !modified.isEmpty();
    }

    /**
     * @param code    Requirement code
     * @param changes Changed fields
     */
    public record Modification(String code, List<FieldChange> changes) {
        public Modification {
            changes = List.copyOf(changes);
        }
    }

    /**
     * @param field  "label", "mandatory" or "expression"
     * @param before Old value (expressions rendered as JSON)
     * @param after  New value
     */
    public record FieldChange(String field, String before, String after) {
    }
}
