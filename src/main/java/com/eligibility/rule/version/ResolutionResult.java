package com.eligibility.rule.version;

import com.eligibility.rule.RuleVersion;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Result of resolving the applicable version of a rule set for a date.
 * Either carries a version (possibly with data-integrity warnings) or
 * explains why no version is active.
 */
public final class ResolutionResult {

    private final String ruleSetId;
    private final LocalDate asOf;
    private final RuleVersion version;
    private final List<String> warnings;
    private final String error;

    private ResolutionResult(String ruleSetId, LocalDate asOf, RuleVersion version,
                             List<String> warnings, String error) {
        this.ruleSetId = ruleSetId;
        this.asOf = asOf;
        this.version = version;
        this.warnings = List.copyOf(warnings);
        this.error = error;
    }

    /**
     * Create a result for a resolved version.
     */
    public static ResolutionResult resolved(String ruleSetId, LocalDate asOf, RuleVersion version, List<String> warnings) {
        return new ResolutionResult(ruleSetId, asOf, version, warnings, null);
    }

    /**
     * Create a result for a rule set with no published version effective on the date.
     */
    public static ResolutionResult noActiveVersion(String ruleSetId, LocalDate asOf) {
        String error = "No active rule version for rule set '" + ruleSetId + "' on " + asOf;
        return new ResolutionResult(ruleSetId, asOf, null, List.of(), error);
    }

    public boolean isResolved() {
        return version != null;
    }

    public Optional<RuleVersion> getVersion() {
        return Optional.ofNullable(version);
    }

    public String getRuleSetId() {
        return ruleSetId;
    }

    public LocalDate getAsOf() {
        return asOf;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    /**
     * Reason no version was resolved; null when resolved.
     */
    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return "ResolutionResult{" +
                "ruleSetId=" + ruleSetId +
                ", asOf=" + asOf +
                ", version=" + (version != null ? version.id() : "none") +
                ", warnings=" + warnings.size() +
                '}';
    }
}
