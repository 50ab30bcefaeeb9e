package com.eligibility.rule;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * A temporally scoped snapshot of the requirements of one rule set.
 *
 * @param id               Version identifier
 * @param ruleSetId        Owning rule set (e.g. a visa category)
 * @param effectiveFrom    First effective day (inclusive)
 * @param effectiveTo      Last effective day (inclusive), or null when open-ended
 * @param published        Whether the version takes part in resolution
 * @param monotonicVersion Mutation counter for optimistic concurrency
 * @param createdAt        Creation time, used to break resolution ties
 * @param publishedAt      Publish time, or null for drafts
 * @param requirements     Requirements in evaluation order
 */
public record RuleVersion(
        String id,
        String ruleSetId,
        LocalDate effectiveFrom,
        LocalDate effectiveTo,
        boolean published,
        long monotonicVersion,
        Instant createdAt,
        Instant publishedAt,
        List<Requirement> requirements
) {
    public RuleVersion {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(ruleSetId, "ruleSetId");
        Objects.requireNonNull(createdAt, "createdAt");
        // validates the bounds
        new DateRange(effectiveFrom, effectiveTo);
        requirements = requirements == null ? List.of() : List.copyOf(requirements);
    }

    public DateRange effectiveRange() {
        return new DateRange(effectiveFrom, effectiveTo);
    }

    public boolean isEffectiveOn(LocalDate date) {
        return effectiveRange().contains(date);
    }

    /**
     * Published copy with the version counter bumped.
     */
    public RuleVersion asPublished(Instant at) {
        return new RuleVersion(id, ruleSetId, effectiveFrom, effectiveTo, true,
                monotonicVersion + 1, createdAt, at, requirements);
    }

    /**
     * Copy with new requirements and the version counter bumped.
     */
    public RuleVersion withRequirements(List<Requirement> newRequirements) {
        return new RuleVersion(id, ruleSetId, effectiveFrom, effectiveTo, published,
                monotonicVersion + 1, createdAt, publishedAt, newRequirements);
    }

    /**
     * Copy with a new effective range and the version counter bumped.
     */
    public RuleVersion withRange(DateRange range) {
        return new RuleVersion(id, ruleSetId, range.from(), range.to(), published,
                monotonicVersion + 1, createdAt, publishedAt, requirements);
    }
}
