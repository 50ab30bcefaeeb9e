package com.eligibility.rule.version;

import com.eligibility.exception.OptimisticLockException;
import com.eligibility.rule.RuleVersion;

import java.util.List;
import java.util.Optional;

/**
 * Authoring-side storage of rule versions.
 * Writes are compare-and-swap; a stale expectation raises {@link OptimisticLockException}.
 */
public interface RuleVersionStore {

    Optional<RuleVersion> findById(String versionId);

    /**
     * All versions of a rule set, drafts included, ordered by effective start.
     */
    List<RuleVersion> findByRuleSet(String ruleSetId);

    /**
     * Counter bumped by every successful publish in the rule set.
     */
    long publishRevision(String ruleSetId);

    /**
     * Store a new version.
     *
     * @throws IllegalArgumentException if the id is taken
     */
    RuleVersion insert(RuleVersion version);

    /**
     * Replace a version if its stored counter still equals {@code expectedVersion}.
     */
    RuleVersion compareAndSet(RuleVersion updated, long expectedVersion);

    /**
     * Replace a version if its stored counter still equals {@code expectedVersion} and no
     * other publish in the same rule set committed since {@code expectedRevision} was read.
     * Bumps the rule set's publish revision.
     */
    RuleVersion compareAndPublish(RuleVersion updated, long expectedVersion, long expectedRevision);
}
