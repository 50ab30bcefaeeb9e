package com.eligibility.rule.version;

import com.eligibility.exception.EligibilityException;
import com.eligibility.exception.InvalidExpressionException;
import com.eligibility.exception.OptimisticLockException;
import com.eligibility.exception.RuleVersionConflictException;
import com.eligibility.expression.ExpressionValidator;
import com.eligibility.expression.ValidationResult;
import com.eligibility.rule.DateRange;
import com.eligibility.rule.Requirement;
import com.eligibility.rule.RuleVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Authoring path for rule versions: drafts, revisions and publishing.
 * <p>
 * Every write is a compare-and-swap on the version's {@code monotonicVersion};
 * a caller holding a stale copy gets an {@link OptimisticLockException} and
 * must re-fetch and retry. Publishing also checks the rule set's publish
 * revision, so of two concurrent publishers of the same rule set at most one
 * commits against the state it validated.
 */
public class RuleVersionPublisher {

    private static final Logger log = LoggerFactory.getLogger(RuleVersionPublisher.class);

    private final RuleVersionStore store;
    private final ExpressionValidator validator;
    private final Clock clock;
    private final List<RuleVersionPublishedListener> listeners = new CopyOnWriteArrayList<>();

    public RuleVersionPublisher(RuleVersionStore store, ExpressionValidator validator) {
        this(store, validator, Clock.systemUTC());
    }

    public RuleVersionPublisher(RuleVersionStore store, ExpressionValidator validator, Clock clock) {
        this.store = store;
        this.validator = validator;
        this.clock = clock;
    }

    public void addListener(RuleVersionPublishedListener listener) {
        listeners.add(listener);
    }

    /**
     * Create an unpublished version with {@code monotonicVersion = 1}.
     */
    public RuleVersion createDraft(String ruleSetId, DateRange range, List<Requirement> requirements) {
        checkUniqueCodes(requirements);
        RuleVersion draft = new RuleVersion(UUID.randomUUID().toString(), ruleSetId, range.from(), range.to(),
                false, 1, clock.instant(), null, requirements);
        store.insert(draft);
        log.info("Created draft rule version {} for {} effective {}", draft.id(), ruleSetId, range);
        return draft;
    }

    /**
     * Replace the requirements of a draft.
     *
     * @throws EligibilityException    if the version is published
     * @throws OptimisticLockException if {@code expectedVersion} is stale
     */
    public RuleVersion reviseDraft(String versionId, long expectedVersion, List<Requirement> requirements) {
        RuleVersion current = requireDraft(versionId, expectedVersion);
        checkUniqueCodes(requirements);
        RuleVersion revised = store.compareAndSet(current.withRequirements(requirements), expectedVersion);
        log.info("Revised draft rule version {} (now version {})", versionId, revised.monotonicVersion());
        return revised;
    }

    /**
     * Move the effective range of a draft.
     */
    public RuleVersion rescheduleDraft(String versionId, long expectedVersion, DateRange range) {
        RuleVersion current = requireDraft(versionId, expectedVersion);
        RuleVersion moved = store.compareAndSet(current.withRange(range), expectedVersion);
        log.info("Rescheduled draft rule version {} to {}", versionId, range);
        return moved;
    }

    /**
     * Publish a draft.
     *
     * @param versionId       Draft to publish
     * @param expectedVersion {@code monotonicVersion} the caller last read
     * @return Published version
     * @throws InvalidExpressionException   if any requirement expression is invalid
     * @throws RuleVersionConflictException if the range conflicts with another published version
     * @throws OptimisticLockException      if the version or its rule set changed concurrently
     */
    public RuleVersion publish(String versionId, long expectedVersion) {
        RuleVersion current = requireDraft(versionId, expectedVersion);
        String ruleSetId = current.ruleSetId();

        // read the revision before the versions it guards
        long revision = store.publishRevision(ruleSetId);

        validateRequirements(current);

        List<Conflict> conflicts = ConflictDetector.findConflicts(
                store.findByRuleSet(ruleSetId), current.effectiveRange(), versionId).stream()
                .filter(Conflict::published)
                .toList();
        if (!conflicts.isEmpty()) {
            log.warn("Publish of {} blocked by {} conflicting published version(s)", versionId, conflicts.size());
            throw new RuleVersionConflictException("Rule version " + versionId + " " + current.effectiveRange()
                    + " conflicts with published versions: " + conflicts, conflicts);
        }

        Instant now = clock.instant();
        RuleVersion published = store.compareAndPublish(current.asPublished(now), expectedVersion, revision);
        log.info("Published rule version {} for {} effective {}", versionId, ruleSetId, published.effectiveRange());

        RuleVersionPublishedEvent event = new RuleVersionPublishedEvent(ruleSetId, versionId,
                published.effectiveRange(), now);
        for (RuleVersionPublishedListener listener : listeners) {
            try {
                listener.onPublished(event);
            } catch (RuntimeException e) {
                log.warn("Publish listener {} failed for {}: {}", listener, versionId, e.getMessage(), e);
            }
        }
        return published;
    }

    private RuleVersion requireDraft(String versionId, long expectedVersion) {
        RuleVersion current = store.findById(versionId)
                .orElseThrow(() -> new EligibilityException("Unknown rule version: " + versionId));
        if (current.monotonicVersion() != expectedVersion) {
            throw new OptimisticLockException(versionId, expectedVersion, current.monotonicVersion());
        }
        if (current.published()) {
            throw new EligibilityException("Rule version " + versionId + " is published and read-only");
        }
        return current;
    }

    private void validateRequirements(RuleVersion version) {
        List<String> problems = new ArrayList<>();
        for (Requirement requirement : version.requirements()) {
            ValidationResult result = validator.validate(requirement.expression());
            if (!result.ok()) {
                problems.add(requirement.code() + ": " + String.join("; ", result.errors()));
            }
        }
        if (!problems.isEmpty()) {
            throw new InvalidExpressionException("Rule version " + version.id()
                    + " has invalid requirement expressions: " + String.join(" | ", problems), -1);
        }
    }

    private static void checkUniqueCodes(List<Requirement> requirements) {
        Set<String> seen = new HashSet<>();
        Set<String> duplicates = requirements.stream()
                .map(Requirement::code)
                .filter(code -> !seen.add(code))
                .collect(Collectors.toCollection(LinkedHashSet::new));
        if (!duplicates.isEmpty()) {
            throw new EligibilityException("Duplicate requirement codes: " + duplicates);
        }
    }
}
