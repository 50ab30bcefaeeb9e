package com.eligibility.rule.version;

import com.eligibility.exception.OptimisticLockException;
import com.eligibility.rule.RuleVersion;
import com.eligibility.rule.RuleVersionProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe in-memory rule version store.
 * <p>
 * Each rule set's versions live in one immutable snapshot that is swapped
 * atomically per rule set, so readers always see either the old or the new
 * committed state.
 */
public class InMemoryRuleVersionStore implements RuleVersionStore, RuleVersionProvider {

    private static final Logger log = LoggerFactory.getLogger(InMemoryRuleVersionStore.class);

    private static final Comparator<RuleVersion> BY_EFFECTIVE_FROM =
            Comparator.comparing(RuleVersion::effectiveFrom).thenComparing(RuleVersion::id);

    private final Map<String, RuleSetState> ruleSets = new ConcurrentHashMap<>();
    private final Map<String, String> ruleSetByVersion = new ConcurrentHashMap<>();

    @Override
    public Optional<RuleVersion> findById(String versionId) {
        String ruleSetId = ruleSetByVersion.get(versionId);
        if (ruleSetId == null) {
            return Optional.empty();
        }
        RuleSetState state = ruleSets.get(ruleSetId);
        return state == null ? Optional.empty() : Optional.ofNullable(state.versions().get(versionId));
    }

    @Override
    public List<RuleVersion> findByRuleSet(String ruleSetId) {
        RuleSetState state = ruleSets.get(ruleSetId);
        if (state == null) {
            return List.of();
        }
        return state.versions().values().stream().sorted(BY_EFFECTIVE_FROM).toList();
    }

    @Override
    public List<RuleVersion> publishedVersions(String ruleSetId) {
        return findByRuleSet(ruleSetId).stream().filter(RuleVersion::published).toList();
    }

    @Override
    public long publishRevision(String ruleSetId) {
        RuleSetState state = ruleSets.get(ruleSetId);
        return state == null ? 0 : state.revision();
    }

    @Override
    public RuleVersion insert(RuleVersion version) {
        if (ruleSetByVersion.putIfAbsent(version.id(), version.ruleSetId()) != null) {
            throw new IllegalArgumentException("Rule version id already exists: " + version.id());
        }
        ruleSets.compute(version.ruleSetId(), (key, state) -> {
            RuleSetState current = state == null ? RuleSetState.EMPTY : state;
            long revision = version.published() ? current.revision() + 1 : current.revision();
            return current.with(version, revision);
        });
        log.debug("Stored rule version {} for rule set {}", version.id(), version.ruleSetId());
        return version;
    }

    @Override
    public RuleVersion compareAndSet(RuleVersion updated, long expectedVersion) {
        ruleSets.compute(updated.ruleSetId(), (key, state) -> {
            RuleVersion stored = requireStored(state, updated);
            checkVersion(stored, expectedVersion);
            return state.with(updated, state.revision());
        });
        return updated;
    }

    @Override
    public RuleVersion compareAndPublish(RuleVersion updated, long expectedVersion, long expectedRevision) {
        ruleSets.compute(updated.ruleSetId(), (key, state) -> {
            RuleVersion stored = requireStored(state, updated);
            checkVersion(stored, expectedVersion);
            if (state.revision() != expectedRevision) {
                throw new OptimisticLockException("Rule set " + key + " changed while publishing "
                        + updated.id() + " (expected revision " + expectedRevision
                        + ", found " + state.revision() + ")");
            }
            return state.with(updated, state.revision() + 1);
        });
        return updated;
    }

    private static RuleVersion requireStored(RuleSetState state, RuleVersion updated) {
        RuleVersion stored = state == null ? null : state.versions().get(updated.id());
        if (stored == null) {
            throw new IllegalArgumentException("Unknown rule version: " + updated.id());
        }
        return stored;
    }

    private static void checkVersion(RuleVersion stored, long expectedVersion) {
        if (stored.monotonicVersion() != expectedVersion) {
            throw new OptimisticLockException(stored.id(), expectedVersion, stored.monotonicVersion());
        }
    }

    /**
     * Immutable snapshot of one rule set.
     */
    private record RuleSetState(long revision, Map<String, RuleVersion> versions) {

        static final RuleSetState EMPTY = new RuleSetState(0, Map.of());

        RuleSetState with(RuleVersion version, long newRevision) {
            Map<String, RuleVersion> copy = new LinkedHashMap<>(versions);
            copy.put(version.id(), version);
            return new RuleSetState(newRevision, Map.copyOf(copy));
        }
    }
}
