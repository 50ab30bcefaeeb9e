package com.eligibility.core;

import com.eligibility.rule.version.ResolutionResult;
import com.eligibility.rule.version.RuleVersionPublishedEvent;
import com.eligibility.rule.version.RuleVersionPublishedListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Read-through cache of version resolutions keyed by (rule set, as-of date).
 * <p>
 * Entries of a rule set are dropped when a version of it is published. A
 * resolution that was computed while a publish happened is not stored, so a
 * stale version is never cached past its invalidation.
 */
public class RuleVersionCache implements RuleVersionPublishedListener {

    private static final Logger log = LoggerFactory.getLogger(RuleVersionCache.class);

    private final Map<Key, ResolutionResult> entries = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> generations = new ConcurrentHashMap<>();
    private final int maxEntries;

    public RuleVersionCache(int maxEntries) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be positive");
        }
        this.maxEntries = maxEntries;
    }

    /**
     * Cached resolution, computing and storing it on a miss.
     */
    public ResolutionResult get(String ruleSetId, LocalDate asOf, Supplier<ResolutionResult> loader) {
        Key key = new Key(ruleSetId, asOf);
        ResolutionResult cached = entries.get(key);
        if (cached != null) {
            return cached;
        }

        long generation = generation(ruleSetId).get();
        ResolutionResult loaded = loader.get();
        if (generation(ruleSetId).get() == generation) {
            if (entries.size() >= maxEntries) {
                log.debug("Rule version cache full ({} entries), clearing", entries.size());
                entries.clear();
            }
            entries.put(key, loaded);
            if (generation(ruleSetId).get() != generation) {
                // lost a race with invalidate()
                entries.remove(key, loaded);
            }
        }
        return loaded;
    }

    @Override
    public void onPublished(RuleVersionPublishedEvent event) {
        invalidate(event.ruleSetId());
    }

    public void invalidate(String ruleSetId) {
        generation(ruleSetId).incrementAndGet();
        entries.keySet().removeIf(key -> key.ruleSetId().equals(ruleSetId));
        log.debug("Invalidated cached resolutions of rule set {}", ruleSetId);
    }

    public void invalidateAll() {
        generations.values().forEach(AtomicLong::incrementAndGet);
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    private AtomicLong generation(String ruleSetId) {
        return generations.computeIfAbsent(ruleSetId, id -> new AtomicLong());
    }

    private record Key(String ruleSetId, LocalDate asOf) {
    }
}
