package com.eligibility.core;

import com.eligibility.rule.DateRange;
import com.eligibility.rule.version.ResolutionResult;
import com.eligibility.rule.version.RuleVersionPublishedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RuleVersionCache.
 */
class RuleVersionCacheTest {

    private static final LocalDate DAY = LocalDate.of(2024, 3, 1);

    private RuleVersionCache cache;
    private AtomicInteger loads;

    @BeforeEach
    void setUp() {
        cache = new RuleVersionCache(2);
        loads = new AtomicInteger();
    }

    private ResolutionResult load(String ruleSetId, LocalDate asOf) {
        return cache.get(ruleSetId, asOf, () -> {
            loads.incrementAndGet();
            return ResolutionResult.noActiveVersion(ruleSetId, asOf);
        });
    }

    @Test
    @DisplayName("Should load once per rule set and date")
    void shouldCacheResolutions() {
        ResolutionResult first = load("skilled-worker", DAY);
        ResolutionResult second = load("skilled-worker", DAY);

        assertSame(first, second);
        assertEquals(1, loads.get());
        load("skilled-worker", DAY.plusDays(1));
        assertEquals(2, loads.get());
    }

    @Test
    @DisplayName("A publish should drop only its rule set's entries")
    void shouldInvalidateOnPublish() {
        load("skilled-worker", DAY);
        load("student", DAY);

        cache.onPublished(new RuleVersionPublishedEvent("skilled-worker", "v2", DateRange.startingAt(DAY), Instant.now()));

        assertEquals(1, cache.size());
        load("student", DAY);
        assertEquals(2, loads.get());
        load("skilled-worker", DAY);
        assertEquals(3, loads.get());
    }

    @Test
    @DisplayName("A resolution racing an invalidation should not be cached")
    void shouldNotCacheStaleLoad() {
        cache.get("skilled-worker", DAY, () -> {
            cache.invalidate("skilled-worker");
            return ResolutionResult.noActiveVersion("skilled-worker", DAY);
        });

        assertEquals(0, cache.size());
    }

    @Test
    @DisplayName("A full cache should start over rather than grow")
    void shouldBoundSize() {
        load("a", DAY);
        load("b", DAY);
        load("c", DAY);

        assertTrue(cache.size() <= 2);
        cache.invalidateAll();
        assertEquals(0, cache.size());
    }

    @Test
    @DisplayName("Should reject a non-positive capacity")
    void shouldRejectInvalidCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new RuleVersionCache(0));
    }
}
