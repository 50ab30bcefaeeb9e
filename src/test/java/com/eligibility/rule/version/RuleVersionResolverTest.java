package com.eligibility.rule.version;

import com.eligibility.rule.RuleVersion;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RuleVersionResolver.
 */
class RuleVersionResolverTest {

    private static final String RULE_SET = "skilled-worker";
    private static final Instant CREATED = Instant.parse("2024-01-01T09:00:00Z");

    private static RuleVersion version(String id, String from, String to, boolean published, Instant createdAt) {
        return new RuleVersion(id, RULE_SET, LocalDate.parse(from), to == null ? null : LocalDate.parse(to),
                published, 1, createdAt, published ? createdAt : null, List.of());
    }

    @Test
    @DisplayName("Should resolve the single effective published version")
    void shouldResolveSingleVersion() {
        List<RuleVersion> versions = List.of(
                version("h1", "2024-01-01", "2024-06-30", true, CREATED),
                version("h2", "2024-07-01", null, true, CREATED));

        ResolutionResult result = RuleVersionResolver.resolve(RULE_SET, LocalDate.of(2024, 8, 15), versions);

        assertTrue(result.isResolved());
        assertEquals("h2", result.getVersion().orElseThrow().id());
        assertTrue(result.getWarnings().isEmpty());
        assertNull(result.getError());
    }

    @Test
    @DisplayName("Effective bounds should be inclusive on both ends")
    void shouldIncludeBothBounds() {
        List<RuleVersion> versions = List.of(version("h1", "2024-01-01", "2024-06-30", true, CREATED));

        assertTrue(RuleVersionResolver.resolve(RULE_SET, LocalDate.of(2024, 1, 1), versions).isResolved());
        assertTrue(RuleVersionResolver.resolve(RULE_SET, LocalDate.of(2024, 6, 30), versions).isResolved());
        assertFalse(RuleVersionResolver.resolve(RULE_SET, LocalDate.of(2024, 7, 1), versions).isResolved());
    }

    @Test
    @DisplayName("Drafts and other rule sets should be ignored")
    void shouldIgnoreDraftsAndOtherRuleSets() {
        RuleVersion foreign = new RuleVersion("student-1", "student", LocalDate.of(2024, 1, 1), null,
                true, 1, CREATED, CREATED, List.of());
        List<RuleVersion> versions = List.of(version("draft", "2024-01-01", null, false, CREATED), foreign);

        ResolutionResult result = RuleVersionResolver.resolve(RULE_SET, LocalDate.of(2024, 3, 1), versions);

        assertFalse(result.isResolved());
        assertTrue(result.getVersion().isEmpty());
        assertEquals("No active rule version for rule set 'skilled-worker' on 2024-03-01", result.getError());
    }

    @Test
    @DisplayName("Overlapping published versions should pick the newest and warn")
    void shouldPreferMostRecentlyCreated() {
        List<RuleVersion> versions = List.of(
                version("older", "2024-01-01", null, true, CREATED),
                version("newer", "2024-03-01", "2024-12-31", true, CREATED.plusSeconds(3600)));

        ResolutionResult result = RuleVersionResolver.resolve(RULE_SET, LocalDate.of(2024, 4, 1), versions);

        assertEquals("newer", result.getVersion().orElseThrow().id());
        assertEquals(1, result.getWarnings().size());
        assertTrue(result.getWarnings().get(0).contains("older"));
        assertTrue(result.getWarnings().get(0).endsWith("using most recently created newer"));
    }

    @Test
    @DisplayName("Instance resolution should read versions from the provider")
    void shouldUseProvider() {
        AtomicInteger calls = new AtomicInteger();
        RuleVersionResolver resolver = new RuleVersionResolver(ruleSetId -> {
            calls.incrementAndGet();
            return List.of(version("h1", "2024-01-01", null, true, CREATED));
        });

        ResolutionResult result = resolver.resolve(RULE_SET, LocalDate.of(2024, 2, 1));

        assertTrue(result.isResolved());
        assertEquals(RULE_SET, result.getRuleSetId());
        assertEquals(LocalDate.of(2024, 2, 1), result.getAsOf());
        assertEquals(1, calls.get());
    }
}
