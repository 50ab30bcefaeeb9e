package com.eligibility.rule.version;

import com.eligibility.rule.DateRange;

import java.time.Instant;

/**
 * Emitted after a rule version publish has committed.
 *
 * @param ruleSetId   Rule set whose active versions changed
 * @param versionId   Newly published version
 * @param range       Its effective range
 * @param publishedAt Commit time
 */
public record RuleVersionPublishedEvent(String ruleSetId, String versionId, DateRange range, Instant publishedAt) {
}
