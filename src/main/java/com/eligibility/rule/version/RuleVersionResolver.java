package com.eligibility.rule.version;

import com.eligibility.rule.RuleVersion;
import com.eligibility.rule.RuleVersionProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Selects the single rule version applicable on a date.
 * <p>
 * Candidates are published versions whose range contains the date. Several
 * candidates mean publishing let a conflict through; the most recently
 * created one is used and a warning is surfaced rather than failing.
 */
public class RuleVersionResolver {

    private static final Logger log = LoggerFactory.getLogger(RuleVersionResolver.class);

    private static final Comparator<RuleVersion> MOST_RECENT_FIRST =
            Comparator.comparing(RuleVersion::createdAt)
                    .thenComparingLong(RuleVersion::monotonicVersion)
                    .thenComparing(RuleVersion::id)
                    .reversed();

    private final RuleVersionProvider provider;

    public RuleVersionResolver(RuleVersionProvider provider) {
        this.provider = provider;
    }

    /**
     * Resolve against the versions supplied by the provider.
     */
    public ResolutionResult resolve(String ruleSetId, LocalDate asOf) {
        return resolve(ruleSetId, asOf, provider.publishedVersions(ruleSetId));
    }

    /**
     * Resolve against already-loaded versions. Pure: no provider access.
     *
     * @param ruleSetId Rule set
     * @param asOf      Evaluation date
     * @param versions  Versions of the rule set; unpublished ones are ignored
     * @return Resolved version, or the reason none applies
     */
    public static ResolutionResult resolve(String ruleSetId, LocalDate asOf, Collection<RuleVersion> versions) {
        List<RuleVersion> candidates = versions.stream()
                .filter(RuleVersion::published)
                .filter(version -> ruleSetId.equals(version.ruleSetId()))
                .filter(version -> version.isEffectiveOn(asOf))
                .sorted(MOST_RECENT_FIRST)
                .toList();

        if (candidates.isEmpty()) {
            log.debug("No active rule version for {} on {}", ruleSetId, asOf);
            return ResolutionResult.noActiveVersion(ruleSetId, asOf);
        }

        RuleVersion selected = candidates.get(0);
        if (candidates.size() == 1) {
            return ResolutionResult.resolved(ruleSetId, asOf, selected, List.of());
        }

        String ids = candidates.stream().map(RuleVersion::id).collect(Collectors.joining(", "));
        String warning = "Multiple published rule versions of '" + ruleSetId + "' are effective on " + asOf
                + " (" + ids + "); using most recently created " + selected.id();
        log.warn("Rule version integrity problem: {}", warning);
        return ResolutionResult.resolved(ruleSetId, asOf, selected, List.of(warning));
    }
}
