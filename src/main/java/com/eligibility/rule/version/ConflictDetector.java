package com.eligibility.rule.version;

import com.eligibility.rule.DateRange;
import com.eligibility.rule.RuleVersion;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Authoring-time checks on the effective ranges of a rule set.
 * <p>
 * Ranges are compared in half-open form, {@code [from, to + 1 day)}, with an
 * open end treated as +infinity. Any conflict with a published version must
 * block publishing, which keeps resolution down to a single candidate.
 */
public class ConflictDetector {

    private final RuleVersionStore store;

    public ConflictDetector(RuleVersionStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * Classify how {@code subject} relates to {@code other}.
     * {@code classify(a, b)} is always {@code classify(b, a).inverse()}.
     */
    public static ConflictType classify(DateRange subject, DateRange other) {
        if (!subject.intersects(other)) {
            return ConflictType.NO_CONFLICT;
        }
        if (subject.equals(other)) {
            return ConflictType.OVERLAP;
        }
        if (subject.encloses(other)) {
            return ConflictType.CONTAINS;
        }
        if (other.encloses(subject)) {
            return ConflictType.CONTAINED_BY;
        }
        return ConflictType.OVERLAP;
    }

    /**
     * Published versions of the rule set whose range intersects the proposed one.
     * Any result blocks publishing; draft overlaps are not reported.
     *
     * @param ruleSetId     Rule set
     * @param effectiveFrom Proposed first day
     * @param effectiveTo   Proposed last day, or null when open-ended
     * @return Conflicts, each typed from the proposed range's point of view
     */
    public List<Conflict> detectConflicts(String ruleSetId, LocalDate effectiveFrom, LocalDate effectiveTo) {
        return detectConflicts(ruleSetId, new DateRange(effectiveFrom, effectiveTo), null);
    }

    /**
     * As {@link #detectConflicts(String, LocalDate, LocalDate)}, ignoring one version (usually the one being published).
     */
    public List<Conflict> detectConflicts(String ruleSetId, DateRange proposed, String excludeVersionId) {
        return findConflicts(store.findByRuleSet(ruleSetId), proposed, excludeVersionId).stream()
                .filter(Conflict::published)
                .toList();
    }

    static List<Conflict> findConflicts(Collection<RuleVersion> versions, DateRange proposed, String excludeVersionId) {
        List<Conflict> conflicts = new ArrayList<>();
        for (RuleVersion version : versions) {
            if (version.id().equals(excludeVersionId)) {
                continue;
            }
            ConflictType type = classify(proposed, version.effectiveRange());
            if (type.isConflict()) {
                conflicts.add(new Conflict(version.id(), version.effectiveRange(), version.published(), type));
            }
        }
        return conflicts;
    }

    /**
     * Conflicts among the published versions of one collection, each pair reported once.
     */
    public static List<Conflict> publishedConflicts(Collection<RuleVersion> versions) {
        List<RuleVersion> published = versions.stream().filter(RuleVersion::published).toList();
        List<Conflict> conflicts = new ArrayList<>();
        for (int i = 0; i < published.size(); i++) {
            for (int j = i + 1; j < published.size(); j++) {
                RuleVersion later = published.get(j);
                RuleVersion earlier = published.get(i);
                ConflictType type = classify(later.effectiveRange(), earlier.effectiveRange());
                if (type.isConflict()) {
                    conflicts.add(new Conflict(earlier.id(), earlier.effectiveRange(), true, type));
                }
            }
        }
        return conflicts;
    }

    /**
     * Date sub-ranges not covered by any published version, from the earliest
     * published start onwards. Ends with an open-ended gap when the last
     * coverage is bounded.
     *
     * @return Gaps in date order; empty when nothing is published
     */
    public List<DateRange> gapAnalysis(String ruleSetId) {
        List<DateRange> ranges = publishedRanges(ruleSetId);
        if (ranges.isEmpty()) {
            return List.of();
        }
        return gaps(ranges, ranges.get(0).from(), null);
    }

    /**
     * Gaps, overlaps and coverage of a bounded window.
     *
     * @param windowFrom First day of the window
     * @param windowTo   Last day of the window (inclusive)
     */
    public CoverageReport coverageReport(String ruleSetId, LocalDate windowFrom, LocalDate windowTo) {
        DateRange window = new DateRange(windowFrom, Objects.requireNonNull(windowTo, "windowTo"));
        List<DateRange> ranges = publishedRanges(ruleSetId);
        List<DateRange> gaps = gaps(ranges, windowFrom, windowTo);

        long totalDays = ChronoUnit.DAYS.between(windowFrom, windowTo) + 1;
        long gapDays = gaps.stream().mapToLong(gap -> ChronoUnit.DAYS.between(gap.from(), gap.to()) + 1).sum();
        double percentage = BigDecimal.valueOf((totalDays - gapDays) * 100.0 / totalDays)
                .setScale(2, RoundingMode.HALF_UP)
                .doubleValue();

        return new CoverageReport(window, gaps, overlaps(ruleSetId, window), percentage);
    }

    private List<DateRange> publishedRanges(String ruleSetId) {
        return store.findByRuleSet(ruleSetId).stream()
                .filter(RuleVersion::published)
                .map(RuleVersion::effectiveRange)
                .sorted(Comparator.comparing(DateRange::from))
                .toList();
    }

    /**
     * Uncovered sub-ranges of {@code [windowFrom, windowTo]}; a null windowTo is +infinity.
     */
    private static List<DateRange> gaps(List<DateRange> sortedRanges, LocalDate windowFrom, LocalDate windowTo) {
        List<DateRange> gaps = new ArrayList<>();
        // first day not yet known to be covered; null once coverage is open-ended
        LocalDate cursor = windowFrom;

        for (DateRange range : sortedRanges) {
            if (cursor == null || (windowTo != null && cursor.isAfter(windowTo))) {
                break;
            }
            if (windowTo != null && range.from().isAfter(windowTo)) {
                break;
            }
            if (range.to() != null && range.to().isBefore(cursor)) {
                continue;
            }
            if (range.from().isAfter(cursor)) {
                gaps.add(new DateRange(cursor, range.from().minusDays(1)));
            }
            LocalDate end = range.exclusiveEnd();
            cursor = end == null ? null : (end.isAfter(cursor) ? end : cursor);
        }

        if (cursor != null && (windowTo == null || !cursor.isAfter(windowTo))) {
            gaps.add(new DateRange(cursor, windowTo));
        }
        return gaps;
    }

    private List<CoverageReport.Overlap> overlaps(String ruleSetId, DateRange window) {
        List<RuleVersion> published = store.findByRuleSet(ruleSetId).stream()
                .filter(RuleVersion::published)
                .filter(version -> version.effectiveRange().intersects(window))
                .sorted(Comparator.comparing(RuleVersion::effectiveFrom))
                .toList();

        List<CoverageReport.Overlap> overlaps = new ArrayList<>();
        LocalDate coveredUntil = null; // exclusive; meaningful once something was seen
        boolean seen = false;
        boolean openEnded = false;

        for (RuleVersion version : published) {
            DateRange range = version.effectiveRange();
            if (seen && (openEnded || range.from().isBefore(coveredUntil))) {
                LocalDate overlapEnd = openEnded ? range.to() : earlier(coveredUntil.minusDays(1), range.to());
                overlaps.add(new CoverageReport.Overlap(clip(new DateRange(range.from(), overlapEnd), window), version.id()));
            }
            seen = true;
            if (range.isOpenEnded()) {
                openEnded = true;
            } else if (!openEnded && (coveredUntil == null || range.exclusiveEnd().isAfter(coveredUntil))) {
                coveredUntil = range.exclusiveEnd();
            }
        }
        return overlaps;
    }

    private static LocalDate earlier(LocalDate a, LocalDate b) {
        if (b == null) {
            return a;
        }
        return a.isBefore(b) ? a : b;
    }

    private static DateRange clip(DateRange range, DateRange window) {
        LocalDate from = range.from().isBefore(window.from()) ? window.from() : range.from();
        LocalDate to = earlier(window.to(), range.to());
        return new DateRange(from, to);
    }
}
