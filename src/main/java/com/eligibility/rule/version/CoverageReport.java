package com.eligibility.rule.version;

import com.eligibility.rule.DateRange;

import java.util.List;

/**
 * Coverage of a bounded window by the published versions of a rule set.
 *
 * @param window             Analysed window
 * @param gaps               Sub-ranges covered by no published version
 * @param overlaps           Sub-ranges covered by more than one published version
 * @param coveragePercentage Share of the window's days that are covered, 0 to 100, two decimals
 */
public record CoverageReport(DateRange window, List<DateRange> gaps, List<Overlap> overlaps, double coveragePercentage) {

    public CoverageReport {
        gaps = List.copyOf(gaps);
        overlaps = List.copyOf(overlaps);
    }

    public boolean isComplete() {
        return gaps.isEmpty() && overlaps.isEmpty();
    }

    /**
     * @param range     Doubly covered days
     * @param versionId The later-starting version that causes the overlap
     */
    public record Overlap(DateRange range, String versionId) {
    }
}
