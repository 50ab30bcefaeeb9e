package com.eligibility.rule;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Effective date range of a rule version.
 * Both bounds are inclusive; a null {@code to} means open-ended.
 * Comparisons use the half-open form {@code [from, to + 1 day)}.
 *
 * @param from First effective day
 * @param to   Last effective day, or null
 */
public record DateRange(LocalDate from, LocalDate to) {

    public DateRange {
        Objects.requireNonNull(from, "from");
        if (to != null && to.isBefore(from)) {
            throw new IllegalArgumentException("Date range ends (" + to + ") before it starts (" + from + ")");
        }
    }

    public static DateRange of(LocalDate from, LocalDate to) {
        return new DateRange(from, to);
    }

    public static DateRange startingAt(LocalDate from) {
        return new DateRange(from, null);
    }

    public boolean isOpenEnded() {
        return to == null;
    }

    /**
     * Exclusive end of the half-open form, or null for +infinity.
     */
    public LocalDate exclusiveEnd() {
        return to == null ? null : to.plusDays(1);
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(from) && (to == null || !date.isAfter(to));
    }

    /**
     * Whether every day of {@code other} also lies in this range.
     */
    public boolean encloses(DateRange other) {
        return !other.from.isBefore(from) && endsNoEarlierThan(other);
    }

    public boolean intersects(DateRange other) {
        return (to == null || !to.isBefore(other.from)) && (other.to == null || !other.to.isBefore(from));
    }

    private boolean endsNoEarlierThan(DateRange other) {
        if (to == null) {
            return true;
        }
        return other.to != null && !to.isBefore(other.to);
    }

    @Override
    public String toString() {
        return "[" + from + ", " + (to == null ? "open" : to) + "]";
    }
}
