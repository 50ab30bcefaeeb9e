package com.eligibility.policy;

import java.util.Locale;

/**
 * Coarse eligibility verdict, ordered from least to most restrictive.
 */
public enum Outcome {
    ELIGIBLE("eligible"),
    REQUIRES_REVIEW("requires_review"),
    NOT_ELIGIBLE("not_eligible");

    private final String label;

    Outcome(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public int restrictiveness() {
        return ordinal();
    }

    public boolean isMoreRestrictiveThan(Outcome other) {
        return restrictiveness() > other.restrictiveness();
    }

    public static Outcome mostRestrictive(Outcome a, Outcome b) {
        return a.isMoreRestrictiveThan(b) ? a : b;
    }

    /**
     * Parse a verdict label. Accepts the engine vocabulary and the AI
     * vocabulary ({@code likely}, {@code possible}, {@code unlikely});
     * anything else needs a human.
     */
    public static Outcome fromLabel(String label) {
        if (label == null) {
            return REQUIRES_REVIEW;
        }
        return switch (label.trim().toLowerCase(Locale.ROOT).replace('-', '_')) {
            case "eligible", "likely" -> ELIGIBLE;
            case "not_eligible", "unlikely" -> NOT_ELIGIBLE;
            default -> REQUIRES_REVIEW;
        };
    }
}
