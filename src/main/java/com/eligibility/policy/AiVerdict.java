package com.eligibility.policy;

import java.util.List;
import java.util.Objects;

/**
 * Probabilistic verdict produced outside the engine.
 *
 * @param outcome    Verdict
 * @param confidence Confidence in [0, 1]
 * @param reasoning  Free-text reasoning
 * @param citations  Supporting citations
 * @param available  False when the verdict is a stand-in for a failed or timed-out call
 */
public record AiVerdict(Outcome outcome, double confidence, String reasoning, List<Citation> citations,
                        boolean available) {

    public AiVerdict {
        Objects.requireNonNull(outcome, "outcome");
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            throw new IllegalArgumentException("AI confidence must be within [0, 1], got " + confidence);
        }
        reasoning = reasoning == null ? "" : reasoning;
        citations = citations == null ? List.of() : List.copyOf(citations);
    }

    public static AiVerdict of(Outcome outcome, double confidence, String reasoning) {
        return new AiVerdict(outcome, confidence, reasoning, List.of(), true);
    }

    /**
     * Verdict from an AI label such as {@code likely} or {@code not_eligible}.
     */
    public static AiVerdict fromLabel(String label, double confidence, String reasoning, List<Citation> citations) {
        return new AiVerdict(Outcome.fromLabel(label), confidence, reasoning, citations, true);
    }

    /**
     * Stand-in for a failed AI call: needs review, zero confidence.
     */
    public static AiVerdict unavailable(String reason) {
        return new AiVerdict(Outcome.REQUIRES_REVIEW, 0.0, "AI reasoning unavailable: " + reason, List.of(), false);
    }
}
