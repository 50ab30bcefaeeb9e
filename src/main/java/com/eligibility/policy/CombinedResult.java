package com.eligibility.policy;

import java.util.List;

/**
 * Final decision for one evaluation request. Immutable; a re-evaluation
 * produces a new result.
 *
 * @param outcome           Final verdict
 * @param confidence        Final confidence in [0, 1]
 * @param conflictDetected  Whether the rule and AI verdicts disagree on eligibility
 * @param requiresReview    Whether a human must finalise the case
 * @param escalationReasons Triggers that fired, in declaration order
 * @param reasoningSummary  One-line explanation
 * @param aggregate         Rule verdict, or null when no rule version applied
 * @param aiVerdict         AI verdict, or null when it was never requested
 */
public record CombinedResult(
        Outcome outcome,
        double confidence,
        boolean conflictDetected,
        boolean requiresReview,
        List<EscalationReason> escalationReasons,
        String reasoningSummary,
        AggregateResult aggregate,
        AiVerdict aiVerdict
) {
    public CombinedResult {
        escalationReasons = List.copyOf(escalationReasons);
    }

    /**
     * Result for an evaluation that could not produce a rule verdict at all.
     */
    public static CombinedResult fatal(EscalationReason reason, String explanation) {
        return new CombinedResult(Outcome.REQUIRES_REVIEW, 0.0, false, true,
                List.of(reason), explanation, null, null);
    }

    public boolean isFatal() {
        return aggregate == null;
    }
}
