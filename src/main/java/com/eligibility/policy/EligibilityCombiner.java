package com.eligibility.policy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Fuses the rule verdict with the AI verdict.
 * <p>
 * The more restrictive outcome always wins, so eligibility is never granted
 * while either source disputes it. A conflict (one side eligible, the other
 * not eligible) takes the lower confidence; otherwise confidences are blended
 * with the configured weights. Review is required when confidence is below the
 * floor, on conflict, or when mandatory requirements lack facts; any one suffices.
 */
public class EligibilityCombiner {

    private static final Logger log = LoggerFactory.getLogger(EligibilityCombiner.class);

    private final DecisionThresholds thresholds;

    public EligibilityCombiner() {
        this(DecisionThresholds.defaults());
    }

    public EligibilityCombiner(DecisionThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public CombinedResult combine(AggregateResult aggregate, AiVerdict ai) {
        return combine(aggregate, ai, thresholds.confidenceFloor());
    }

    public CombinedResult combine(AggregateResult aggregate, AiVerdict ai, double confidenceFloor) {
        Outcome rule = aggregate.outcome();
        boolean conflict = isConflict(rule, ai.outcome());
        Outcome outcome = Outcome.mostRestrictive(rule, ai.outcome());

        double confidence = conflict
                ? Math.min(aggregate.confidence(), ai.confidence())
                : thresholds.ruleWeight() * aggregate.confidence() + thresholds.aiWeight() * ai.confidence();
        confidence = Math.max(0.0, Math.min(1.0, confidence));

        List<EscalationReason> reasons = new ArrayList<>();
        if (confidence < confidenceFloor) {
            reasons.add(EscalationReason.LOW_CONFIDENCE);
        }
        if (conflict) {
            reasons.add(EscalationReason.RULE_AI_CONFLICT);
        }
        if (!aggregate.mandatoryMissingFacts().isEmpty()) {
            reasons.add(EscalationReason.MISSING_MANDATORY_FACTS);
        }

        String summary = summarize(aggregate, ai, outcome, confidence, conflict, reasons, confidenceFloor);
        if (conflict) {
            log.warn("Rule engine outcome ({}) conflicts with AI outcome ({}); resolved to {}",
                    rule.label(), ai.outcome().label(), outcome.label());
        }
        return new CombinedResult(outcome, confidence, conflict, !reasons.isEmpty(), reasons, summary, aggregate, ai);
    }

    /**
     * Disagreement at the coarse eligible / not eligible level. {@code requires_review} is neutral.
     */
    public static boolean isConflict(Outcome rule, Outcome ai) {
        return rule == Outcome.ELIGIBLE && ai == Outcome.NOT_ELIGIBLE
                || rule == Outcome.NOT_ELIGIBLE && ai == Outcome.ELIGIBLE;
    }

    private static String summarize(AggregateResult aggregate, AiVerdict ai, Outcome outcome, double confidence,
                                    boolean conflict, List<EscalationReason> reasons, double floor) {
        StringBuilder sb = new StringBuilder();
        sb.append("Rule engine: ").append(aggregate.outcome().label())
                .append(" (").append(aggregate.passed()).append(" of ").append(aggregate.total())
                .append(" requirements passed, ").append(percent(aggregate.confidence())).append(")");
        if (ai.available()) {
            sb.append("; AI: ").append(ai.outcome().label()).append(" (").append(percent(ai.confidence())).append(")");
        } else {
            sb.append("; AI: unavailable");
        }
        if (conflict) {
            sb.append("; rule engine outcome (").append(aggregate.outcome().label())
                    .append(") conflicts with AI outcome (").append(ai.outcome().label()).append(")");
        }
        sb.append("; final: ").append(outcome.label()).append(" (").append(percent(confidence)).append(")");
        if (reasons.contains(EscalationReason.LOW_CONFIDENCE)) {
            sb.append("; confidence below threshold (").append(percent(confidence))
                    .append(" < ").append(percent(floor)).append(")");
        }
        if (!reasons.isEmpty()) {
            sb.append("; human review required: ")
                    .append(String.join(", ", reasons.stream().map(EscalationReason::label).toList()));
        }
        return sb.toString();
    }

    private static String percent(double value) {
        return String.format(Locale.ROOT, "%.0f%%", value * 100);
    }

    public DecisionThresholds getThresholds() {
        return thresholds;
    }
}
