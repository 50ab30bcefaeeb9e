package com.eligibility.policy;

import com.eligibility.exception.ConfigurationException;

/**
 * Numeric decision policy.
 *
 * @param eligibleThreshold    Aggregate confidence at or above which the verdict is eligible
 * @param notEligibleThreshold Aggregate confidence at or below which the verdict is not eligible
 * @param confidenceFloor      Combined confidence below which a case is escalated
 * @param ruleWeight           Weight of the rule verdict's confidence when sources agree
 * @param aiWeight             Weight of the AI verdict's confidence when sources agree
 */
public record DecisionThresholds(
        double eligibleThreshold,
        double notEligibleThreshold,
        double confidenceFloor,
        double ruleWeight,
        double aiWeight
) {
    private static final double WEIGHT_TOLERANCE = 1e-9;

    public DecisionThresholds {
        checkUnit("eligible-threshold", eligibleThreshold);
        checkUnit("not-eligible-threshold", notEligibleThreshold);
        checkUnit("confidence-floor", confidenceFloor);
        checkUnit("rule-weight", ruleWeight);
        checkUnit("ai-weight", aiWeight);
        if (notEligibleThreshold >= eligibleThreshold) {
            throw new ConfigurationException("not-eligible-threshold (" + notEligibleThreshold
                    + ") must be below eligible-threshold (" + eligibleThreshold + ")");
        }
        if (Math.abs(ruleWeight + aiWeight - 1.0) > WEIGHT_TOLERANCE) {
            throw new ConfigurationException("rule-weight and ai-weight must sum to 1.0, got "
                    + ruleWeight + " + " + aiWeight);
        }
    }

    public static DecisionThresholds defaults() {
        return new DecisionThresholds(0.8, 0.4, 0.6, 0.6, 0.4);
    }

    private static void checkUnit(String name, double value) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new ConfigurationException(name + " must be within [0, 1], got " + value);
        }
    }
}
