package com.eligibility.policy;

import java.util.Locale;

/**
 * Why a combined result was routed to a human reviewer.
 */
public enum EscalationReason {
    LOW_CONFIDENCE,
    RULE_AI_CONFLICT,
    MISSING_MANDATORY_FACTS,
    NO_ACTIVE_RULE_VERSION,
    RULES_UNAVAILABLE,
    FACTS_UNAVAILABLE;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
