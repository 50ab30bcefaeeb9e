package com.eligibility.core;

import com.eligibility.policy.AiVerdict;

/**
 * External AI reasoning call. Implementations may be slow or fail; the
 * engine bounds the call with a timeout and maps failures to
 * {@link AiVerdict#unavailable(String)}.
 */
@FunctionalInterface
public interface AiReasoningProvider {

    AiVerdict evaluate(String caseId, String ruleSetId);
}
