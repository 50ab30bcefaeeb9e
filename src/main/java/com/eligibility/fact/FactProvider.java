package com.eligibility.fact;

import java.util.Collection;

/**
 * Read-only source of case facts, supplied by the orchestration layer.
 * Returns the full fact history; picking the current fact per key is done by
 * {@link FactNormalizer}.
 */
@FunctionalInterface
public interface FactProvider {

    /**
     * @param caseId Case identifier
     * @return All facts recorded for the case, in insertion order
     */
    Collection<Fact> currentFacts(String caseId);
}
