package com.eligibility.fact;

/**
 * Provenance of a fact.
 */
public enum FactSource {
    USER,
    AI,
    REVIEWER
}
