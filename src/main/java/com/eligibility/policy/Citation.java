package com.eligibility.policy;

/**
 * Source passage an AI verdict relies on.
 *
 * @param documentVersionId Cited document version
 * @param excerpt           Quoted passage
 * @param relevanceScore    Retrieval relevance in [0, 1], or null when unknown
 */
public record Citation(String documentVersionId, String excerpt, Double relevanceScore) {
}
