package com.eligibility.policy;

import com.eligibility.exception.ConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for EligibilityCombiner.
 */
class EligibilityCombinerTest {

    private EligibilityCombiner combiner;

    @BeforeEach
    void setUp() {
        combiner = new EligibilityCombiner();
    }

    private static AggregateResult aggregate(Outcome outcome, double confidence) {
        return aggregate(outcome, confidence, List.of());
    }

    private static AggregateResult aggregate(Outcome outcome, double confidence, List<String> mandatoryMissing) {
        return new AggregateResult(outcome, confidence, 1, 0, mandatoryMissing.isEmpty() ? 0 : 1, 0,
                mandatoryMissing, mandatoryMissing, List.of(), List.of());
    }

    @Test
    @DisplayName("A rule/AI disagreement should resolve to the restrictive side")
    void shouldResolveConflictConservatively() {
        CombinedResult result = combiner.combine(aggregate(Outcome.ELIGIBLE, 0.9),
                AiVerdict.of(Outcome.NOT_ELIGIBLE, 0.8, "Sponsor licence revoked"));

        assertEquals(Outcome.NOT_ELIGIBLE, result.outcome());
        assertTrue(result.conflictDetected());
        assertEquals(0.8, result.confidence(), 1e-9);
        assertTrue(result.requiresReview());
        assertTrue(result.escalationReasons().contains(EscalationReason.RULE_AI_CONFLICT));
        assertTrue(result.reasoningSummary().contains("conflicts with AI outcome"));
    }

    @Test
    @DisplayName("Agreeing outcomes should blend confidences by weight")
    void shouldBlendAgreeingConfidences() {
        CombinedResult result = combiner.combine(aggregate(Outcome.ELIGIBLE, 1.0),
                AiVerdict.of(Outcome.ELIGIBLE, 0.9, "All criteria met"));

        assertEquals(Outcome.ELIGIBLE, result.outcome());
        assertEquals(0.96, result.confidence(), 1e-9);
        assertFalse(result.conflictDetected());
        assertFalse(result.requiresReview());
        assertTrue(result.escalationReasons().isEmpty());
        assertFalse(result.isFatal());
    }

    @Test
    @DisplayName("Requires-review against eligible should not count as a conflict")
    void shouldTreatReviewAsNeutral() {
        CombinedResult result = combiner.combine(aggregate(Outcome.REQUIRES_REVIEW, 0.9),
                AiVerdict.of(Outcome.ELIGIBLE, 0.9, ""));

        assertEquals(Outcome.REQUIRES_REVIEW, result.outcome());
        assertFalse(result.conflictDetected());
        assertFalse(EligibilityCombiner.isConflict(Outcome.REQUIRES_REVIEW, Outcome.NOT_ELIGIBLE));
    }

    @Test
    @DisplayName("Confidence below the floor should escalate")
    void shouldEscalateLowConfidence() {
        CombinedResult result = combiner.combine(aggregate(Outcome.REQUIRES_REVIEW, 0.5),
                AiVerdict.of(Outcome.REQUIRES_REVIEW, 0.5, ""));

        assertEquals(List.of(EscalationReason.LOW_CONFIDENCE), result.escalationReasons());
        assertTrue(result.requiresReview());
    }

    @Test
    @DisplayName("A per-call floor should override the configured one")
    void shouldUseExplicitFloor() {
        AggregateResult rules = aggregate(Outcome.ELIGIBLE, 1.0);
        AiVerdict ai = AiVerdict.of(Outcome.ELIGIBLE, 0.9, "");

        assertFalse(combiner.combine(rules, ai).requiresReview());
        assertEquals(List.of(EscalationReason.LOW_CONFIDENCE), combiner.combine(rules, ai, 0.99).escalationReasons());
    }

    @Test
    @DisplayName("Missing mandatory facts should escalate")
    void shouldEscalateMissingMandatoryFacts() {
        CombinedResult result = combiner.combine(aggregate(Outcome.REQUIRES_REVIEW, 1.0, List.of("has_valid_passport")),
                AiVerdict.of(Outcome.ELIGIBLE, 0.9, ""));

        assertEquals(Outcome.REQUIRES_REVIEW, result.outcome());
        assertEquals(List.of(EscalationReason.MISSING_MANDATORY_FACTS), result.escalationReasons());
    }

    @Test
    @DisplayName("An unavailable AI verdict should keep an eligible rule verdict from passing through")
    void shouldNotTrustRulesAloneWhenAiUnavailable() {
        CombinedResult result = combiner.combine(aggregate(Outcome.ELIGIBLE, 1.0), AiVerdict.unavailable("timed out"));

        assertEquals(Outcome.REQUIRES_REVIEW, result.outcome());
        assertEquals(0.6, result.confidence(), 1e-9);
        assertFalse(result.aiVerdict().available());
        assertTrue(result.reasoningSummary().contains("AI: unavailable"));
    }

    static Stream<Arguments> outcomePairs() {
        return Arrays.stream(Outcome.values())
                .flatMap(rule -> Arrays.stream(Outcome.values()).map(ai -> Arguments.of(rule, ai)));
    }

    @ParameterizedTest
    @MethodSource("outcomePairs")
    @DisplayName("The combined outcome should never be less restrictive than either input")
    void shouldNeverLoosen(Outcome rule, Outcome ai) {
        CombinedResult result = combiner.combine(aggregate(rule, 0.7), AiVerdict.of(ai, 0.7, ""));

        assertFalse(rule.isMoreRestrictiveThan(result.outcome()));
        assertFalse(ai.isMoreRestrictiveThan(result.outcome()));
        if (rule == Outcome.NOT_ELIGIBLE || ai == Outcome.NOT_ELIGIBLE) {
            assertEquals(Outcome.NOT_ELIGIBLE, result.outcome());
        }
        boolean expectedConflict = rule != ai && rule != Outcome.REQUIRES_REVIEW && ai != Outcome.REQUIRES_REVIEW;
        assertEquals(expectedConflict, result.conflictDetected());
        assertTrue(result.confidence() >= 0.0 && result.confidence() <= 1.0);
    }

    @Test
    @DisplayName("AI labels should map onto outcomes")
    void shouldMapAiLabels() {
        assertEquals(Outcome.ELIGIBLE, Outcome.fromLabel("likely"));
        assertEquals(Outcome.NOT_ELIGIBLE, Outcome.fromLabel("Not-Eligible"));
        assertEquals(Outcome.REQUIRES_REVIEW, Outcome.fromLabel("unclear"));
        assertEquals(Outcome.REQUIRES_REVIEW, Outcome.fromLabel(null));
        assertThrows(IllegalArgumentException.class, () -> AiVerdict.of(Outcome.ELIGIBLE, 1.2, ""));
    }

    @Test
    @DisplayName("AI citations should be carried through to the combined result")
    void shouldKeepCitations() {
        Citation citation = new Citation("guidance-2024-v3", "Salary must be at least 38,700 GBP", 0.92);
        AiVerdict ai = AiVerdict.fromLabel("unlikely", 0.7, "Salary below threshold", List.of(citation));

        CombinedResult result = combiner.combine(aggregate(Outcome.NOT_ELIGIBLE, 0.5), ai);

        assertEquals(Outcome.NOT_ELIGIBLE, ai.outcome());
        assertEquals(List.of(citation), result.aiVerdict().citations());
        assertEquals(0.6 * 0.5 + 0.4 * 0.7, result.confidence(), 1e-9);
    }

    @Test
    @DisplayName("Thresholds should reject weights that do not sum to one")
    void shouldValidateThresholds() {
        assertThrows(ConfigurationException.class, () -> new DecisionThresholds(0.8, 0.4, 0.6, 0.5, 0.4));
        assertThrows(ConfigurationException.class, () -> new DecisionThresholds(0.4, 0.8, 0.6, 0.6, 0.4));
        assertThrows(ConfigurationException.class, () -> new DecisionThresholds(1.1, 0.4, 0.6, 0.6, 0.4));
        assertDoesNotThrow(DecisionThresholds::defaults);
    }
}
