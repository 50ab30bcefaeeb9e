package com.eligibility.policy;

import com.eligibility.expression.EvaluationErrorKind;
import com.eligibility.expression.RequirementOutcome;
import com.eligibility.rule.Requirement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ResultAggregator.
 */
class ResultAggregatorTest {

    private ResultAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = new ResultAggregator();
    }

    private static RequirementResult passed(String code, boolean mandatory) {
        return result(code, mandatory, RequirementOutcome.passed(List.of()));
    }

    private static RequirementResult failed(String code, boolean mandatory) {
        return result(code, mandatory, RequirementOutcome.failed(List.of()));
    }

    private static RequirementResult missing(String code, boolean mandatory, String... facts) {
        return result(code, mandatory, RequirementOutcome.missingFacts(List.of(facts), List.of(facts)));
    }

    private static RequirementResult error(String code, boolean mandatory) {
        return result(code, mandatory, RequirementOutcome.error(List.of("years_employed"),
                EvaluationErrorKind.DIVISION_BY_ZERO, "Operator '/' divided by zero"));
    }

    private static RequirementResult result(String code, boolean mandatory, RequirementOutcome outcome) {
        return new RequirementResult(new Requirement(code, code, true, mandatory), outcome);
    }

    @Test
    @DisplayName("No requirements should be not eligible with a warning")
    void shouldRejectEmptyRuleVersion() {
        AggregateResult result = aggregator.aggregate(List.of());

        assertEquals(Outcome.NOT_ELIGIBLE, result.outcome());
        assertEquals(0.0, result.confidence());
        assertEquals(List.of(ResultAggregator.NO_REQUIREMENTS), result.warnings());
    }

    @Test
    @DisplayName("All passing requirements should be eligible with full confidence")
    void shouldBeEligibleWhenAllPass() {
        AggregateResult result = aggregator.aggregate(List.of(passed("MIN_SALARY", true), passed("PASSPORT", true)));

        assertEquals(Outcome.ELIGIBLE, result.outcome());
        assertEquals(1.0, result.confidence());
        assertEquals(2, result.passed());
        assertEquals(2, result.total());
    }

    @Test
    @DisplayName("A missing mandatory fact should require review")
    void shouldRequireReviewForMissingMandatoryFact() {
        AggregateResult result = aggregator.aggregate(List.of(
                passed("MIN_SALARY", true),
                missing("PASSPORT", true, "has_valid_passport")));

        assertEquals(Outcome.REQUIRES_REVIEW, result.outcome());
        assertEquals(1.0, result.confidence());
        assertEquals(List.of("has_valid_passport"), result.missingFacts());
        assertEquals(List.of("has_valid_passport"), result.mandatoryMissingFacts());
        assertEquals(1, result.missing());
    }

    @Test
    @DisplayName("A mandatory evaluation error should require review with zero confidence")
    void shouldRequireReviewForMandatoryError() {
        AggregateResult result = aggregator.aggregate(List.of(error("TENURE", true)));

        assertEquals(Outcome.REQUIRES_REVIEW, result.outcome());
        assertEquals(0.0, result.confidence());
        assertEquals(1, result.errors());
        assertTrue(result.warnings().contains(ResultAggregator.NO_EVALUABLE_REQUIREMENTS));
        assertTrue(result.warnings().stream()
                .anyMatch(w -> w.startsWith("Requirement TENURE could not be evaluated (division_by_zero)")));
    }

    @Test
    @DisplayName("A failed mandatory requirement should dominate a high pass rate")
    void shouldRejectOnMandatoryFailure() {
        AggregateResult result = aggregator.aggregate(List.of(
                passed("A", false), passed("B", false), passed("C", false), passed("D", false),
                failed("MIN_SALARY", true)));

        assertEquals(Outcome.NOT_ELIGIBLE, result.outcome());
        assertEquals(0.8, result.confidence(), 1e-9);
    }

    @Test
    @DisplayName("A failed mandatory requirement should outrank missing mandatory facts")
    void shouldPreferFailureOverMissing() {
        AggregateResult result = aggregator.aggregate(List.of(
                failed("MIN_SALARY", true),
                missing("PASSPORT", true, "has_valid_passport")));

        assertEquals(Outcome.NOT_ELIGIBLE, result.outcome());
    }

    @ParameterizedTest
    @CsvSource({
            "4, 1, ELIGIBLE",
            "3, 2, REQUIRES_REVIEW",
            "2, 3, NOT_ELIGIBLE",
            "0, 5, NOT_ELIGIBLE"
    })
    @DisplayName("Optional requirements should be judged by confidence thresholds")
    void shouldApplyThresholds(int passedCount, int failedCount, Outcome expected) {
        List<RequirementResult> results = new ArrayList<>();
        for (int i = 0; i < passedCount; i++) {
            results.add(passed("P" + i, false));
        }
        for (int i = 0; i < failedCount; i++) {
            results.add(failed("F" + i, false));
        }

        AggregateResult result = aggregator.aggregate(results);

        assertEquals(expected, result.outcome());
        assertTrue(result.confidence() >= 0.0 && result.confidence() <= 1.0);
    }

    @Test
    @DisplayName("Only optional requirements with missing facts should be not eligible")
    void shouldRejectWhenNothingEvaluable() {
        AggregateResult result = aggregator.aggregate(List.of(missing("ENGLISH", false, "english_level")));

        assertEquals(Outcome.NOT_ELIGIBLE, result.outcome());
        assertEquals(0, result.evaluable());
        assertTrue(result.mandatoryMissingFacts().isEmpty());
        assertTrue(result.warnings().contains(ResultAggregator.NO_EVALUABLE_REQUIREMENTS));
    }

    @Test
    @DisplayName("Missing facts should be de-duplicated in first-seen order")
    void shouldMergeMissingFacts() {
        AggregateResult result = aggregator.aggregate(List.of(
                missing("A", false, "a", "b"),
                missing("B", true, "b", "c"),
                passed("C", false)));

        assertEquals(List.of("a", "b", "c"), result.missingFacts());
        assertEquals(List.of("b", "c"), result.mandatoryMissingFacts());
    }

    @Test
    @DisplayName("Upstream warnings should come first")
    void shouldKeepUpstreamWarnings() {
        AggregateResult result = aggregator.aggregate(List.of(error("OPTIONAL", false), passed("A", true)),
                List.of("Multiple published rule versions"));

        assertEquals("Multiple published rule versions", result.warnings().get(0));
        assertEquals(2, result.warnings().size());
        assertEquals(Outcome.ELIGIBLE, result.outcome());
    }

    @Test
    @DisplayName("Custom thresholds should move the decision boundaries")
    void shouldHonourCustomThresholds() {
        ResultAggregator strict = new ResultAggregator(new DecisionThresholds(0.95, 0.5, 0.6, 0.6, 0.4));

        AggregateResult result = strict.aggregate(List.of(
                passed("A", false), passed("B", false), passed("C", false), passed("D", false),
                failed("E", false)));

        assertEquals(Outcome.REQUIRES_REVIEW, result.outcome());
        assertEquals(0.95, strict.getThresholds().eligibleThreshold());
    }
}
