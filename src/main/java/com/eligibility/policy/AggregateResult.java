package com.eligibility.policy;

import java.util.List;

/**
 * Deterministic verdict for one rule version and fact set.
 *
 * @param outcome               Verdict
 * @param confidence            Passed share of evaluable requirements, in [0, 1]
 * @param passed                Requirements that passed
 * @param failed                Requirements that failed
 * @param missing               Requirements lacking facts
 * @param errors                Requirements that could not be evaluated
 * @param missingFacts          Missing fact keys across all requirements, first-seen order
 * @param mandatoryMissingFacts Missing fact keys of mandatory requirements
 * @param warnings              Non-fatal anomalies
 * @param results               Per-requirement results in evaluation order
 */
public record AggregateResult(
        Outcome outcome,
        double confidence,
        int passed,
        int failed,
        int missing,
        int errors,
        List<String> missingFacts,
        List<String> mandatoryMissingFacts,
        List<String> warnings,
        List<RequirementResult> results
) {
    public AggregateResult {
        missingFacts = List.copyOf(missingFacts);
        mandatoryMissingFacts = List.copyOf(mandatoryMissingFacts);
        warnings = List.copyOf(warnings);
        results = List.copyOf(results);
    }

    public int total() {
        return passed + failed + missing + errors;
    }

    public int evaluable() {
        return passed + failed;
    }
}
