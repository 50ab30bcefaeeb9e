package com.eligibility.policy;

import com.eligibility.expression.RequirementOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Folds per-requirement outcomes into one confidence score and verdict.
 * <p>
 * Verdict precedence:
 * <ol>
 *   <li>no requirements: {@code not_eligible}, fail-closed</li>
 *   <li>a mandatory requirement failed: {@code not_eligible}</li>
 *   <li>a mandatory requirement is missing facts or errored: {@code requires_review}</li>
 *   <li>nothing evaluable: {@code not_eligible}</li>
 *   <li>confidence thresholds</li>
 * </ol>
 */
public class ResultAggregator {

    private static final Logger log = LoggerFactory.getLogger(ResultAggregator.class);

    static final String NO_REQUIREMENTS = "no requirements defined";
    static final String NO_EVALUABLE_REQUIREMENTS = "no evaluable requirements";

    private final DecisionThresholds thresholds;

    public ResultAggregator() {
        this(DecisionThresholds.defaults());
    }

    public ResultAggregator(DecisionThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public AggregateResult aggregate(List<RequirementResult> results) {
        return aggregate(results, List.of());
    }

    /**
     * @param results          Per-requirement results in evaluation order
     * @param upstreamWarnings Warnings raised before evaluation (e.g. during version resolution)
     */
    public AggregateResult aggregate(List<RequirementResult> results, List<String> upstreamWarnings) {
        List<String> warnings = new ArrayList<>(upstreamWarnings);
        Set<String> missingFacts = new LinkedHashSet<>();
        Set<String> mandatoryMissingFacts = new LinkedHashSet<>();
        int passed = 0;
        int failed = 0;
        int missing = 0;
        int errors = 0;
        boolean mandatoryFailed = false;
        boolean mandatoryIncomplete = false;

        for (RequirementResult result : results) {
            RequirementOutcome outcome = result.outcome();
            switch (outcome.status()) {
                case PASSED -> passed++;
                case FAILED -> {
                    failed++;
                    mandatoryFailed |= result.isMandatory();
                }
                case MISSING_FACTS -> {
                    missing++;
                    missingFacts.addAll(outcome.missingFacts());
                    if (result.isMandatory()) {
                        mandatoryMissingFacts.addAll(outcome.missingFacts());
                        mandatoryIncomplete = true;
                    }
                }
                case ERROR -> {
                    errors++;
                    mandatoryIncomplete |= result.isMandatory();
                    warnings.add("Requirement " + result.requirement().code() + " could not be evaluated ("
                            + outcome.errorKind().label() + "): " + String.join("; ", outcome.messages()));
                }
            }
        }

        int evaluable = passed + failed;
        double confidence = evaluable == 0 ? 0.0 : (double) passed / evaluable;

        Outcome verdict;
        if (results.isEmpty()) {
            warnings.add(NO_REQUIREMENTS);
            verdict = Outcome.NOT_ELIGIBLE;
        } else {
            if (evaluable == 0) {
                warnings.add(NO_EVALUABLE_REQUIREMENTS);
            }
            if (mandatoryFailed) {
                verdict = Outcome.NOT_ELIGIBLE;
            } else if (mandatoryIncomplete) {
                verdict = Outcome.REQUIRES_REVIEW;
            } else if (evaluable == 0) {
                verdict = Outcome.NOT_ELIGIBLE;
            } else {
                verdict = byConfidence(confidence);
            }
        }

        log.debug("Aggregated {} requirements: passed={}, failed={}, missing={}, errors={} -> {} ({})",
                results.size(), passed, failed, missing, errors, verdict.label(), confidence);

        return new AggregateResult(verdict, confidence, passed, failed, missing, errors,
                List.copyOf(missingFacts), List.copyOf(mandatoryMissingFacts), warnings, results);
    }

    private Outcome byConfidence(double confidence) {
        if (confidence >= thresholds.eligibleThreshold()) {
            return Outcome.ELIGIBLE;
        }
        if (confidence <= thresholds.notEligibleThreshold()) {
            return Outcome.NOT_ELIGIBLE;
        }
        return Outcome.REQUIRES_REVIEW;
    }

    public DecisionThresholds getThresholds() {
        return thresholds;
    }
}
