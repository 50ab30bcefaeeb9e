package com.eligibility.expression;

import java.util.Collection;
import java.util.List;

/**
 * Result of evaluating a single requirement expression.
 *
 * @param status              Passed, failed, missing facts or error
 * @param variablesReferenced Variable names the expression uses, in first-use order
 * @param missingFacts        Referenced variables absent from the fact set
 * @param errorKind           Error classification, only for {@link RequirementStatus#ERROR}
 * @param messages            Diagnostic messages (validator errors or evaluation failure)
 */
public record RequirementOutcome(
        RequirementStatus status,
        List<String> variablesReferenced,
        List<String> missingFacts,
        EvaluationErrorKind errorKind,
        List<String> messages
) {
    public RequirementOutcome {
        variablesReferenced = variablesReferenced == null ? List.of() : List.copyOf(variablesReferenced);
        missingFacts = missingFacts == null ? List.of() : List.copyOf(missingFacts);
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    public static RequirementOutcome passed(Collection<String> variables) {
        return new RequirementOutcome(RequirementStatus.PASSED, List.copyOf(variables), null, null, null);
    }

    public static RequirementOutcome failed(Collection<String> variables) {
        return new RequirementOutcome(RequirementStatus.FAILED, List.copyOf(variables), null, null, null);
    }

    public static RequirementOutcome missingFacts(Collection<String> variables, List<String> missing) {
        return new RequirementOutcome(RequirementStatus.MISSING_FACTS, List.copyOf(variables), missing, null, null);
    }

    public static RequirementOutcome error(Collection<String> variables, EvaluationErrorKind kind, String message) {
        return new RequirementOutcome(RequirementStatus.ERROR, List.copyOf(variables), null, kind, List.of(message));
    }

    public static RequirementOutcome invalid(Collection<String> variables, List<String> errors) {
        return new RequirementOutcome(RequirementStatus.ERROR, List.copyOf(variables), null,
                EvaluationErrorKind.INVALID_EXPRESSION, errors);
    }

    public boolean isPassed() {
        return status == RequirementStatus.PASSED;
    }

    public boolean isFailed() {
        return status == RequirementStatus.FAILED;
    }

    /**
     * True when no verdict could be produced (missing facts or error).
     */
    public boolean isIncomplete() {
        return !status.isEvaluable();
    }
}
