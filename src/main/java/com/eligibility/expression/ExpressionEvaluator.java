package com.eligibility.expression;

import com.eligibility.expression.ast.EvaluationException;
import com.eligibility.fact.FactNormalizer;
import com.eligibility.fact.NormalizedFacts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates a requirement expression against a case's current facts.
 * <p>
 * In order:
 * <ol>
 *   <li>validate; a structural failure is an {@code error} outcome and nothing is evaluated</li>
 *   <li>any referenced variable absent from the facts gives a {@code missing_facts} outcome</li>
 *   <li>coerce the referenced facts to the types their usage implies</li>
 *   <li>evaluate the compiled tree; typed failures become {@code error} outcomes</li>
 *   <li>null, non-finite and non-boolean results are errors, never pass/fail</li>
 * </ol>
 * Stateless and thread-safe.
 */
public class ExpressionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ExpressionEvaluator.class);

    private final ExpressionValidator validator;
    private final FactNormalizer normalizer;

    public ExpressionEvaluator() {
        this(new ExpressionValidator(), new FactNormalizer());
    }

    public ExpressionEvaluator(ExpressionValidator validator, FactNormalizer normalizer) {
        this.validator = validator;
        this.normalizer = normalizer;
    }

    /**
     * Validate and evaluate a raw expression.
     *
     * @param expression Raw expression (Map, List or scalar)
     * @param facts      Current fact values
     * @return Requirement outcome
     */
    public RequirementOutcome evaluate(Object expression, NormalizedFacts facts) {
        return evaluate(validator.validate(expression), facts);
    }

    /**
     * Evaluate an already validated expression.
     *
     * @param validation Result of {@link ExpressionValidator#validate(Object)}
     * @param facts      Current fact values
     * @return Requirement outcome
     */
    public RequirementOutcome evaluate(ValidationResult validation, NormalizedFacts facts) {
        List<String> variables = List.copyOf(validation.variablesReferenced());
        if (!validation.ok()) {
            log.debug("Expression rejected by validator: {}", validation.errors());
            return RequirementOutcome.invalid(variables, validation.errors());
        }

        NormalizedFacts available = facts == null ? NormalizedFacts.empty() : facts;
        List<String> missing = new ArrayList<>();
        for (String variable : variables) {
            if (!available.contains(variable)) {
                missing.add(variable);
            }
        }
        if (!missing.isEmpty()) {
            return RequirementOutcome.missingFacts(variables, missing);
        }

        NormalizedFacts coerced = normalizer.coerce(available, validation.usage());
        Object result;
        try {
            result = validation.expression().evaluate(coerced);
        } catch (EvaluationException e) {
            log.debug("Evaluation of {} failed: {} ({})", validation.expression(), e.getMessage(), e.getKind());
            return RequirementOutcome.error(variables, e.getKind(), e.getMessage());
        }

        if (result == null) {
            return RequirementOutcome.error(variables, EvaluationErrorKind.NULL_RESULT,
                    "Condition could not be determined (expression evaluated to null)");
        }
        if (result instanceof Number n && !Double.isFinite(n.doubleValue())) {
            return RequirementOutcome.error(variables, EvaluationErrorKind.NON_FINITE_RESULT,
                    "Expression evaluated to a non-finite number: " + n);
        }
        if (result instanceof Boolean b) {
            return b ? RequirementOutcome.passed(variables) : RequirementOutcome.failed(variables);
        }
        return RequirementOutcome.error(variables, EvaluationErrorKind.TYPE_MISMATCH,
                "Expression must evaluate to a boolean, got " + result.getClass().getSimpleName() + " (" + result + ")");
    }

    public ExpressionValidator getValidator() {
        return validator;
    }

    public FactNormalizer getNormalizer() {
        return normalizer;
    }
}
