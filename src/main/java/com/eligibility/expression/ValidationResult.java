package com.eligibility.expression;

import com.eligibility.expression.ast.Expression;
import com.eligibility.fact.ValueType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Outcome of structural validation.
 *
 * @param ok                  Whether the expression may be evaluated
 * @param variablesReferenced Variable names in first-use order
 * @param errors              Validation messages, each naming the offending path
 * @param expression          Compiled tree; null when not ok
 * @param usage               Type each variable's usage implies (variables without a hint are omitted)
 */
public record ValidationResult(
        boolean ok,
        Set<String> variablesReferenced,
        List<String> errors,
        Expression expression,
        Map<String, ValueType> usage
) {
    public ValidationResult {
        variablesReferenced = Collections.unmodifiableSet(new LinkedHashSet<>(variablesReferenced));
        errors = List.copyOf(errors);
        usage = Collections.unmodifiableMap(new LinkedHashMap<>(usage));
    }

    public static ValidationResult valid(Expression expression, Set<String> variables, Map<String, ValueType> usage) {
        return new ValidationResult(true, variables, List.of(), expression, usage);
    }

    public static ValidationResult invalid(List<String> errors, Set<String> variables) {
        return new ValidationResult(false, variables, errors, null, Map.of());
    }

    public static ValidationResult invalid(String error) {
        return invalid(List.of(error), Set.of());
    }

    /**
     * True when the expression references no facts and so evaluates to a fixed outcome.
     */
    public boolean isConstant() {
        return ok && variablesReferenced.isEmpty();
    }
}
