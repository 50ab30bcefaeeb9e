package com.eligibility.expression.ast;

import com.eligibility.expression.EvaluationErrorKind;

/**
 * Raised by expression nodes when evaluation cannot complete.
 * Never escapes {@link com.eligibility.expression.ExpressionEvaluator}; it is
 * folded into an error outcome there.
 */
public class EvaluationException extends RuntimeException {

    private final EvaluationErrorKind kind;

    public EvaluationException(EvaluationErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public EvaluationErrorKind getKind() {
        return kind;
    }
}
