package com.eligibility.exception;

/**
 * Exception thrown when a text condition cannot be compiled.
 */
public class InvalidExpressionException extends EligibilityException {

    private final int position;

    public InvalidExpressionException(String message, int position) {
        super(message);
        this.position = position;
    }

    /**
     * Character offset in the source text where compilation failed.
     */
    public int getPosition() {
        return position;
    }
}
