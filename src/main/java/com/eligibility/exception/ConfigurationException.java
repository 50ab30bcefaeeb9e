package com.eligibility.exception;

/**
 * Exception thrown when the rule catalogue or engine settings are invalid.
 * Results in fail-fast at startup.
 */
public class ConfigurationException extends EligibilityException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
