package com.warewise.model;

/**
 * A rule definition is misconfigured (a parameter of the wrong type or out of range).
 * Unlike data or configuration gaps this propagates to the caller.
 */
public class RuleContractViolationException extends RuntimeException {

    public RuleContractViolationException(String message) {
        super(message);
    }

    public RuleContractViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
