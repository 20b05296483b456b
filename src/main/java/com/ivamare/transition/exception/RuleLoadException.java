package com.ivamare.transition.exception;

/**
 * Thrown when a rule source cannot be read or contains malformed rules.
 */
public class RuleLoadException extends TransitionEngineException {

    public RuleLoadException(String message) {
        super(message);
    }

    public RuleLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
