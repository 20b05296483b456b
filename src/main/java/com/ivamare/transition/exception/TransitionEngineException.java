package com.ivamare.transition.exception;

/**
 * Base exception for all Transition Engine errors.
 */
public class TransitionEngineException extends RuntimeException {

    public TransitionEngineException(String message) {
        super(message);
    }

    public TransitionEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
