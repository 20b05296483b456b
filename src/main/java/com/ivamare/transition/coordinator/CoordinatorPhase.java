package com.ivamare.transition.coordinator;

/**
 * Phases of a single coordinator invocation.
 *
 * <pre>
 * single entity:  STARTED -> VALIDATING -> REJECTED
 *                                       -> EXECUTING -> SUCCEEDED | FAILED
 * distributed:    STARTED -> EXECUTING -> COMPENSATING -> SUCCEEDED | FAILED
 * </pre>
 */
public enum CoordinatorPhase {
    STARTED,
    VALIDATING,
    REJECTED,
    EXECUTING,
    COMPENSATING,
    SUCCEEDED,
    FAILED;

    public boolean isTerminal() {
        return this == REJECTED || this == SUCCEEDED || this == FAILED;
    }
}
