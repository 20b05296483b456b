package com.ivamare.transition.model;

/**
 * Stable error codes returned in a failed {@link TransactionResult}.
 */
public enum TransactionErrorCode {

    /** The from-state to to-state edge is not permitted for the entity type */
    INVALID_TRANSITION("InvalidTransition"),

    /** Entity type or a state name was blank */
    INVALID_REQUEST("InvalidRequest"),

    /** The wrapped operation threw */
    OPERATION_FAILED("OperationFailed"),

    /** The storage collaborator detected a concurrent update of the entity */
    CONCURRENT_MODIFICATION("ConcurrentModification"),

    /** The calling thread was interrupted or the operation was cancelled */
    CANCELLED("Cancelled");

    private final String code;

    TransactionErrorCode(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
