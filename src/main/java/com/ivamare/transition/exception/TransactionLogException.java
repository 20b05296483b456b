package com.ivamare.transition.exception;

/**
 * Raised when a transition attempt could not be written to the transaction log.
 *
 * <p>The coordinator never catches this exception; it always reaches the caller.
 */
public class TransactionLogException extends TransitionEngineException {

    private final String entityType;
    private final String entityId;

    public TransactionLogException(String entityType, String entityId, Throwable cause) {
        super("Failed to append transition attempt for " + entityType + "/" + entityId, cause);
        this.entityType = entityType;
        this.entityId = entityId;
    }

    public String getEntityType() {
        return entityType;
    }

    public String getEntityId() {
        return entityId;
    }
}
