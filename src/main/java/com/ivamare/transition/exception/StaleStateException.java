package com.ivamare.transition.exception;

/**
 * Thrown by a transactional operation when the entity it tried to update no longer
 * carries the version (or state) the caller observed.
 *
 * <p>The engine does not serialize concurrent transitions of the same entity. Storage
 * collaborators signal a lost race with this exception and the coordinator reports it
 * as {@code ConcurrentModification}.
 */
public class StaleStateException extends TransitionEngineException {

    private final String entityType;
    private final String entityId;
    private final Object expectedVersion;

    public StaleStateException(String entityType, String entityId, Object expectedVersion) {
        super("Entity " + entityType + "/" + entityId + " was modified concurrently (expected version "
            + expectedVersion + ")");
        this.entityType = entityType;
        this.entityId = entityId;
        this.expectedVersion = expectedVersion;
    }

    public String getEntityType() {
        return entityType;
    }

    public String getEntityId() {
        return entityId;
    }

    public Object getExpectedVersion() {
        return expectedVersion;
    }
}
