package com.ivamare.transition.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Shared state of one distributed transaction.
 *
 * <p>Created by the coordinator, handed to the caller's operation and to the
 * compensating actions, and discarded when the invocation returns. Confined to the
 * invoking thread; not safe for concurrent use.
 */
public class DistributedTransactionContext {

    private final String correlationId;
    private final String transactionType;
    private final String fromState;
    private final String toState;
    private final Instant startedAt;
    private final List<ParticipantRef> participants = new ArrayList<>();
    private String result;

    public DistributedTransactionContext(
            String correlationId,
            String transactionType,
            String fromState,
            String toState) {
        this.correlationId = correlationId;
        this.transactionType = transactionType;
        this.fromState = fromState;
        this.toState = toState;
        this.startedAt = Instant.now();
    }

    public String correlationId() {
        return correlationId;
    }

    public String transactionType() {
        return transactionType;
    }

    public String fromState() {
        return fromState;
    }

    public String toState() {
        return toState;
    }

    public Instant startedAt() {
        return startedAt;
    }

    /**
     * Free-text progress written by participants (nullable).
     */
    public String result() {
        return result;
    }

    public void setResult(String result) {
        this.result = result;
    }

    /**
     * Append a line to the progress text.
     */
    public void appendResult(String line) {
        this.result = result == null || result.isEmpty() ? line : result + "\n" + line;
    }

    /**
     * Record an entity touched by this transaction.
     */
    public void addParticipant(String entityType, String entityId) {
        participants.add(new ParticipantRef(entityType, entityId));
    }

    public List<ParticipantRef> participants() {
        return Collections.unmodifiableList(participants);
    }

    /**
     * An entity taking part in a distributed transaction.
     *
     * @param entityType Entity type name
     * @param entityId Entity identifier
     */
    public record ParticipantRef(String entityType, String entityId) {

        @Override
        public String toString() {
            return entityType + "/" + entityId;
        }
    }
}
