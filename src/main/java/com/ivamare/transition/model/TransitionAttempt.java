package com.ivamare.transition.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One logged transition attempt. Never mutated after creation.
 *
 * @param id Identifier assigned by the transaction log (null before append)
 * @param entityType Entity type name
 * @param entityId Entity identifier
 * @param fromState State the caller observed
 * @param toState Requested state
 * @param userId Acting user
 * @param username Acting user's display name (nullable)
 * @param timestamp When the attempt finished
 * @param success Whether the transition was committed
 * @param failureReason Why it failed (present iff not successful)
 * @param metadata Free-form key/value context (unmodifiable, never null)
 * @param durationMs Wall-clock duration in milliseconds (nullable)
 * @param transactionId Correlation id grouping multi-step work (nullable)
 */
public record TransitionAttempt(
    Long id,
    String entityType,
    String entityId,
    String fromState,
    String toState,
    String userId,
    String username,
    Instant timestamp,
    boolean success,
    String failureReason,
    Map<String, Object> metadata,
    Long durationMs,
    String transactionId
) {

    public TransitionAttempt {
        if (success && failureReason != null) {
            throw new IllegalArgumentException("Successful attempt cannot carry a failure reason");
        }
        if (!success && (failureReason == null || failureReason.isBlank())) {
            throw new IllegalArgumentException("Failed attempt requires a failure reason");
        }
        metadata = metadata == null || metadata.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Create an attempt for a committed transition.
     */
    public static TransitionAttempt succeeded(
            String entityType,
            String entityId,
            String fromState,
            String toState,
            Actor actor,
            Map<String, Object> metadata,
            long durationMs,
            String transactionId) {
        return new TransitionAttempt(
            null, entityType, entityId, fromState, toState,
            actor.userId(), actor.username(), Instant.now(),
            true, null, metadata, durationMs, transactionId
        );
    }

    /**
     * Create an attempt for a rejected or failed transition.
     */
    public static TransitionAttempt failed(
            String entityType,
            String entityId,
            String fromState,
            String toState,
            Actor actor,
            String failureReason,
            Map<String, Object> metadata,
            long durationMs,
            String transactionId) {
        return new TransitionAttempt(
            null, entityType, entityId, fromState, toState,
            actor.userId(), actor.username(), Instant.now(),
            false, failureReason, metadata, durationMs, transactionId
        );
    }

    /**
     * Copy with the id assigned by the log.
     */
    public TransitionAttempt withId(long assignedId) {
        return new TransitionAttempt(
            assignedId, entityType, entityId, fromState, toState,
            userId, username, timestamp, success, failureReason,
            metadata, durationMs, transactionId
        );
    }
}
