package com.ivamare.transition.validation;

import com.ivamare.transition.model.Actor;
import com.ivamare.transition.model.TransactionErrorCode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a transition check.
 *
 * @param valid Whether the edge is permitted
 * @param entityType Normalized entity type (may be blank for rejected requests)
 * @param fromState Normalized from-state
 * @param toState Normalized to-state
 * @param errorCode Why the edge was rejected (null when valid)
 * @param message Rejection detail (null when valid)
 * @param actor Acting user carried for audit (nullable)
 * @param metadata Audit context (never null)
 */
public record ValidationResult(
    boolean valid,
    String entityType,
    String fromState,
    String toState,
    TransactionErrorCode errorCode,
    String message,
    Actor actor,
    Map<String, Object> metadata
) {

    public ValidationResult {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static ValidationResult valid(String entityType, String fromState, String toState,
                                         Actor actor, Map<String, Object> metadata) {
        return new ValidationResult(true, entityType, fromState, toState, null, null, actor, metadata);
    }

    public static ValidationResult invalid(String entityType, String fromState, String toState,
                                           TransactionErrorCode errorCode, String message,
                                           Actor actor, Map<String, Object> metadata) {
        return new ValidationResult(false, entityType, fromState, toState, errorCode, message, actor, metadata);
    }
}
