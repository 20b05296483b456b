package com.ivamare.transition.validation;

import com.ivamare.transition.model.Actor;

import java.util.Map;
import java.util.Set;

/**
 * Answers whether a transition is legal for an entity type.
 *
 * <p>The decision is purely rule-based. Actor and metadata are carried on the
 * result so callers can log the check, but they never influence it.
 */
public interface TransitionValidator {

    /**
     * Validate a transition.
     *
     * @param entityType Entity type name
     * @param fromState Current state
     * @param toState Requested state
     * @return validation outcome
     */
    ValidationResult validate(String entityType, String fromState, String toState);

    /**
     * Validate a transition, carrying audit context.
     *
     * @param entityType Entity type name
     * @param fromState Current state
     * @param toState Requested state
     * @param actor Acting user (nullable)
     * @param metadata Audit context (nullable)
     * @return validation outcome
     */
    ValidationResult validate(String entityType, String fromState, String toState,
                              Actor actor, Map<String, Object> metadata);

    /**
     * Legal next states for an entity type and state.
     */
    Set<String> getAvailableTransitions(String entityType, String fromState);
}
