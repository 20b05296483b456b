package com.ivamare.transition.api;

import com.ivamare.transition.coordinator.CompensatingActions;
import com.ivamare.transition.coordinator.DistributedOperation;
import com.ivamare.transition.coordinator.TransactionalOperation;
import com.ivamare.transition.model.Actor;
import com.ivamare.transition.model.ComplianceRecord;
import com.ivamare.transition.model.EntityType;
import com.ivamare.transition.model.TransactionResult;
import com.ivamare.transition.model.TransitionAttempt;
import com.ivamare.transition.validation.ValidationResult;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Entry point used by business services to validate, execute and audit state transitions.
 *
 * <p>Services never talk to the rule store or the transaction log directly.
 */
public interface TransitionEngine {

    // --- Validation ---

    /**
     * Check whether a transition is legal. Nothing is logged.
     */
    ValidationResult validateTransition(String entityType, String fromState, String toState);

    /**
     * Check whether a transition is legal, carrying audit context on the result.
     */
    ValidationResult validateTransition(String entityType, String fromState, String toState,
                                        Actor actor, Map<String, Object> metadata);

    /**
     * Legal next states of an entity in a given state.
     */
    Set<String> getAvailableTransitions(String entityType, String fromState);

    default Set<String> getAvailableTransitions(EntityType entityType, String fromState) {
        return getAvailableTransitions(entityType.typeName(), fromState);
    }

    // --- Entity types ---

    /**
     * Register an application entity type. Registering an existing name is a no-op.
     *
     * @throws IllegalArgumentException if the name is blank
     */
    EntityType registerEntityType(String typeName);

    /**
     * Resolve a registered entity type, including types registered from loaded rules.
     */
    Optional<EntityType> resolveEntityType(String typeName);

    /**
     * Names of all registered entity types, sorted. Types without rules are included.
     */
    Set<String> listRegisteredEntityTypes();

    // --- Execution ---

    /**
     * Validate, execute and log a single-entity transition.
     *
     * @throws com.ivamare.transition.exception.TransactionLogException if the attempt
     *         could not be logged
     */
    <T> TransactionResult<T> executeTransaction(
        String entityType,
        String entityId,
        String fromState,
        String toState,
        Actor actor,
        TransactionalOperation<T> operation,
        Map<String, Object> metadata);

    default <T> TransactionResult<T> executeTransaction(
            EntityType entityType,
            String entityId,
            String fromState,
            String toState,
            Actor actor,
            TransactionalOperation<T> operation) {
        return executeTransaction(entityType.typeName(), entityId, fromState, toState, actor, operation, null);
    }

    /**
     * Execute and log a multi-entity transaction with compensating actions.
     *
     * @throws com.ivamare.transition.exception.TransactionLogException if the attempt
     *         could not be logged
     */
    <T> TransactionResult<T> executeDistributedTransaction(
        String transactionType,
        String transactionId,
        String fromState,
        String toState,
        Actor actor,
        DistributedOperation<T> operation,
        CompensatingActions compensation,
        Map<String, Object> metadata);

    // --- Audit ---

    /**
     * Transition history of an entity, newest first, using the configured default limit.
     */
    List<TransitionAttempt> getEntityTransactions(String entityType, String entityId);

    /**
     * Transition history of an entity, newest first.
     */
    List<TransitionAttempt> getEntityTransactions(String entityType, String entityId, int limit);

    /**
     * All attempts logged under a correlation id, oldest first.
     */
    List<TransitionAttempt> getCorrelatedTransactions(String transactionId);

    /**
     * Record a business-rule evaluation. A store failure never fails the caller.
     *
     * @return id of the stored record, or empty if it could not be stored
     * @throws NullPointerException if actor is null
     */
    Optional<Long> logComplianceCheck(
        String entityType,
        String entityId,
        Actor actor,
        String ruleId,
        String ruleName,
        boolean compliant,
        String message);

    /**
     * Compliance history of an entity, newest first, using the configured default limit.
     */
    List<ComplianceRecord> getComplianceHistory(String entityType, String entityId);

    // --- Rule administration ---

    Set<String> listEntityTypes();

    Optional<Map<String, Set<String>>> getRules(String entityType);

    /**
     * Reload all rules from the configured rule source.
     */
    void reloadRules();

    /**
     * Replace the rules of one entity type.
     */
    void updateRules(String entityType, Map<String, ? extends Collection<String>> rules);
}
