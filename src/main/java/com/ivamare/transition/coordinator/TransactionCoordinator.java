package com.ivamare.transition.coordinator;

import com.ivamare.transition.model.Actor;
import com.ivamare.transition.model.TransactionResult;

import java.util.Map;

/**
 * Runs business operations under transition validation and records every attempt.
 *
 * <p>Validation and operation failures come back as failed {@link TransactionResult}s.
 * Only a failure to write the transaction log is thrown
 * ({@link com.ivamare.transition.exception.TransactionLogException}).
 */
public interface TransactionCoordinator {

    /**
     * Validate a transition, run the operation if it is legal, and log the attempt.
     *
     * @param entityType Entity type name
     * @param entityId Entity identifier
     * @param fromState State the caller observed
     * @param toState Requested state
     * @param actor Acting user
     * @param operation Work to run when the transition is legal
     * @param metadata Audit context (nullable)
     * @return result envelope
     */
    <T> TransactionResult<T> executeTransaction(
        String entityType,
        String entityId,
        String fromState,
        String toState,
        Actor actor,
        TransactionalOperation<T> operation,
        Map<String, Object> metadata);

    /**
     * Run a multi-entity operation against a shared context, then invoke the matching
     * compensating action and log the attempt under the correlation id.
     *
     * @param transactionType Logical type of the transaction (logged as entity type)
     * @param transactionId Correlation id (generated when null or blank)
     * @param fromState Logical from-state
     * @param toState Logical to-state
     * @param actor Acting user
     * @param operation Work to run
     * @param compensation Compensating actions (nullable)
     * @param metadata Audit context (nullable)
     * @return result envelope carrying the correlation id
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
}
