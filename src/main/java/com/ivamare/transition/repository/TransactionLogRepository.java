package com.ivamare.transition.repository;

import com.ivamare.transition.model.TransitionAttempt;

import java.util.List;

/**
 * Append-only log of transition attempts.
 */
public interface TransactionLogRepository {

    /**
     * Persist one attempt.
     *
     * @param attempt The attempt (its id is ignored)
     * @return id assigned by the store
     * @throws com.ivamare.transition.exception.TransactionLogException if the attempt
     *         could not be persisted
     */
    long append(TransitionAttempt attempt);

    /**
     * Get the attempts recorded for an entity.
     *
     * @param entityType Entity type name
     * @param entityId Entity identifier
     * @param limit Maximum number of attempts (positive)
     * @return attempts, newest first
     */
    List<TransitionAttempt> getEntityHistory(String entityType, String entityId, int limit);

    /**
     * Get all attempts grouped under a correlation id.
     *
     * @param transactionId Correlation id
     * @return attempts in chronological order
     */
    List<TransitionAttempt> getByTransactionId(String transactionId);

    /**
     * Count logged attempts.
     *
     * @param success Filter by outcome (nullable for all)
     */
    long count(Boolean success);
}
