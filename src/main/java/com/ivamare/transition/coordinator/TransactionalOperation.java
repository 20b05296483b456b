package com.ivamare.transition.coordinator;

/**
 * Business work executed under a validated transition, e.g. persisting the new
 * state of a task.
 *
 * @param <T> Result type
 */
@FunctionalInterface
public interface TransactionalOperation<T> {

    /**
     * Perform the work.
     *
     * @return result handed back to the caller (may be null)
     * @throws Exception any failure; the coordinator turns it into a failed result
     */
    T execute() throws Exception;
}
