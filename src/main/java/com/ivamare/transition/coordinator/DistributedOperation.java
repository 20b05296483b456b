package com.ivamare.transition.coordinator;

import com.ivamare.transition.model.DistributedTransactionContext;

/**
 * Multi-entity work executed against a shared context.
 *
 * @param <T> Result type
 */
@FunctionalInterface
public interface DistributedOperation<T> {

    /**
     * Perform the work, recording progress and participants on the context.
     *
     * @param context Shared context of this transaction
     * @return result handed back to the caller (may be null)
     * @throws Exception any failure; triggers {@link CompensatingActions#onFailure}
     */
    T execute(DistributedTransactionContext context) throws Exception;
}
