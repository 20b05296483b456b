package com.ivamare.transition.coordinator;

import com.ivamare.transition.model.DistributedTransactionContext;

/**
 * Callbacks reacting to the outcome of a distributed transaction.
 *
 * <p>Exactly one of the two methods runs, once, after the operation resolves. Both
 * default to no-ops. Exceptions thrown here are logged by the coordinator and never
 * change the outcome.
 */
public interface CompensatingActions {

    /**
     * Called after the operation completed normally, e.g. to finalize side effects.
     */
    default void onSuccess(DistributedTransactionContext context) throws Exception {
        // Default: no-op
    }

    /**
     * Called after the operation threw, e.g. to undo partial work.
     */
    default void onFailure(DistributedTransactionContext context) throws Exception {
        // Default: no-op
    }

    /**
     * Callback with a single context argument.
     */
    @FunctionalInterface
    interface Callback {
        void accept(DistributedTransactionContext context) throws Exception;
    }

    static CompensatingActions none() {
        return new CompensatingActions() {};
    }

    static CompensatingActions onSuccess(Callback onSuccess) {
        return of(onSuccess, null);
    }

    static CompensatingActions onFailure(Callback onFailure) {
        return of(null, onFailure);
    }

    /**
     * Build from two optional callbacks.
     *
     * @param onSuccess success callback (nullable)
     * @param onFailure failure callback (nullable)
     */
    static CompensatingActions of(Callback onSuccess, Callback onFailure) {
        return new CompensatingActions() {
            @Override
            public void onSuccess(DistributedTransactionContext context) throws Exception {
                if (onSuccess != null) {
                    onSuccess.accept(context);
                }
            }

            @Override
            public void onFailure(DistributedTransactionContext context) throws Exception {
                if (onFailure != null) {
                    onFailure.accept(context);
                }
            }
        };
    }
}
