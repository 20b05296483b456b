package com.ivamare.transition.model;

/**
 * Envelope returned to every coordinator caller.
 *
 * <p>A success carries the operation's value (which may itself be null) and no error;
 * a failure carries an error code and message and no value.
 *
 * @param success Whether the transition was committed
 * @param result Value returned by the operation (only on success)
 * @param errorCode Stable error code (only on failure)
 * @param errorMessage Error message (only on failure)
 * @param attemptId Id of the logged transition attempt
 * @param correlationId Correlation id for distributed work (nullable)
 * @param <T> Operation result type
 */
public record TransactionResult<T>(
    boolean success,
    T result,
    String errorCode,
    String errorMessage,
    Long attemptId,
    String correlationId
) {

    public TransactionResult {
        if (success && (errorCode != null || errorMessage != null)) {
            throw new IllegalArgumentException("Successful result cannot carry an error");
        }
        if (!success && (errorCode == null || errorMessage == null)) {
            throw new IllegalArgumentException("Failed result requires an error code and message");
        }
        if (!success && result != null) {
            throw new IllegalArgumentException("Failed result cannot carry a value");
        }
    }

    public static <T> TransactionResult<T> success(T result, Long attemptId, String correlationId) {
        return new TransactionResult<>(true, result, null, null, attemptId, correlationId);
    }

    public static <T> TransactionResult<T> failure(
            TransactionErrorCode errorCode,
            String errorMessage,
            Long attemptId,
            String correlationId) {
        return failure(errorCode.code(), errorMessage, attemptId, correlationId);
    }

    public static <T> TransactionResult<T> failure(
            String errorCode,
            String errorMessage,
            Long attemptId,
            String correlationId) {
        return new TransactionResult<>(false, null, errorCode, errorMessage, attemptId, correlationId);
    }

    public boolean isFailure() {
        return !success;
    }

    /**
     * Check the error code against a known code.
     */
    public boolean hasErrorCode(TransactionErrorCode code) {
        return code.code().equals(errorCode);
    }
}
