package com.ivamare.transition.coordinator;

import com.ivamare.transition.exception.StaleStateException;
import com.ivamare.transition.model.Actor;
import com.ivamare.transition.model.DistributedTransactionContext;
import com.ivamare.transition.model.TransactionErrorCode;
import com.ivamare.transition.model.TransactionResult;
import com.ivamare.transition.model.TransitionAttempt;
import com.ivamare.transition.repository.TransactionLogRepository;
import com.ivamare.transition.validation.TransitionValidator;
import com.ivamare.transition.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CancellationException;

/**
 * Default implementation of TransactionCoordinator.
 *
 * <p>Every invocation appends exactly one {@link TransitionAttempt}, whatever the
 * outcome. The append happens on the caller's thread before the result is returned,
 * or before an {@link Error} thrown by the operation is rethrown.
 */
public class DefaultTransactionCoordinator implements TransactionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(DefaultTransactionCoordinator.class);

    static final String REASON_INVALID_TRANSITION = "invalid transition";
    static final String REASON_INVALID_REQUEST = "invalid request";
    static final String REASON_CANCELLED = "cancelled";

    private final TransitionValidator validator;
    private final TransactionLogRepository transactionLog;

    /**
     * Creates a new DefaultTransactionCoordinator.
     *
     * @param validator The transition validator
     * @param transactionLog The transaction log
     */
    public DefaultTransactionCoordinator(TransitionValidator validator, TransactionLogRepository transactionLog) {
        this.validator = validator;
        this.transactionLog = transactionLog;
    }

    // --- Single Entity ---

    @Override
    public <T> TransactionResult<T> executeTransaction(
            String entityType,
            String entityId,
            String fromState,
            String toState,
            Actor actor,
            TransactionalOperation<T> operation,
            Map<String, Object> metadata) {

        Objects.requireNonNull(entityId, "entityId must not be null");
        Objects.requireNonNull(actor, "actor must not be null");
        Objects.requireNonNull(operation, "operation must not be null");

        long startNanos = System.nanoTime();
        Map<String, Object> auditMetadata = copyOf(metadata);
        trace(CoordinatorPhase.STARTED, entityType, entityId);

        if (Thread.currentThread().isInterrupted()) {
            long attemptId = append(TransitionAttempt.failed(
                normalize(entityType), entityId, normalize(fromState), normalize(toState),
                actor, REASON_CANCELLED, auditMetadata, elapsedMs(startNanos), null));
            trace(CoordinatorPhase.FAILED, entityType, entityId);
            return TransactionResult.failure(TransactionErrorCode.CANCELLED,
                "Transaction cancelled before execution", attemptId, null);
        }

        trace(CoordinatorPhase.VALIDATING, entityType, entityId);
        ValidationResult validation = validator.validate(entityType, fromState, toState, actor, auditMetadata);

        if (!validation.valid()) {
            String reason = validation.errorCode() == TransactionErrorCode.INVALID_REQUEST
                ? REASON_INVALID_REQUEST
                : REASON_INVALID_TRANSITION;
            long attemptId = append(TransitionAttempt.failed(
                validation.entityType(), entityId, validation.fromState(), validation.toState(),
                actor, reason, auditMetadata, elapsedMs(startNanos), null));
            trace(CoordinatorPhase.REJECTED, entityType, entityId);
            log.info("Rejected transition {} -> {} for {}/{}: {}",
                fromState, toState, entityType, entityId, validation.message());
            return TransactionResult.failure(validation.errorCode(), validation.message(), attemptId, null);
        }

        trace(CoordinatorPhase.EXECUTING, entityType, entityId);
        T value;
        try {
            value = operation.execute();
        } catch (Exception e) {
            TransactionErrorCode errorCode = classify(e);
            String reason = failureReason(e);
            auditMetadata.put("exception", e.getClass().getName());
            long attemptId = append(TransitionAttempt.failed(
                validation.entityType(), entityId, validation.fromState(), validation.toState(),
                actor, reason, auditMetadata, elapsedMs(startNanos), null));
            trace(CoordinatorPhase.FAILED, entityType, entityId);
            log.warn("Transition {} -> {} for {}/{} failed: {}",
                fromState, toState, entityType, entityId, reason, e);
            return TransactionResult.failure(errorCode, reason, attemptId, null);
        } catch (Error e) {
            auditMetadata.put("exception", e.getClass().getName());
            append(TransitionAttempt.failed(
                validation.entityType(), entityId, validation.fromState(), validation.toState(),
                actor, failureReason(e), auditMetadata, elapsedMs(startNanos), null));
            trace(CoordinatorPhase.FAILED, entityType, entityId);
            log.error("Transition {} -> {} for {}/{} aborted by error",
                fromState, toState, entityType, entityId, e);
            throw e;
        }

        long attemptId = append(TransitionAttempt.succeeded(
            validation.entityType(), entityId, validation.fromState(), validation.toState(),
            actor, auditMetadata, elapsedMs(startNanos), null));
        trace(CoordinatorPhase.SUCCEEDED, entityType, entityId);
        log.debug("Transition {} -> {} for {}/{} committed (attemptId={})",
            fromState, toState, entityType, entityId, attemptId);
        return TransactionResult.success(value, attemptId, null);
    }

    // --- Distributed ---

    @Override
    public <T> TransactionResult<T> executeDistributedTransaction(
            String transactionType,
            String transactionId,
            String fromState,
            String toState,
            Actor actor,
            DistributedOperation<T> operation,
            CompensatingActions compensation,
            Map<String, Object> metadata) {

        Objects.requireNonNull(transactionType, "transactionType must not be null");
        Objects.requireNonNull(actor, "actor must not be null");
        Objects.requireNonNull(operation, "operation must not be null");

        long startNanos = System.nanoTime();
        String correlationId = transactionId != null && !transactionId.isBlank()
            ? transactionId
            : UUID.randomUUID().toString();
        CompensatingActions actions = compensation != null ? compensation : CompensatingActions.none();
        Map<String, Object> auditMetadata = copyOf(metadata);
        DistributedTransactionContext context =
            new DistributedTransactionContext(correlationId, transactionType, fromState, toState);
        trace(CoordinatorPhase.STARTED, transactionType, correlationId);

        T value = null;
        Exception failure = null;
        if (Thread.currentThread().isInterrupted()) {
            failure = new CancellationException("Transaction cancelled before execution");
        } else {
            trace(CoordinatorPhase.EXECUTING, transactionType, correlationId);
            try {
                value = operation.execute(context);
            } catch (Exception e) {
                failure = e;
            } catch (Error e) {
                trace(CoordinatorPhase.COMPENSATING, transactionType, correlationId);
                runCompensation(actions, context, false, auditMetadata);
                addContextDetails(context, auditMetadata);
                auditMetadata.put("exception", e.getClass().getName());
                append(TransitionAttempt.failed(transactionType, correlationId, fromState, toState,
                    actor, failureReason(e), auditMetadata, elapsedMs(startNanos), correlationId));
                trace(CoordinatorPhase.FAILED, transactionType, correlationId);
                log.error("Distributed transaction {} ({}) aborted by error", correlationId, transactionType, e);
                throw e;
            }
        }

        trace(CoordinatorPhase.COMPENSATING, transactionType, correlationId);
        boolean succeeded = failure == null;
        runCompensation(actions, context, succeeded, auditMetadata);

        addContextDetails(context, auditMetadata);

        if (succeeded) {
            long attemptId = append(TransitionAttempt.succeeded(transactionType, correlationId,
                fromState, toState, actor, auditMetadata, elapsedMs(startNanos), correlationId));
            trace(CoordinatorPhase.SUCCEEDED, transactionType, correlationId);
            log.info("Distributed transaction {} ({}) completed (attemptId={})",
                correlationId, transactionType, attemptId);
            return TransactionResult.success(value, attemptId, correlationId);
        }

        String reason = failureReason(failure);
        auditMetadata.put("exception", failure.getClass().getName());
        long attemptId = append(TransitionAttempt.failed(transactionType, correlationId,
            fromState, toState, actor, reason, auditMetadata, elapsedMs(startNanos), correlationId));
        trace(CoordinatorPhase.FAILED, transactionType, correlationId);
        log.warn("Distributed transaction {} ({}) failed: {}", correlationId, transactionType, reason, failure);
        return TransactionResult.failure(classify(failure), reason, attemptId, correlationId);
    }

    // --- Internal ---

    private void runCompensation(
            CompensatingActions actions,
            DistributedTransactionContext context,
            boolean succeeded,
            Map<String, Object> auditMetadata) {
        try {
            if (succeeded) {
                actions.onSuccess(context);
            } else {
                actions.onFailure(context);
            }
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            auditMetadata.put("compensation_error", failureReason(e));
            log.error("Compensating action {} failed for distributed transaction {} ({})",
                succeeded ? "onSuccess" : "onFailure",
                context.correlationId(), context.transactionType(), e);
        }
    }

    private static void addContextDetails(DistributedTransactionContext context, Map<String, Object> auditMetadata) {
        if (context.result() != null) {
            auditMetadata.put("context_result", context.result());
        }
        if (!context.participants().isEmpty()) {
            auditMetadata.put("participants",
                context.participants().stream().map(Object::toString).toList());
        }
    }

    private long append(TransitionAttempt attempt) {
        // TransactionLogException propagates: the caller must not proceed unaudited
        return transactionLog.append(attempt);
    }

    private static TransactionErrorCode classify(Exception e) {
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
            return TransactionErrorCode.CANCELLED;
        }
        if (e instanceof CancellationException) {
            return TransactionErrorCode.CANCELLED;
        }
        if (e instanceof StaleStateException) {
            return TransactionErrorCode.CONCURRENT_MODIFICATION;
        }
        return TransactionErrorCode.OPERATION_FAILED;
    }

    private static String failureReason(Throwable e) {
        String message = e.getMessage();
        return message != null && !message.isBlank() ? message : e.getClass().getName();
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim();
    }

    private static Map<String, Object> copyOf(Map<String, Object> metadata) {
        return metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata);
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    private static void trace(CoordinatorPhase phase, String entityType, String entityId) {
        log.debug("[{}/{}] phase {}", entityType, entityId, phase);
    }
}
