package com.ivamare.transition.api.impl;

import com.ivamare.transition.api.TransitionEngine;
import com.ivamare.transition.compliance.ComplianceRecorder;
import com.ivamare.transition.coordinator.CompensatingActions;
import com.ivamare.transition.coordinator.DistributedOperation;
import com.ivamare.transition.coordinator.TransactionCoordinator;
import com.ivamare.transition.coordinator.TransactionalOperation;
import com.ivamare.transition.model.Actor;
import com.ivamare.transition.model.ComplianceRecord;
import com.ivamare.transition.model.EntityType;
import com.ivamare.transition.model.EntityTypeRegistry;
import com.ivamare.transition.model.TransactionResult;
import com.ivamare.transition.model.TransitionAttempt;
import com.ivamare.transition.repository.TransactionLogRepository;
import com.ivamare.transition.rules.RuleStore;
import com.ivamare.transition.validation.TransitionValidator;
import com.ivamare.transition.validation.ValidationResult;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Default implementation of TransitionEngine.
 */
public class DefaultTransitionEngine implements TransitionEngine {

    private final RuleStore ruleStore;
    private final EntityTypeRegistry entityTypeRegistry;
    private final TransitionValidator validator;
    private final TransactionCoordinator coordinator;
    private final TransactionLogRepository transactionLog;
    private final ComplianceRecorder complianceRecorder;
    private final int defaultHistoryLimit;

    /**
     * Creates a new DefaultTransitionEngine.
     *
     * @param ruleStore The rule store
     * @param entityTypeRegistry Registry shared with the rule store
     * @param validator The transition validator
     * @param coordinator The transaction coordinator
     * @param transactionLog The transaction log
     * @param complianceRecorder The compliance recorder
     * @param defaultHistoryLimit Limit used when callers do not pass one
     */
    public DefaultTransitionEngine(
            RuleStore ruleStore,
            EntityTypeRegistry entityTypeRegistry,
            TransitionValidator validator,
            TransactionCoordinator coordinator,
            TransactionLogRepository transactionLog,
            ComplianceRecorder complianceRecorder,
            int defaultHistoryLimit) {
        this.ruleStore = ruleStore;
        this.entityTypeRegistry = entityTypeRegistry;
        this.validator = validator;
        this.coordinator = coordinator;
        this.transactionLog = transactionLog;
        this.complianceRecorder = complianceRecorder;
        this.defaultHistoryLimit = defaultHistoryLimit;
    }

    // --- Validation ---

    @Override
    public ValidationResult validateTransition(String entityType, String fromState, String toState) {
        return validator.validate(entityType, fromState, toState);
    }

    @Override
    public ValidationResult validateTransition(String entityType, String fromState, String toState,
                                               Actor actor, Map<String, Object> metadata) {
        return validator.validate(entityType, fromState, toState, actor, metadata);
    }

    @Override
    public Set<String> getAvailableTransitions(String entityType, String fromState) {
        return validator.getAvailableTransitions(entityType, fromState);
    }

    // --- Entity types ---

    @Override
    public EntityType registerEntityType(String typeName) {
        return entityTypeRegistry.register(typeName);
    }

    @Override
    public Optional<EntityType> resolveEntityType(String typeName) {
        return entityTypeRegistry.resolve(typeName);
    }

    @Override
    public Set<String> listRegisteredEntityTypes() {
        return entityTypeRegistry.typeNames();
    }

    // --- Execution ---

    @Override
    public <T> TransactionResult<T> executeTransaction(
            String entityType,
            String entityId,
            String fromState,
            String toState,
            Actor actor,
            TransactionalOperation<T> operation,
            Map<String, Object> metadata) {
        return coordinator.executeTransaction(entityType, entityId, fromState, toState, actor, operation, metadata);
    }

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
        return coordinator.executeDistributedTransaction(transactionType, transactionId, fromState, toState,
            actor, operation, compensation, metadata);
    }

    // --- Audit ---

    @Override
    public List<TransitionAttempt> getEntityTransactions(String entityType, String entityId) {
        return getEntityTransactions(entityType, entityId, defaultHistoryLimit);
    }

    @Override
    public List<TransitionAttempt> getEntityTransactions(String entityType, String entityId, int limit) {
        return transactionLog.getEntityHistory(entityType, entityId, limit);
    }

    @Override
    public List<TransitionAttempt> getCorrelatedTransactions(String transactionId) {
        return transactionLog.getByTransactionId(transactionId);
    }

    @Override
    public Optional<Long> logComplianceCheck(
            String entityType,
            String entityId,
            Actor actor,
            String ruleId,
            String ruleName,
            boolean compliant,
            String message) {
        return complianceRecorder.record(entityType, entityId, actor, ruleId, ruleName, compliant, message);
    }

    @Override
    public List<ComplianceRecord> getComplianceHistory(String entityType, String entityId) {
        return complianceRecorder.history(entityType, entityId, defaultHistoryLimit);
    }

    // --- Rule administration ---

    @Override
    public Set<String> listEntityTypes() {
        return ruleStore.listEntityTypes();
    }

    @Override
    public Optional<Map<String, Set<String>>> getRules(String entityType) {
        return ruleStore.getRules(entityType);
    }

    @Override
    public void reloadRules() {
        ruleStore.reload();
    }

    @Override
    public void updateRules(String entityType, Map<String, ? extends Collection<String>> rules) {
        ruleStore.updateRules(entityType, rules);
    }
}
