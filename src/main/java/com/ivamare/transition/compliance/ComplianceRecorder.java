package com.ivamare.transition.compliance;

import com.ivamare.transition.model.Actor;
import com.ivamare.transition.model.ComplianceRecord;
import com.ivamare.transition.repository.ComplianceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Records business-rule evaluations next to the transition log.
 *
 * <p>Recording never affects the primary transaction: a store failure is logged and
 * reported as an empty id, and a non-compliant outcome is data, not an error.
 */
public class ComplianceRecorder {

    private static final Logger log = LoggerFactory.getLogger(ComplianceRecorder.class);

    private final ComplianceRepository complianceRepository;

    public ComplianceRecorder(ComplianceRepository complianceRepository) {
        this.complianceRepository = complianceRepository;
    }

    /**
     * Record a compliance check.
     *
     * @param entityType Entity type name
     * @param entityId Entity identifier
     * @param actor Acting user
     * @param ruleId Rule identifier
     * @param ruleName Rule name
     * @param compliant Whether the rule was satisfied
     * @param message Explanation (nullable)
     * @return id of the stored record, or empty if it could not be stored
     * @throws NullPointerException if actor is null
     */
    public Optional<Long> record(
            String entityType,
            String entityId,
            Actor actor,
            String ruleId,
            String ruleName,
            boolean compliant,
            String message) {

        Objects.requireNonNull(actor, "actor must not be null");
        ComplianceRecord record = ComplianceRecord.create(
            entityType, entityId, actor, ruleId, ruleName, compliant, message);

        if (!compliant) {
            log.warn("Compliance rule {} ({}) not satisfied for {}/{}: {}",
                ruleId, ruleName, entityType, entityId, message);
        }

        try {
            long id = complianceRepository.record(record);
            log.debug("Recorded compliance check {} for {}/{} (compliant={})",
                ruleId, entityType, entityId, compliant);
            return Optional.of(id);
        } catch (RuntimeException e) {
            log.error("Failed to record compliance check {} for {}/{}",
                ruleId, entityType, entityId, e);
            return Optional.empty();
        }
    }

    /**
     * Compliance history of an entity, newest first.
     */
    public List<ComplianceRecord> history(String entityType, String entityId, int limit) {
        return complianceRepository.findByEntity(entityType, entityId, limit);
    }
}
