package com.ivamare.transition.model;

import java.time.Instant;

/**
 * Outcome of a business-rule evaluation, logged next to (but independent of)
 * state-machine legality.
 *
 * @param id Identifier assigned by the store (null before insert)
 * @param entityType Entity type name
 * @param entityId Entity identifier
 * @param userId Acting user
 * @param ruleId Rule identifier
 * @param ruleName Human-readable rule name
 * @param compliant Whether the rule was satisfied
 * @param message Explanation (nullable)
 * @param timestamp When the evaluation was recorded
 */
public record ComplianceRecord(
    Long id,
    String entityType,
    String entityId,
    String userId,
    String ruleId,
    String ruleName,
    boolean compliant,
    String message,
    Instant timestamp
) {

    public static ComplianceRecord create(
            String entityType,
            String entityId,
            Actor actor,
            String ruleId,
            String ruleName,
            boolean compliant,
            String message) {
        return new ComplianceRecord(
            null, entityType, entityId, actor.userId(),
            ruleId, ruleName, compliant, message, Instant.now()
        );
    }
}
