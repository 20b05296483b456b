package com.ivamare.transition.rules;

import com.ivamare.transition.model.EntityType;
import com.ivamare.transition.model.TransitionRuleSet;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Holds the permitted transitions per entity type.
 *
 * <p>Readers always observe one complete snapshot; {@link #reload()} and
 * {@link #updateRules(String, Map)} swap in a new snapshot rather than editing
 * the current one. Anything without a rule is denied.
 */
public interface RuleStore {

    /**
     * Get the from-state to to-states mapping of an entity type.
     *
     * @param entityType Entity type name
     * @return mapping, or empty if the entity type has no rules
     */
    Optional<Map<String, Set<String>>> getRules(String entityType);

    default Optional<Map<String, Set<String>>> getRules(EntityType entityType) {
        return getRules(entityType.typeName());
    }

    /**
     * Legal next states, in declaration order.
     *
     * @return targets, empty for an unknown entity type or a state without outgoing edges
     */
    Set<String> getAvailableTransitions(String entityType, String fromState);

    default Set<String> getAvailableTransitions(EntityType entityType, String fromState) {
        return getAvailableTransitions(entityType.typeName(), fromState);
    }

    /**
     * Check a single edge. False for anything not explicitly permitted.
     */
    boolean isValidTransition(String entityType, String fromState, String toState);

    default boolean isValidTransition(EntityType entityType, String fromState, String toState) {
        return isValidTransition(entityType.typeName(), fromState, toState);
    }

    /**
     * Entity types with at least one rule.
     */
    Set<String> listEntityTypes();

    /**
     * Replace the whole rule set from the backing source.
     *
     * @throws com.ivamare.transition.exception.RuleLoadException if the source cannot be
     *         loaded; the current rules stay active
     */
    void reload();

    /**
     * Replace the rules of one entity type. An empty mapping removes the entity type.
     */
    void updateRules(String entityType, Map<String, ? extends Collection<String>> rules);

    /**
     * Current snapshot.
     */
    TransitionRuleSet snapshot();
}
