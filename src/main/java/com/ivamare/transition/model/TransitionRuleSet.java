package com.ivamare.transition.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable snapshot of the permitted transitions, per entity type.
 *
 * <p>Maps entity type to (from-state to ordered set of legal to-states). A state that
 * is absent from the mapping has no legal transitions. Target order follows the order
 * in which the rule source declared them.
 *
 * @param rules entity type to state-edge mapping (deep-copied, unmodifiable)
 */
public record TransitionRuleSet(Map<String, Map<String, Set<String>>> rules) {

    private static final TransitionRuleSet EMPTY = new TransitionRuleSet(Map.of());

    public TransitionRuleSet {
        if (rules == null) {
            throw new IllegalArgumentException("rules must not be null");
        }
        Map<String, Map<String, Set<String>>> copy = new LinkedHashMap<>();
        rules.forEach((entityType, edges) -> {
            if (edges != null && !edges.isEmpty()) {
                copy.put(requireName(entityType, "entity type"), copyEdges(edges));
            }
        });
        rules = Collections.unmodifiableMap(copy);
    }

    public static TransitionRuleSet empty() {
        return EMPTY;
    }

    /**
     * Build a rule set from a loosely typed mapping, e.g. one bound from configuration
     * or parsed from JSON.
     */
    public static TransitionRuleSet of(Map<String, ? extends Map<String, ? extends Collection<String>>> source) {
        Map<String, Map<String, Set<String>>> rules = new LinkedHashMap<>();
        if (source != null) {
            source.forEach((entityType, edges) -> rules.put(entityType, toEdgeMap(edges)));
        }
        return new TransitionRuleSet(rules);
    }

    /**
     * Get the edges for one entity type.
     *
     * @return edges, or empty if the entity type has no rules
     */
    public Optional<Map<String, Set<String>>> rulesFor(String entityType) {
        if (entityType == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(rules.get(entityType));
    }

    /**
     * Legal targets from a state. Never null.
     */
    public Set<String> targets(String entityType, String fromState) {
        return rulesFor(entityType)
            .map(edges -> edges.get(fromState))
            .orElse(Set.of());
    }

    public boolean allows(String entityType, String fromState, String toState) {
        return toState != null && targets(entityType, fromState).contains(toState);
    }

    /**
     * Entity types with at least one rule, sorted.
     */
    public Set<String> entityTypes() {
        return Collections.unmodifiableSet(new TreeSet<>(rules.keySet()));
    }

    /**
     * Copy of this rule set with the rules of one entity type replaced.
     * An empty or null mapping removes the entity type.
     */
    public TransitionRuleSet withEntityType(String entityType, Map<String, ? extends Collection<String>> edges) {
        String name = requireName(entityType, "entity type");
        Map<String, Map<String, Set<String>>> copy = new LinkedHashMap<>(rules);
        if (edges == null || edges.isEmpty()) {
            copy.remove(name);
        } else {
            copy.put(name, toEdgeMap(edges));
        }
        return new TransitionRuleSet(copy);
    }

    /**
     * Copy of this rule set where every entity type present in {@code other}
     * replaces the one in this set.
     */
    public TransitionRuleSet overriddenBy(TransitionRuleSet other) {
        Map<String, Map<String, Set<String>>> copy = new LinkedHashMap<>(rules);
        copy.putAll(other.rules());
        return new TransitionRuleSet(copy);
    }

    public int edgeCount() {
        return rules.values().stream()
            .flatMap(edges -> edges.values().stream())
            .mapToInt(Set::size)
            .sum();
    }

    private static Map<String, Set<String>> toEdgeMap(Map<String, ? extends Collection<String>> edges) {
        Map<String, Set<String>> result = new LinkedHashMap<>();
        if (edges != null) {
            edges.forEach((from, targets) ->
                result.put(from, targets == null ? Set.of() : new LinkedHashSet<>(targets)));
        }
        return result;
    }

    private static Map<String, Set<String>> copyEdges(Map<String, Set<String>> edges) {
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        edges.forEach((from, targets) -> {
            Set<String> targetCopy = new LinkedHashSet<>();
            if (targets != null) {
                for (String target : targets) {
                    targetCopy.add(requireName(target, "target state"));
                }
            }
            copy.put(requireName(from, "state"), Collections.unmodifiableSet(targetCopy));
        });
        return Collections.unmodifiableMap(copy);
    }

    private static String requireName(String name, String what) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException(what + " name must not be blank");
        }
        return name.trim();
    }
}
