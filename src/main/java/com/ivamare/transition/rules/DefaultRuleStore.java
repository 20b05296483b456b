package com.ivamare.transition.rules;

import com.ivamare.transition.model.EntityTypeRegistry;
import com.ivamare.transition.model.TransitionRuleSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Rule store backed by an atomically swapped immutable {@link TransitionRuleSet}.
 */
public class DefaultRuleStore implements RuleStore {

    private static final Logger log = LoggerFactory.getLogger(DefaultRuleStore.class);

    private final RuleSource ruleSource;
    private final EntityTypeRegistry entityTypeRegistry;
    private final AtomicReference<TransitionRuleSet> current =
        new AtomicReference<>(TransitionRuleSet.empty());

    /**
     * Creates a store with no rules. Call {@link #reload()} to load the source.
     *
     * @param ruleSource The backing rule source
     * @param entityTypeRegistry Registry receiving every loaded entity type
     */
    public DefaultRuleStore(RuleSource ruleSource, EntityTypeRegistry entityTypeRegistry) {
        this.ruleSource = ruleSource;
        this.entityTypeRegistry = entityTypeRegistry;
    }

    @Override
    public Optional<Map<String, Set<String>>> getRules(String entityType) {
        return current.get().rulesFor(entityType);
    }

    @Override
    public Set<String> getAvailableTransitions(String entityType, String fromState) {
        return current.get().targets(entityType, fromState);
    }

    @Override
    public boolean isValidTransition(String entityType, String fromState, String toState) {
        return current.get().allows(entityType, fromState, toState);
    }

    @Override
    public Set<String> listEntityTypes() {
        return current.get().entityTypes();
    }

    @Override
    public void reload() {
        TransitionRuleSet loaded = ruleSource.load();
        loaded.entityTypes().forEach(entityTypeRegistry::register);
        TransitionRuleSet previous = current.getAndSet(loaded);
        log.info("Loaded transition rules from {}: {} entity types, {} edges (previously {} entity types)",
            ruleSource.describe(), loaded.entityTypes().size(), loaded.edgeCount(),
            previous.entityTypes().size());
    }

    @Override
    public void updateRules(String entityType, Map<String, ? extends Collection<String>> rules) {
        TransitionRuleSet updated = current.updateAndGet(snapshot -> snapshot.withEntityType(entityType, rules));
        if (updated.rulesFor(entityType.trim()).isPresent()) {
            entityTypeRegistry.register(entityType);
            log.info("Updated transition rules for entity type {}", entityType);
        } else {
            log.info("Removed transition rules for entity type {}", entityType);
        }
    }

    @Override
    public TransitionRuleSet snapshot() {
        return current.get();
    }
}
