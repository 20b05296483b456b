package com.ivamare.transition.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of entity types available in this deployment.
 *
 * <p>Pre-populated with {@link StandardEntityType}. Rule stores register every
 * entity type found in a rule source. Applications register and resolve their own
 * through {@link com.ivamare.transition.api.TransitionEngine}.
 */
public class EntityTypeRegistry {

    private static final Logger log = LoggerFactory.getLogger(EntityTypeRegistry.class);

    private final Map<String, EntityType> types = new ConcurrentHashMap<>();

    public EntityTypeRegistry() {
        for (StandardEntityType type : StandardEntityType.values()) {
            types.put(type.typeName(), type);
        }
    }

    /**
     * Register an entity type by name. Registering an existing name is a no-op.
     *
     * @param typeName non-blank type name
     * @return the registered type
     */
    public EntityType register(String typeName) {
        EntityType candidate = EntityType.of(typeName);
        return types.computeIfAbsent(candidate.typeName(), name -> {
            log.info("Registered entity type {}", name);
            return candidate;
        });
    }

    /**
     * Resolve a registered entity type.
     */
    public Optional<EntityType> resolve(String typeName) {
        if (typeName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(types.get(typeName.trim()));
    }

    public boolean isRegistered(String typeName) {
        return resolve(typeName).isPresent();
    }

    /**
     * All registered type names, sorted.
     */
    public Set<String> typeNames() {
        return Collections.unmodifiableSet(new TreeSet<>(types.keySet()));
    }
}
