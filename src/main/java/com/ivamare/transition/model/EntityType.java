package com.ivamare.transition.model;

/**
 * A kind of entity whose state transitions are governed by rules.
 *
 * <p>Known kinds are listed in {@link StandardEntityType}. Kinds introduced by rule
 * sources or by applications at runtime are registered in {@link EntityTypeRegistry}.
 */
public interface EntityType {

    /**
     * Name used in rule sources and persisted log rows (e.g. "task").
     */
    String typeName();

    /**
     * Create an entity type for an arbitrary name.
     *
     * @param typeName non-blank type name
     * @return a standard type if the name matches one, otherwise a custom type
     */
    static EntityType of(String typeName) {
        return StandardEntityType.fromTypeName(typeName)
            .<EntityType>map(t -> t)
            .orElseGet(() -> new CustomEntityType(typeName));
    }

    /**
     * Entity type registered at runtime.
     *
     * @param typeName The type name
     */
    record CustomEntityType(String typeName) implements EntityType {

        public CustomEntityType {
            if (typeName == null || typeName.isBlank()) {
                throw new IllegalArgumentException("typeName must not be blank");
            }
            typeName = typeName.trim();
        }

        @Override
        public String toString() {
            return typeName;
        }
    }
}
