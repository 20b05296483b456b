package com.ivamare.transition.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Entity types known to every deployment.
 */
public enum StandardEntityType implements EntityType {
    TASK("task"),
    REMINDER("reminder"),
    BOARD("board"),
    FAMILY_TASK("family_task"),
    TEMPLATE("template");

    private final String typeName;

    StandardEntityType(String typeName) {
        this.typeName = typeName;
    }

    @Override
    public String typeName() {
        return typeName;
    }

    /**
     * Look up a standard type by its persisted name.
     */
    public static Optional<StandardEntityType> fromTypeName(String typeName) {
        if (typeName == null) {
            return Optional.empty();
        }
        String normalized = typeName.trim();
        return Arrays.stream(values())
            .filter(t -> t.typeName.equals(normalized))
            .findFirst();
    }
}
