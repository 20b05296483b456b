package com.ivamare.transition.model;

/**
 * The user on whose behalf a transition is attempted.
 *
 * @param userId Identifier of the acting user
 * @param username Display name (nullable)
 */
public record Actor(String userId, String username) {

    private static final Actor SYSTEM = new Actor("0", "system");

    public Actor {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be blank");
        }
    }

    public static Actor of(String userId) {
        return new Actor(userId, null);
    }

    public static Actor of(String userId, String username) {
        return new Actor(userId, username);
    }

    /**
     * Actor for activity initiated by the engine itself.
     */
    public static Actor system() {
        return SYSTEM;
    }
}
