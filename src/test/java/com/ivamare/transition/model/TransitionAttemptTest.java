package com.ivamare.transition.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TransitionAttempt")
class TransitionAttemptTest {

    private static final Actor ACTOR = Actor.of("7", "alice");

    @Test
    @DisplayName("should create succeeded attempt without reason")
    void shouldCreateSucceeded() {
        TransitionAttempt attempt = TransitionAttempt.succeeded(
            "task", "42", "pending", "in_progress", ACTOR, null, 12L, null);

        assertThat(attempt.id()).isNull();
        assertThat(attempt.success()).isTrue();
        assertThat(attempt.failureReason()).isNull();
        assertThat(attempt.userId()).isEqualTo("7");
        assertThat(attempt.username()).isEqualTo("alice");
        assertThat(attempt.durationMs()).isEqualTo(12L);
        assertThat(attempt.metadata()).isEmpty();
        assertThat(attempt.timestamp()).isNotNull();
    }

    @Test
    @DisplayName("should require a reason on failure")
    void shouldRequireReason() {
        assertThatThrownBy(() -> TransitionAttempt.failed(
            "task", "42", "pending", "done", ACTOR, " ", null, 0L, null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should reject reason on success")
    void shouldRejectReasonOnSuccess() {
        assertThatThrownBy(() -> new TransitionAttempt(null, "task", "42", "a", "b", "7", null,
            null, true, "oops", null, null, null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should copy metadata defensively")
    void shouldCopyMetadata() {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("source", "api");

        TransitionAttempt attempt = TransitionAttempt.failed(
            "task", "42", "pending", "done", ACTOR, "invalid transition", metadata, 0L, "tx-1");
        metadata.put("source", "changed");

        assertThat(attempt.metadata()).containsEntry("source", "api");
        assertThatThrownBy(() -> attempt.metadata().put("x", 1))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("should keep every field when assigning id")
    void shouldAssignId() {
        TransitionAttempt attempt = TransitionAttempt.failed(
            "task", "42", "pending", "done", ACTOR, "invalid transition", Map.of("k", "v"), 3L, "tx-1");

        TransitionAttempt withId = attempt.withId(99L);

        assertThat(withId.id()).isEqualTo(99L);
        assertThat(withId).usingRecursiveComparison().ignoringFields("id").isEqualTo(attempt);
    }
}
