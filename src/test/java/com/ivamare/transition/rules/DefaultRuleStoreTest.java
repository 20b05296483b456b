package com.ivamare.transition.rules;

import com.ivamare.transition.exception.RuleLoadException;
import com.ivamare.transition.model.EntityTypeRegistry;
import com.ivamare.transition.model.StandardEntityType;
import com.ivamare.transition.model.TransitionRuleSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DefaultRuleStore")
class DefaultRuleStoreTest {

    private static final TransitionRuleSet TASK_RULES = TransitionRuleSet.of(Map.of(
        "task", Map.of(
            "pending", List.of("in_progress", "cancelled"),
            "in_progress", List.of("completed"),
            "completed", List.of()
        )
    ));

    private AtomicReference<TransitionRuleSet> sourceRules;
    private EntityTypeRegistry registry;
    private DefaultRuleStore store;

    @BeforeEach
    void setUp() {
        sourceRules = new AtomicReference<>(TASK_RULES);
        registry = new EntityTypeRegistry();
        store = new DefaultRuleStore(sourceRules::get, registry);
        store.reload();
    }

    @Nested
    @DisplayName("queries")
    class QueryTests {

        @Test
        @DisplayName("should start empty before first reload")
        void shouldStartEmpty() {
            DefaultRuleStore fresh = new DefaultRuleStore(() -> TASK_RULES, registry);

            assertThat(fresh.listEntityTypes()).isEmpty();
            assertThat(fresh.isValidTransition("task", "pending", "in_progress")).isFalse();
        }

        @Test
        @DisplayName("should return available transitions for known state")
        void shouldReturnAvailableTransitions() {
            assertThat(store.getAvailableTransitions("task", "pending"))
                .containsExactlyInAnyOrder("in_progress", "cancelled");
            assertThat(store.getAvailableTransitions(StandardEntityType.TASK, "in_progress"))
                .containsExactly("completed");
        }

        @Test
        @DisplayName("should return empty transitions for entity type without rules")
        void shouldReturnEmptyForUnknownType() {
            assertThat(store.getAvailableTransitions("reminder", "snoozed")).isEmpty();
            assertThat(store.getRules("reminder")).isEmpty();
        }

        @Test
        @DisplayName("should return empty transitions for terminal state")
        void shouldReturnEmptyForTerminalState() {
            assertThat(store.getAvailableTransitions("task", "completed")).isEmpty();
            assertThat(store.isValidTransition("task", "completed", "pending")).isFalse();
        }

        @Test
        @DisplayName("should deny anything not explicitly permitted")
        void shouldDenyByDefault() {
            assertThat(store.isValidTransition("task", "pending", "in_progress")).isTrue();
            assertThat(store.isValidTransition("task", "pending", "completed")).isFalse();
            assertThat(store.isValidTransition("task", "unknown", "pending")).isFalse();
            assertThat(store.isValidTransition("board", "active", "archived")).isFalse();
        }

        @Test
        @DisplayName("should register loaded entity types")
        void shouldRegisterLoadedTypes() {
            sourceRules.set(TransitionRuleSet.of(Map.of("shopping_list", Map.of("open", List.of("done")))));

            store.reload();

            assertThat(registry.isRegistered("shopping_list")).isTrue();
        }
    }

    @Nested
    @DisplayName("reload")
    class ReloadTests {

        @Test
        @DisplayName("should be idempotent")
        void shouldBeIdempotent() {
            TransitionRuleSet before = store.snapshot();

            store.reload();

            assertThat(store.snapshot()).isEqualTo(before);
        }

        @Test
        @DisplayName("should pick up changed source")
        void shouldPickUpChanges() {
            sourceRules.set(TransitionRuleSet.of(Map.of("reminder", Map.of("scheduled", List.of("snoozed")))));

            store.reload();

            assertThat(store.listEntityTypes()).containsExactly("reminder");
            assertThat(store.getAvailableTransitions("task", "pending")).isEmpty();
        }

        @Test
        @DisplayName("should keep current rules when source fails")
        void shouldKeepRulesOnFailure() {
            DefaultRuleStore failing = new DefaultRuleStore(new RuleSource() {
                private boolean loaded;

                @Override
                public TransitionRuleSet load() {
                    if (loaded) {
                        throw new RuleLoadException("rules file unreadable");
                    }
                    loaded = true;
                    return TASK_RULES;
                }
            }, registry);
            failing.reload();

            assertThatThrownBy(failing::reload).isInstanceOf(RuleLoadException.class);
            assertThat(failing.snapshot()).isEqualTo(TASK_RULES);
        }

        @Test
        @DisplayName("should let readers observe either the old or the new snapshot")
        void shouldSwapAtomically() throws Exception {
            TransitionRuleSet replacement = TransitionRuleSet.of(Map.of(
                "task", Map.of("open", List.of("closed"))
            ));
            ExecutorService readers = Executors.newFixedThreadPool(4);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<Boolean>> results = new ArrayList<>();
            try {
                for (int i = 0; i < 4; i++) {
                    results.add(readers.submit(() -> {
                        start.await();
                        for (int n = 0; n < 2_000; n++) {
                            TransitionRuleSet seen = store.snapshot();
                            if (!seen.equals(TASK_RULES) && !seen.equals(replacement)) {
                                return false;
                            }
                        }
                        return true;
                    }));
                }
                start.countDown();
                for (int n = 0; n < 200; n++) {
                    sourceRules.set(n % 2 == 0 ? replacement : TASK_RULES);
                    store.reload();
                }
                for (Future<Boolean> result : results) {
                    assertThat(result.get(10, TimeUnit.SECONDS)).isTrue();
                }
            } finally {
                readers.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("updateRules")
    class UpdateRulesTests {

        @Test
        @DisplayName("should return exactly the rules that were set")
        void shouldRoundTrip() {
            Map<String, Set<String>> reminderRules = new LinkedHashMap<>();
            reminderRules.put("scheduled", Set.of("snoozed", "dismissed"));
            reminderRules.put("snoozed", Set.of("scheduled", "dismissed"));

            store.updateRules("reminder", reminderRules);

            assertThat(store.getRules("reminder")).contains(reminderRules);
            assertThat(store.getAvailableTransitions("task", "pending"))
                .containsExactlyInAnyOrder("in_progress", "cancelled");
            assertThat(registry.isRegistered("reminder")).isTrue();
        }

        @Test
        @DisplayName("should replace existing entity type wholesale")
        void shouldReplaceWholesale() {
            store.updateRules("task", Map.of("open", List.of("closed")));

            assertThat(store.getRules("task")).contains(Map.of("open", Set.of("closed")));
            assertThat(store.isValidTransition("task", "pending", "in_progress")).isFalse();
        }

        @Test
        @DisplayName("should remove entity type when given empty rules")
        void shouldRemoveEntityType() {
            store.updateRules("task", Map.<String, List<String>>of());

            assertThat(store.listEntityTypes()).doesNotContain("task");
            assertThat(store.getRules("task")).isEmpty();
        }

        @Test
        @DisplayName("should not change snapshots already handed out")
        void shouldNotMutateOldSnapshot() {
            TransitionRuleSet before = store.snapshot();

            store.updateRules("task", Map.of("open", List.of("closed")));

            assertThat(before.allows("task", "pending", "in_progress")).isTrue();
        }

        @Test
        @DisplayName("should be discarded by the next reload")
        void shouldBeDiscardedByReload() {
            store.updateRules("reminder", Map.of("scheduled", List.of("snoozed")));

            store.reload();

            assertThat(store.getRules("reminder")).isEmpty();
        }
    }
}
