package com.ivamare.transition.rules;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.transition.exception.RuleLoadException;
import com.ivamare.transition.model.TransitionRuleSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.ClassPathResource;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JsonResourceRuleSource")
class JsonResourceRuleSourceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("should load rules from classpath resource")
    void shouldLoadClasspathRules() {
        JsonResourceRuleSource source =
            new JsonResourceRuleSource(new ClassPathResource("transition-rules.json"), objectMapper);

        TransitionRuleSet rules = source.load();

        assertThat(rules.entityTypes()).containsExactly("reminder", "task");
        assertThat(rules.targets("task", "pending")).containsExactly("in_progress", "cancelled");
        assertThat(rules.targets("task", "completed")).isEmpty();
        assertThat(rules.allows("reminder", "snoozed", "scheduled")).isTrue();
        assertThat(source.describe()).contains("transition-rules.json");
    }

    @Test
    @DisplayName("should fail when resource is missing")
    void shouldFailWhenMissing() {
        JsonResourceRuleSource source =
            new JsonResourceRuleSource(new ClassPathResource("no-such-rules.json"), objectMapper);

        assertThatThrownBy(source::load)
            .isInstanceOf(RuleLoadException.class)
            .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("should fail on malformed JSON")
    void shouldFailOnMalformedJson() {
        JsonResourceRuleSource source = new JsonResourceRuleSource(
            new ByteArrayResource("{\"task\": [".getBytes(StandardCharsets.UTF_8)), objectMapper);

        assertThatThrownBy(source::load)
            .isInstanceOf(RuleLoadException.class)
            .hasMessageContaining("Failed to read rules");
    }

    @Test
    @DisplayName("should fail on blank state names")
    void shouldFailOnInvalidRules() {
        JsonResourceRuleSource source = new JsonResourceRuleSource(
            new ByteArrayResource("{\"task\": {\"\": [\"done\"]}}".getBytes(StandardCharsets.UTF_8)),
            objectMapper);

        assertThatThrownBy(source::load)
            .isInstanceOf(RuleLoadException.class)
            .hasMessageContaining("Invalid rules");
    }
}
