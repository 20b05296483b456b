package com.ivamare.transition.rules;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.transition.exception.RuleLoadException;
import com.ivamare.transition.model.TransitionRuleSet;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

/**
 * Rules read from a JSON resource of the form
 * {@code {"task": {"pending": ["in_progress", "cancelled"]}}}.
 */
public class JsonResourceRuleSource implements RuleSource {

    private static final TypeReference<Map<String, Map<String, List<String>>>> RULES_TYPE =
        new TypeReference<>() {};

    private final Resource resource;
    private final ObjectMapper objectMapper;

    public JsonResourceRuleSource(Resource resource, ObjectMapper objectMapper) {
        this.resource = resource;
        this.objectMapper = objectMapper;
    }

    @Override
    public TransitionRuleSet load() {
        if (!resource.exists()) {
            throw new RuleLoadException("Rule resource not found: " + resource.getDescription());
        }
        Map<String, Map<String, List<String>>> raw;
        try (InputStream in = resource.getInputStream()) {
            raw = objectMapper.readValue(in, RULES_TYPE);
        } catch (IOException e) {
            throw new RuleLoadException("Failed to read rules from " + resource.getDescription(), e);
        }
        try {
            return TransitionRuleSet.of(raw);
        } catch (IllegalArgumentException e) {
            throw new RuleLoadException("Invalid rules in " + resource.getDescription() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String describe() {
        return resource.getDescription();
    }
}
