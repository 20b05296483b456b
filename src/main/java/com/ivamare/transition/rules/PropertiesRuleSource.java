package com.ivamare.transition.rules;

import com.ivamare.transition.TransitionEngineProperties;
import com.ivamare.transition.exception.RuleLoadException;
import com.ivamare.transition.model.TransitionRuleSet;

/**
 * Rules bound from application configuration.
 *
 * <pre>
 * transition:
 *   rules:
 *     task:
 *       pending: [in_progress, cancelled]
 *       "[in_progress]": [completed, blocked]
 * </pre>
 */
public class PropertiesRuleSource implements RuleSource {

    private final TransitionEngineProperties properties;

    public PropertiesRuleSource(TransitionEngineProperties properties) {
        this.properties = properties;
    }

    @Override
    public TransitionRuleSet load() {
        try {
            return TransitionRuleSet.of(properties.getRules());
        } catch (IllegalArgumentException e) {
            throw new RuleLoadException("Invalid transition rules in configuration: " + e.getMessage(), e);
        }
    }

    @Override
    public String describe() {
        return "configuration properties (transition.rules)";
    }
}
