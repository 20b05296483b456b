package com.ivamare.transition.rules;

import com.ivamare.transition.exception.RuleLoadException;
import com.ivamare.transition.model.TransitionRuleSet;

/**
 * Backing source of transition rules, read on every reload.
 */
@FunctionalInterface
public interface RuleSource {

    /**
     * Load the complete rule set.
     *
     * @return rule set (never null)
     * @throws RuleLoadException if the source is unreadable or malformed
     */
    TransitionRuleSet load();

    /**
     * Human-readable description used in log messages.
     */
    default String describe() {
        return getClass().getSimpleName();
    }
}
