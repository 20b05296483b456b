package com.ivamare.transition.rules;

import com.ivamare.transition.model.TransitionRuleSet;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Combines several sources. For an entity type defined by more than one source,
 * the last source wins.
 */
public class CompositeRuleSource implements RuleSource {

    private final List<RuleSource> sources;

    public CompositeRuleSource(List<RuleSource> sources) {
        this.sources = List.copyOf(sources);
    }

    @Override
    public TransitionRuleSet load() {
        TransitionRuleSet merged = TransitionRuleSet.empty();
        for (RuleSource source : sources) {
            merged = merged.overriddenBy(source.load());
        }
        return merged;
    }

    @Override
    public String describe() {
        return sources.stream()
            .map(RuleSource::describe)
            .collect(Collectors.joining(", ", "[", "]"));
    }
}
