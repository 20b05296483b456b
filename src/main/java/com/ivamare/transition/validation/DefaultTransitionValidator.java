package com.ivamare.transition.validation;

import com.ivamare.transition.model.Actor;
import com.ivamare.transition.model.TransactionErrorCode;
import com.ivamare.transition.rules.RuleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;

/**
 * Validator consulting a {@link RuleStore} after trimming and checking the request.
 */
public class DefaultTransitionValidator implements TransitionValidator {

    private static final Logger log = LoggerFactory.getLogger(DefaultTransitionValidator.class);

    private final RuleStore ruleStore;

    public DefaultTransitionValidator(RuleStore ruleStore) {
        this.ruleStore = ruleStore;
    }

    @Override
    public ValidationResult validate(String entityType, String fromState, String toState) {
        return validate(entityType, fromState, toState, null, null);
    }

    @Override
    public ValidationResult validate(String entityType, String fromState, String toState,
                                     Actor actor, Map<String, Object> metadata) {
        String type = normalize(entityType);
        String from = normalize(fromState);
        String to = normalize(toState);

        if (type.isEmpty() || from.isEmpty() || to.isEmpty()) {
            log.debug("Rejected transition request with blank field (entityType='{}', from='{}', to='{}')",
                type, from, to);
            return ValidationResult.invalid(type, from, to, TransactionErrorCode.INVALID_REQUEST,
                "Entity type, from-state and to-state must not be blank", actor, metadata);
        }

        if (!ruleStore.isValidTransition(type, from, to)) {
            log.debug("Transition {} -> {} not permitted for {}", from, to, type);
            return ValidationResult.invalid(type, from, to, TransactionErrorCode.INVALID_TRANSITION,
                "Transition from '" + from + "' to '" + to + "' is not allowed for " + type,
                actor, metadata);
        }

        log.debug("Transition {} -> {} permitted for {}", from, to, type);
        return ValidationResult.valid(type, from, to, actor, metadata);
    }

    @Override
    public Set<String> getAvailableTransitions(String entityType, String fromState) {
        String type = normalize(entityType);
        String from = normalize(fromState);
        if (type.isEmpty() || from.isEmpty()) {
            return Set.of();
        }
        return ruleStore.getAvailableTransitions(type, from);
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim();
    }
}
