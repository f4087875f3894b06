package io.github.cyfko.hpl.core.config;

/**
 * Validation rules specific to one temporal pattern.
 *
 * @param allowTriggerDisjunction   whether the trigger may be an event disjunction
 * @param allowBehaviourDisjunction whether the behaviour may be an event disjunction
 * @param warnOnUnboundResponse     whether a behaviour that reads no trigger alias is reported
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record PatternRules(
        boolean allowTriggerDisjunction,
        boolean allowBehaviourDisjunction,
        boolean warnOnUnboundResponse
) {

    /**
     * @return disjunctions allowed everywhere, no unbound response warning
     */
    public static PatternRules standard() {
        return new PatternRules(true, true, false);
    }

    public PatternRules withUnboundResponseWarning(boolean warn) {
        return new PatternRules(allowTriggerDisjunction, allowBehaviourDisjunction, warn);
    }
}
