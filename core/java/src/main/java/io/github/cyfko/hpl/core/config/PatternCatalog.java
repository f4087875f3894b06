package io.github.cyfko.hpl.core.config;

import io.github.cyfko.hpl.core.ast.PatternKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable mapping from each {@link PatternKind} to its {@link PatternRules}.
 * <p>
 * The catalog is the place where pattern-specific sanity rules are tuned. Every pattern always
 * has rules: {@link #with(PatternKind, PatternRules)} returns a new catalog with one entry replaced.
 * </p>
 *
 * <pre>{@code
 * PatternCatalog catalog = PatternCatalog.defaults()
 *     .with(PatternKind.PREVENTION, new PatternRules(false, true, true));
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class PatternCatalog {

    private final Map<PatternKind, PatternRules> rules;

    private PatternCatalog(Map<PatternKind, PatternRules> rules) {
        EnumMap<PatternKind, PatternRules> copy = new EnumMap<>(PatternKind.class);
        copy.putAll(rules);
        for (PatternKind kind : PatternKind.values()) {
            if (!copy.containsKey(kind)) {
                throw new IllegalArgumentException("No rules for pattern " + kind);
            }
        }
        this.rules = Collections.unmodifiableMap(copy);
    }

    /**
     * Disjunctions are allowed everywhere. Only a requirement whose behaviour reads no trigger
     * alias is reported.
     *
     * @return the default catalog
     */
    public static PatternCatalog defaults() {
        Map<PatternKind, PatternRules> rules = new EnumMap<>(PatternKind.class);
        for (PatternKind kind : PatternKind.values()) {
            rules.put(kind, PatternRules.standard());
        }
        rules.put(PatternKind.REQUIREMENT, PatternRules.standard().withUnboundResponseWarning(true));
        return new PatternCatalog(rules);
    }

    /**
     * @return a catalog allowing every disjunction and reporting no pattern warning
     */
    public static PatternCatalog permissive() {
        Map<PatternKind, PatternRules> rules = new EnumMap<>(PatternKind.class);
        for (PatternKind kind : PatternKind.values()) {
            rules.put(kind, PatternRules.standard());
        }
        return new PatternCatalog(rules);
    }

    public PatternRules rulesFor(PatternKind kind) {
        return rules.get(Objects.requireNonNull(kind, "pattern kind is required"));
    }

    public PatternCatalog with(PatternKind kind, PatternRules patternRules) {
        Objects.requireNonNull(kind, "pattern kind is required");
        Objects.requireNonNull(patternRules, "pattern rules are required");
        Map<PatternKind, PatternRules> copy = new EnumMap<>(rules);
        copy.put(kind, patternRules);
        return new PatternCatalog(copy);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof PatternCatalog other && rules.equals(other.rules));
    }

    @Override
    public int hashCode() {
        return rules.hashCode();
    }

    @Override
    public String toString() {
        return "PatternCatalog" + rules;
    }
}
