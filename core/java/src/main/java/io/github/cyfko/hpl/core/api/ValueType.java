package io.github.cyfko.hpl.core.api;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Coarse value kinds used to typecheck predicate expressions structurally.
 * <p>
 * An expression carries the set of kinds it may evaluate to. Literals have exactly one kind,
 * while a field access may be any message field kind until a message schema narrows it.
 * Two expressions are compatible when their kind sets overlap.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum ValueType {

    BOOL("boolean"),
    NUMBER("number"),
    STRING("string"),
    ARRAY("array"),
    RANGE("range"),
    SET("set"),
    MESSAGE("message");

    private final String displayName;

    ValueType(String displayName) {
        this.displayName = displayName;
    }

    /**
     * @return the human readable name of this kind
     */
    public String getDisplayName() {
        return displayName;
    }

    /** @return every kind */
    public static Set<ValueType> any() {
        return Collections.unmodifiableSet(EnumSet.allOf(ValueType.class));
    }

    /** @return boolean, number and string */
    public static Set<ValueType> primitive() {
        return Collections.unmodifiableSet(EnumSet.of(BOOL, NUMBER, STRING));
    }

    /** @return array, range and set */
    public static Set<ValueType> composite() {
        return Collections.unmodifiableSet(EnumSet.of(ARRAY, RANGE, SET));
    }

    /** @return the kinds a message field may hold */
    public static Set<ValueType> field() {
        return Collections.unmodifiableSet(EnumSet.of(BOOL, NUMBER, STRING, ARRAY, MESSAGE));
    }

    /** @return the kinds an array item may hold */
    public static Set<ValueType> item() {
        return Collections.unmodifiableSet(EnumSet.of(BOOL, NUMBER, STRING, MESSAGE));
    }

    /**
     * @param first a kind
     * @param rest  further kinds
     * @return an unmodifiable set of the given kinds
     */
    public static Set<ValueType> of(ValueType first, ValueType... rest) {
        return Collections.unmodifiableSet(EnumSet.of(first, rest));
    }

    /**
     * Intersects two kind sets.
     *
     * @param a first set
     * @param b second set
     * @return the kinds present in both sets
     */
    public static Set<ValueType> intersect(Collection<ValueType> a, Collection<ValueType> b) {
        EnumSet<ValueType> result = EnumSet.noneOf(ValueType.class);
        result.addAll(a);
        result.retainAll(b);
        return Collections.unmodifiableSet(result);
    }

    /**
     * @param a first set
     * @param b second set
     * @return {@code true} if both sets share at least one kind
     */
    public static boolean overlaps(Collection<ValueType> a, Collection<ValueType> b) {
        return !intersect(a, b).isEmpty();
    }

    /**
     * Renders a kind set the way diagnostics print it, e.g. {@code "number or string"}.
     *
     * @param types the kinds to describe
     * @return a readable description
     */
    public static String describe(Collection<ValueType> types) {
        if (types.isEmpty()) {
            return "nothing";
        }
        EnumSet<ValueType> ordered = EnumSet.noneOf(ValueType.class);
        ordered.addAll(types);
        return ordered.stream().map(ValueType::getDisplayName).collect(Collectors.joining(" or "));
    }
}
