package io.github.cyfko.hpl.core.spi;

import io.github.cyfko.hpl.core.api.ValueType;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Typing contract of a named function: its overloads and its return type.
 *
 * <pre>{@code
 * // log(number, number) -> number
 * FunctionSignature.of("log", ValueType.NUMBER,
 *     Parameters.of(ValueType.of(NUMBER), ValueType.of(NUMBER)));
 *
 * // max(array|set|range) or max(number, number, ...) -> number
 * FunctionSignature.of("max", ValueType.NUMBER,
 *     Parameters.of(ValueType.composite()),
 *     Parameters.variadic(ValueType.of(NUMBER), ValueType.of(NUMBER)));
 * }</pre>
 *
 * @param name       the function name
 * @param overloads  the accepted parameter lists, at least one
 * @param returnType the type of the result
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FunctionSignature(String name, List<Parameters> overloads, ValueType returnType) {

    public FunctionSignature {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Function name cannot be null or blank");
        }
        Objects.requireNonNull(overloads, "overloads are required");
        Objects.requireNonNull(returnType, "returnType is required");
        if (overloads.isEmpty()) {
            throw new IllegalArgumentException("Function '" + name + "' needs at least one overload");
        }
        overloads = List.copyOf(overloads);
    }

    public static FunctionSignature of(String name, ValueType returnType, Parameters... overloads) {
        return new FunctionSignature(name, Arrays.asList(overloads), returnType);
    }

    /**
     * One parameter list of a function.
     * <p>
     * When {@code varArgs} is set, the last parameter may be repeated any number of times,
     * so the list accepts {@code types.size()} arguments or more.
     * </p>
     *
     * @param types   accepted types of each parameter, in order
     * @param varArgs whether the last parameter repeats
     */
    public record Parameters(List<Set<ValueType>> types, boolean varArgs) {

        public Parameters {
            Objects.requireNonNull(types, "types are required");
            types = types.stream().map(Set::copyOf).toList();
            if (varArgs && types.isEmpty()) {
                throw new IllegalArgumentException("A variadic parameter list needs at least one parameter");
            }
        }

        @SafeVarargs
        public static Parameters of(Set<ValueType>... types) {
            return new Parameters(Arrays.asList(types), false);
        }

        @SafeVarargs
        public static Parameters variadic(Set<ValueType>... types) {
            return new Parameters(Arrays.asList(types), true);
        }

        public boolean acceptsArity(int count) {
            return varArgs ? count >= types.size() : count == types.size();
        }

        /**
         * @param position zero-based argument position, within the accepted arity
         * @return the types accepted at that position
         */
        public Set<ValueType> typesAt(int position) {
            return position < types.size() ? types.get(position) : types.get(types.size() - 1);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("(");
            for (int i = 0; i < types.size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(ValueType.describe(types.get(i)));
            }
            return sb.append(varArgs ? ", ...)" : ")").toString();
        }
    }
}
