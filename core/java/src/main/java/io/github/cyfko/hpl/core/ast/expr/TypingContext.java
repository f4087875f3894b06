package io.github.cyfko.hpl.core.ast.expr;

import io.github.cyfko.hpl.core.api.ValueType;
import io.github.cyfko.hpl.core.spi.FunctionRegistry;
import io.github.cyfko.hpl.core.spi.FunctionSignature;

import java.util.Objects;
import java.util.Set;

/**
 * Supplies the types that expressions cannot infer by themselves.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface TypingContext {

    /**
     * @param access a field access
     * @return the types the accessed field may have, empty when the field does not exist
     */
    Set<ValueType> fieldTypes(FieldAccess access);

    /**
     * @param function a function name
     * @return the return types of the function, every type when the function is unknown
     */
    Set<ValueType> returnTypes(String function);

    /**
     * @param reference a quantified variable reference
     * @return the types the variable may have, every primitive type by default
     */
    default Set<ValueType> variableTypes(VariableReference reference) {
        return ValueType.primitive();
    }

    /**
     * Context without message schema, backed by the global function registry.
     *
     * @return the structural context
     */
    static TypingContext structural() {
        return structural(FunctionRegistry.global());
    }

    /**
     * Context without message schema: every field may be any field type.
     *
     * @param registry the registry giving function return types
     * @return the structural context
     */
    static TypingContext structural(FunctionRegistry registry) {
        Objects.requireNonNull(registry, "registry is required");
        return new TypingContext() {
            @Override
            public Set<ValueType> fieldTypes(FieldAccess access) {
                return ValueType.field();
            }

            @Override
            public Set<ValueType> returnTypes(String function) {
                return registry.lookup(function)
                        .map(FunctionSignature::returnType)
                        .map(type -> ValueType.of(type))
                        .orElseGet(ValueType::any);
            }
        };
    }
}
