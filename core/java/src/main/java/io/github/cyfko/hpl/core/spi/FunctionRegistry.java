package io.github.cyfko.hpl.core.spi;

import io.github.cyfko.hpl.core.api.Diagnostic;
import io.github.cyfko.hpl.core.api.DiagnosticCode;
import io.github.cyfko.hpl.core.api.ValueType;
import io.github.cyfko.hpl.core.ast.expr.Expression;
import io.github.cyfko.hpl.core.ast.expr.FunctionCall;
import io.github.cyfko.hpl.core.ast.expr.TypingContext;
import io.github.cyfko.hpl.core.spi.FunctionSignature.Parameters;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

import static io.github.cyfko.hpl.core.api.ValueType.BOOL;
import static io.github.cyfko.hpl.core.api.ValueType.MESSAGE;
import static io.github.cyfko.hpl.core.api.ValueType.NUMBER;
import static io.github.cyfko.hpl.core.api.ValueType.STRING;

/**
 * Registry of the functions that predicates may call, keyed by name.
 * <p>
 * A registry is open for registration until it is {@linkplain #freeze() frozen}. The validator
 * freezes the registry it is given before validating anything, so that concurrent validations
 * share a read-only table. Registering into a frozen registry throws {@link IllegalStateException}.
 * </p>
 *
 * <p><strong>Concurrency:</strong> Internal storage uses a {@link ConcurrentHashMap}, and the
 * frozen flag is volatile.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * FunctionRegistry registry = FunctionRegistry.withBuiltins();
 * registry.register(FunctionSignature.of("norm", ValueType.NUMBER,
 *     Parameters.of(ValueType.of(ValueType.MESSAGE))));
 *
 * PropertyValidator validator = new PropertyValidator(ValidationPolicy.defaults(), registry);
 * // registry is now frozen
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FunctionRegistry {

    private static final Logger log = Logger.getLogger(FunctionRegistry.class.getName());

    private static final FunctionRegistry GLOBAL = withBuiltins();

    private final Map<String, FunctionSignature> functions = new ConcurrentHashMap<>();
    private volatile boolean frozen;

    private FunctionRegistry() {
    }

    /**
     * Returns the process-wide registry, preloaded with the builtin functions.
     *
     * @return the global registry
     */
    public static FunctionRegistry global() {
        return GLOBAL;
    }

    /**
     * @return a new open registry holding the builtin functions
     */
    public static FunctionRegistry withBuiltins() {
        FunctionRegistry registry = new FunctionRegistry();
        registerBuiltins(registry);
        return registry;
    }

    /**
     * @return a new open registry without any function
     */
    public static FunctionRegistry empty() {
        return new FunctionRegistry();
    }

    /**
     * Registers a function.
     *
     * @param signature the function to register
     * @throws IllegalArgumentException if a function with the same name is already registered
     * @throws IllegalStateException    if the registry is frozen
     */
    public void register(FunctionSignature signature) {
        Objects.requireNonNull(signature, "signature is required");
        if (frozen) {
            throw new IllegalStateException("Function registry is frozen, cannot register '" + signature.name() + "'");
        }
        FunctionSignature previous = functions.putIfAbsent(signature.name(), signature);
        if (previous != null) {
            throw new IllegalArgumentException("Function [" + signature.name() + "] is already registered.");
        }
        log.fine(() -> String.format("Registered function %s with %d overload(s)",
                signature.name(), signature.overloads().size()));
    }

    /**
     * @param name a function name
     * @return the signature registered under that name
     */
    public Optional<FunctionSignature> lookup(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(functions.get(name));
    }

    /**
     * Closes the registry for registration. Freezing twice has no effect.
     */
    public void freeze() {
        if (!frozen) {
            frozen = true;
            log.fine(() -> String.format("Function registry frozen with %d function(s)", functions.size()));
        }
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * @return the sorted names of the registered functions
     */
    public Set<String> registeredFunctions() {
        return Collections.unmodifiableSet(new TreeSet<>(functions.keySet()));
    }

    /**
     * Checks a call against the registered signature of its function.
     * <p>
     * The call is accepted when one overload accepts both the number of arguments and the type of
     * every argument. Otherwise {@code UNKNOWN_FUNCTION} is returned when the name is not
     * registered, {@code FUNCTION_ARITY_MISMATCH} when no overload accepts the number of arguments,
     * and one {@code FUNCTION_ARG_TYPE_MISMATCH} per offending position of the first overload of
     * the right arity.
     * </p>
     *
     * @param call    the call to check
     * @param context source of argument types
     * @return the diagnostics of the call, empty when it is well typed
     */
    public List<Diagnostic> typecheck(FunctionCall call, TypingContext context) {
        Objects.requireNonNull(call, "call is required");
        Objects.requireNonNull(context, "context is required");
        FunctionSignature signature = functions.get(call.name());
        if (signature == null) {
            return List.of(Diagnostic.of(DiagnosticCode.UNKNOWN_FUNCTION, call.id(), call.name(),
                    "Unknown function '" + call.name() + "'"));
        }

        List<Expression> arguments = call.arguments();
        List<Parameters> candidates = new ArrayList<>();
        for (Parameters overload : signature.overloads()) {
            if (overload.acceptsArity(arguments.size())) {
                candidates.add(overload);
            }
        }
        if (candidates.isEmpty()) {
            return List.of(Diagnostic.of(DiagnosticCode.FUNCTION_ARITY_MISMATCH, call.id(), call.name(),
                    "Function '" + call.name() + "' does not accept " + arguments.size()
                            + " argument(s), expected " + signature.overloads()));
        }

        List<Diagnostic> firstMismatches = null;
        for (Parameters overload : candidates) {
            List<Diagnostic> mismatches = mismatches(call, overload, arguments, context);
            if (mismatches.isEmpty()) {
                return List.of();
            }
            if (firstMismatches == null) {
                firstMismatches = mismatches;
            }
        }
        return List.copyOf(firstMismatches);
    }

    private static List<Diagnostic> mismatches(FunctionCall call, Parameters overload,
                                               List<Expression> arguments, TypingContext context) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (int i = 0; i < arguments.size(); i++) {
            Set<ValueType> expected = overload.typesAt(i);
            Set<ValueType> actual = arguments.get(i).possibleTypes(context);
            if (!actual.isEmpty() && !ValueType.overlaps(expected, actual)) {
                diagnostics.add(Diagnostic.at(DiagnosticCode.FUNCTION_ARG_TYPE_MISMATCH, call.id(), call.name(), i,
                        "Argument " + i + " of '" + call.name() + "' expects " + ValueType.describe(expected)
                                + " but got " + ValueType.describe(actual)));
            }
        }
        return diagnostics;
    }

    private static void registerBuiltins(FunctionRegistry registry) {
        Set<ValueType> number = ValueType.of(NUMBER);
        Set<ValueType> message = ValueType.of(MESSAGE);
        Set<ValueType> primitive = ValueType.primitive();
        Set<ValueType> composite = ValueType.composite();

        for (String name : List.of("abs", "sqrt", "ceil", "floor", "sin", "cos", "tan",
                "asin", "acos", "atan", "deg", "rad")) {
            registry.register(FunctionSignature.of(name, NUMBER, Parameters.of(number)));
        }
        registry.register(FunctionSignature.of("log", NUMBER, Parameters.of(number, number)));
        registry.register(FunctionSignature.of("atan2", NUMBER, Parameters.of(number, number)));

        registry.register(FunctionSignature.of("bool", BOOL, Parameters.of(primitive)));
        registry.register(FunctionSignature.of("int", NUMBER, Parameters.of(primitive)));
        registry.register(FunctionSignature.of("float", NUMBER, Parameters.of(primitive)));
        registry.register(FunctionSignature.of("str", STRING, Parameters.of(primitive)));

        for (String name : List.of("len", "sum", "prod")) {
            registry.register(FunctionSignature.of(name, NUMBER, Parameters.of(composite)));
        }
        for (String name : List.of("x", "y", "z")) {
            registry.register(FunctionSignature.of(name, NUMBER, Parameters.of(message)));
        }
        for (String name : List.of("max", "min", "gcd")) {
            registry.register(FunctionSignature.of(name, NUMBER,
                    Parameters.of(composite), Parameters.variadic(number, number)));
        }
        for (String name : List.of("roll", "pitch", "yaw")) {
            registry.register(FunctionSignature.of(name, NUMBER,
                    Parameters.of(message), Parameters.of(number, number, number, number)));
        }
    }
}
