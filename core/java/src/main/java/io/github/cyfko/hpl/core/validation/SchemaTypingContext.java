package io.github.cyfko.hpl.core.validation;

import io.github.cyfko.hpl.core.api.ValueType;
import io.github.cyfko.hpl.core.ast.Property;
import io.github.cyfko.hpl.core.ast.event.AtomicEvent;
import io.github.cyfko.hpl.core.ast.event.Event;
import io.github.cyfko.hpl.core.ast.expr.FieldAccess;
import io.github.cyfko.hpl.core.ast.expr.TypingContext;
import io.github.cyfko.hpl.core.spi.FunctionRegistry;
import io.github.cyfko.hpl.core.spi.MessageSchema;
import io.github.cyfko.hpl.core.spi.SchemaProvider;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Types field accesses from the message schemas of the channels they read.
 * <p>
 * A field access reads the channel of its own event, or the channels bound to its alias. When
 * one of those channels has no schema, or the alias is unbound, the field keeps every field type.
 * A provider or schema answering {@code null} is read as "unknown".
 * </p>
 */
final class SchemaTypingContext implements TypingContext {

    private final TypingContext functions;
    private final SchemaProvider provider;
    private final Map<FieldAccess, List<String>> channels = new IdentityHashMap<>();
    private final Map<String, Optional<MessageSchema>> schemas = new HashMap<>();

    SchemaTypingContext(Property property, AliasTable aliases, SchemaProvider provider, FunctionRegistry registry) {
        this.functions = TypingContext.structural(registry);
        this.provider = provider;
        for (Event event : property.events()) {
            for (AtomicEvent atomic : event.atomicEvents()) {
                if (atomic.predicate() == null) {
                    continue;
                }
                String own = atomic.alias().orElse(null);
                for (FieldAccess access : atomic.predicate().fieldAccesses()) {
                    channels.put(access, access.readsOwnMessage(own)
                            ? List.of(atomic.channel())
                            : aliases.channelsOf(access.alias().orElseThrow()));
                }
            }
        }
    }

    Optional<MessageSchema> schemaOf(String channel) {
        return schemas.computeIfAbsent(channel, c -> orEmpty(provider.schemaFor(c)));
    }

    private static <T> Optional<T> orEmpty(Optional<T> answer) {
        return answer == null ? Optional.empty() : answer;
    }

    /**
     * @return {@code true} when every channel read by the access has a schema and none has the field
     */
    boolean isUnknownField(FieldAccess access) {
        List<String> read = channels.getOrDefault(access, List.of());
        if (read.isEmpty()) {
            return false;
        }
        for (String channel : read) {
            Optional<MessageSchema> schema = schemaOf(channel);
            if (schema.isEmpty() || orEmpty(schema.get().fieldType(access.path())).isPresent()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public Set<ValueType> fieldTypes(FieldAccess access) {
        List<String> read = channels.getOrDefault(access, List.of());
        if (read.isEmpty()) {
            return ValueType.field();
        }
        EnumSet<ValueType> types = EnumSet.noneOf(ValueType.class);
        for (String channel : read) {
            Optional<MessageSchema> schema = schemaOf(channel);
            if (schema.isEmpty()) {
                return ValueType.field();
            }
            orEmpty(schema.get().fieldType(access.path())).ifPresent(types::add);
        }
        return types;
    }

    @Override
    public Set<ValueType> returnTypes(String function) {
        return functions.returnTypes(function);
    }
}
