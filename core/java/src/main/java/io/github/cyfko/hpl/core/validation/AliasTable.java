package io.github.cyfko.hpl.core.validation;

import io.github.cyfko.hpl.core.ast.event.AtomicEvent;
import io.github.cyfko.hpl.core.ast.event.Event;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Aliases bound by the events of one property, in binding order.
 * <p>
 * An alias maps to the atomic event that binds it, or to the enclosing event disjunction when
 * several of its disjuncts bind the same alias. The table is derived on each validation and never
 * stored in the tree.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class AliasTable {

    private static final AliasTable EMPTY = new AliasTable(Map.of());

    private final Map<String, Event> bindings;

    AliasTable(Map<String, Event> bindings) {
        this.bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
    }

    public static AliasTable empty() {
        return EMPTY;
    }

    /**
     * @return the bound aliases, in binding order
     */
    public List<String> aliases() {
        return List.copyOf(bindings.keySet());
    }

    public Optional<Event> bindingOf(String alias) {
        return Optional.ofNullable(bindings.get(alias));
    }

    public boolean contains(String alias) {
        return bindings.containsKey(alias);
    }

    /**
     * Lists the channels an alias may denote a message of.
     *
     * @param alias a bound alias
     * @return the channels of the atomic events binding the alias, empty when unbound
     */
    public List<String> channelsOf(String alias) {
        Event event = bindings.get(alias);
        if (event == null) {
            return List.of();
        }
        return event.atomicEvents().stream()
                .filter(atomic -> atomic.alias().map(alias::equals).orElse(false))
                .map(AtomicEvent::channel)
                .toList();
    }

    public Map<String, Event> asMap() {
        return bindings;
    }

    public int size() {
        return bindings.size();
    }

    public boolean isEmpty() {
        return bindings.isEmpty();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("AliasTable{");
        boolean first = true;
        for (Map.Entry<String, Event> entry : bindings.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append("=").append(entry.getValue().id());
            first = false;
        }
        return sb.append('}').toString();
    }
}
