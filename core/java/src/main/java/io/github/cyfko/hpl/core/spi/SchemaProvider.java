package io.github.cyfko.hpl.core.spi;

import java.util.Optional;

/**
 * Source of message schemas, keyed by channel.
 * <p>
 * Validation works structurally without schemas: field accesses may then be of any field type.
 * When a provider is configured, accesses to unknown fields are reported and field types take
 * part in comparison typing.
 * </p>
 *
 * <pre>{@code
 * SchemaProvider provider = channel -> "/odom".equals(channel)
 *     ? Optional.of(path -> path.equals(List.of("pose", "x")) ? Optional.of(ValueType.NUMBER) : Optional.empty())
 *     : Optional.empty();
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface SchemaProvider {

    /**
     * @param channel a channel name
     * @return the schema of the messages on that channel, empty when unknown
     */
    Optional<MessageSchema> schemaFor(String channel);

    /**
     * @return a provider that knows no channel
     */
    static SchemaProvider none() {
        return channel -> Optional.empty();
    }
}
