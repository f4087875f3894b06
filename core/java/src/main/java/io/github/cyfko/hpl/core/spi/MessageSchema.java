package io.github.cyfko.hpl.core.spi;

import io.github.cyfko.hpl.core.api.ValueType;

import java.util.List;
import java.util.Optional;

/**
 * Field types of the messages published on one channel.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface MessageSchema {

    /**
     * @param path field path, outermost field first
     * @return the type of the field, empty when the message has no such field
     */
    Optional<ValueType> fieldType(List<String> path);
}
