package io.github.cyfko.hpl.core.api;

/**
 * Severity of a validation diagnostic.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum Severity {

    /** The property is rejected. */
    ERROR,

    /** The property is accepted but probably not what its author meant. */
    WARNING
}
