package io.github.cyfko.hpl.core.api;

import io.github.cyfko.hpl.core.exception.AstConstructionException;
import io.github.cyfko.hpl.core.exception.ConstructionError;

/**
 * Quantifiers over the elements of a domain.
 *
 * <p><strong>Keyword mappings:</strong></p>
 * <ul>
 *     <li>FORALL / forall</li>
 *     <li>EXISTS / exists</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum QuantifierKind {

    /** Universal quantifier: "forall" */
    FORALL("forall"),

    /** Existential quantifier: "exists" */
    EXISTS("exists");

    private final String keyword;

    QuantifierKind(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }

    /**
     * Finds a quantifier by its keyword or name, ignoring case.
     *
     * @param value keyword or name to search for
     * @return the matching quantifier
     * @throws AstConstructionException if no quantifier matches
     * @throws NullPointerException     if {@code value} is {@code null}
     */
    public static QuantifierKind fromString(String value) {
        String trimmed = value.trim();
        for (QuantifierKind kind : values()) {
            if (kind.keyword.equalsIgnoreCase(trimmed) || kind.name().equalsIgnoreCase(trimmed)) {
                return kind;
            }
        }
        throw new AstConstructionException(ConstructionError.UNKNOWN_OPERATOR, trimmed,
                "Unknown quantifier '" + trimmed + "'");
    }
}
