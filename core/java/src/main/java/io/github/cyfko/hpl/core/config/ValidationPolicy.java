package io.github.cyfko.hpl.core.config;

import io.github.cyfko.hpl.core.spi.SchemaProvider;

import java.util.Optional;

/**
 * Validation policy: how strictly properties are checked before being accepted.
 * <p>
 * Policies are immutable and safe to share between validators running in parallel.
 * </p>
 *
 * <h2>Predefined Policies</h2>
 * <ul>
 *   <li>{@link #defaults()}: default pattern catalog, warnings do not block acceptance</li>
 *   <li>{@link #strict()}: also reports predicates that never read their own message, and any
 *       warning blocks acceptance</li>
 *   <li>{@link #relaxed()}: permissive pattern catalog, no optional warning</li>
 * </ul>
 *
 * <h2>Custom Policy</h2>
 * <pre>{@code
 * ValidationPolicy policy = ValidationPolicy.builder()
 *     .patternCatalog(PatternCatalog.defaults())
 *     .schemaProvider(channel -> schemas.lookup(channel))
 *     .warnOnIgnoredOwnMessage(true)
 *     .build();
 * }</pre>
 *
 * @param policyName              identifies the policy in logs
 * @param patternCatalog          per-pattern sanity rules
 * @param warnOnIgnoredOwnMessage whether a predicate that never reads its own message is reported
 * @param warningsAsErrors        whether warnings block acceptance
 * @param schemaProvider          source of message schemas, {@code null} for structural typing only
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ValidationPolicy(
        String policyName,
        PatternCatalog patternCatalog,
        boolean warnOnIgnoredOwnMessage,
        boolean warningsAsErrors,
        SchemaProvider schemaProvider
) {

    public ValidationPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (patternCatalog == null) {
            throw new IllegalArgumentException("patternCatalog is required");
        }
    }

    public static ValidationPolicy defaults() {
        return new ValidationPolicy(PolicyName.DEFAULT_POLICY.name(), PatternCatalog.defaults(), false, false, null);
    }

    public static ValidationPolicy strict() {
        return new ValidationPolicy(PolicyName.STRICT_POLICY.name(), PatternCatalog.defaults(), true, true, null);
    }

    public static ValidationPolicy relaxed() {
        return new ValidationPolicy(PolicyName.RELAXED_POLICY.name(), PatternCatalog.permissive(), false, false, null);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the schema provider, empty when fields are typed structurally
     */
    public Optional<SchemaProvider> schemas() {
        return Optional.ofNullable(schemaProvider);
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private PatternCatalog _patternCatalog = PatternCatalog.defaults();
        private boolean _warnOnIgnoredOwnMessage = false;
        private boolean _warningsAsErrors = false;
        private SchemaProvider _schemaProvider;

        private Builder() {}

        public ValidationPolicy build() {
            return new ValidationPolicy(_policyName, _patternCatalog, _warnOnIgnoredOwnMessage, _warningsAsErrors, _schemaProvider);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder patternCatalog(PatternCatalog patternCatalog) { this._patternCatalog = patternCatalog; return this; }
        public Builder warnOnIgnoredOwnMessage(boolean warn) { this._warnOnIgnoredOwnMessage = warn; return this; }
        public Builder warningsAsErrors(boolean warningsAsErrors) { this._warningsAsErrors = warningsAsErrors; return this; }
        public Builder schemaProvider(SchemaProvider schemaProvider) { this._schemaProvider = schemaProvider; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
