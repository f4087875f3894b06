package io.github.cyfko.hpl.core.validation;

import io.github.cyfko.hpl.core.api.Diagnostic;
import io.github.cyfko.hpl.core.ast.Property;
import io.github.cyfko.hpl.core.ast.Specification;
import io.github.cyfko.hpl.core.ast.expr.TypingContext;
import io.github.cyfko.hpl.core.config.PatternRules;
import io.github.cyfko.hpl.core.config.ValidationPolicy;
import io.github.cyfko.hpl.core.exception.PropertyValidationException;
import io.github.cyfko.hpl.core.spi.FunctionRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Decides whether a property tree is well formed before a monitor generator consumes it.
 * <p>
 * Validation never throws for mistakes in the property: it walks the whole tree and accumulates
 * every problem as a {@link Diagnostic}. Three passes run in this order, and their diagnostics
 * appear in the report in the same order:
 * </p>
 * <ol>
 *   <li><b>Structural</b>: empty slots, disjunction arity and channel uniqueness, operand types,
 *       function signatures, pattern slots, and field existence when message schemas are known.</li>
 *   <li><b>Binding</b>: every alias reference resolves to an alias bound earlier, no alias is
 *       bound twice.</li>
 *   <li><b>Pattern sanity</b>: warnings configured by the {@link ValidationPolicy}.</li>
 * </ol>
 *
 * <p><strong>Concurrency:</strong> a validator holds only immutable state and a frozen function
 * registry. Distinct trees may be validated in parallel with the same validator.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * PropertyValidator validator = new PropertyValidator(ValidationPolicy.defaults());
 *
 * ValidationReport report = validator.validate(property);   // pure
 * ValidationOutcome outcome = validator.accept(property);   // freezes accepted trees
 * Property ready = validator.requireAccepted(property);     // throws when rejected
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class PropertyValidator {

    private static final Logger log = Logger.getLogger(PropertyValidator.class.getName());

    private final ValidationPolicy policy;
    private final FunctionRegistry registry;

    public PropertyValidator() {
        this(ValidationPolicy.defaults());
    }

    public PropertyValidator(ValidationPolicy policy) {
        this(policy, FunctionRegistry.global());
    }

    /**
     * Creates a validator and freezes the given registry.
     *
     * @param policy   the validation policy
     * @param registry the functions predicates may call
     */
    public PropertyValidator(ValidationPolicy policy, FunctionRegistry registry) {
        this.policy = Objects.requireNonNull(policy, "policy is required");
        this.registry = Objects.requireNonNull(registry, "registry is required");
        registry.freeze();
    }

    public ValidationPolicy getPolicy() {
        return policy;
    }

    public FunctionRegistry getRegistry() {
        return registry;
    }

    /**
     * Validates a property without modifying it.
     *
     * @param property the property to validate
     * @return every diagnostic found
     */
    public ValidationReport validate(Property property) {
        return analyze(property).report;
    }

    /**
     * Validates a property and freezes it when accepted.
     *
     * @param property the property to validate
     * @return the report, the frozen property when accepted, and the alias table
     */
    public ValidationOutcome accept(Property property) {
        Analysis analysis = analyze(property);
        if (!analysis.report.isAccepted()) {
            return new ValidationOutcome(analysis.report, Optional.empty(), analysis.aliases);
        }
        property.freeze();
        return new ValidationOutcome(analysis.report, Optional.of(property), analysis.aliases);
    }

    /**
     * Accepts a property or fails.
     *
     * @param property the property to validate
     * @return the same property, frozen
     * @throws PropertyValidationException if the property is rejected
     */
    public Property requireAccepted(Property property) {
        ValidationOutcome outcome = accept(property);
        return outcome.accepted().orElseThrow(() -> new PropertyValidationException(outcome.report()));
    }

    /**
     * Validates every property of a specification, independently.
     *
     * @param specification the properties to validate
     * @return one report per property, in order
     */
    public List<ValidationReport> validateAll(Specification specification) {
        Objects.requireNonNull(specification, "specification is required");
        List<ValidationReport> reports = new ArrayList<>();
        for (Property property : specification.properties()) {
            reports.add(validate(property));
        }
        return reports;
    }

    private Analysis analyze(Property property) {
        Objects.requireNonNull(property, "property is required");
        PatternRules rules = policy.patternCatalog().rulesFor(property.pattern());

        BindingPass binding = BindingPass.run(property);
        AliasTable aliases = binding.aliasTable();

        SchemaTypingContext schemas = policy.schemas()
                .map(provider -> new SchemaTypingContext(property, aliases, provider, registry))
                .orElse(null);
        TypingContext context = schemas != null ? schemas : TypingContext.structural(registry);

        List<Diagnostic> diagnostics = new ArrayList<>(StructuralPass.run(property, rules, registry, context, schemas));
        diagnostics.addAll(binding.diagnostics());
        diagnostics.addAll(PatternSanityPass.run(property, rules, policy.warnOnIgnoredOwnMessage()));

        ValidationReport report = ValidationReport.of(diagnostics, policy.warningsAsErrors());
        log.fine(() -> String.format("Validated property %s under %s: %d error(s), %d warning(s)",
                property.uid().orElse(property.id().toString()), policy.policyName(),
                report.getErrors().size(), report.getWarnings().size()));
        return new Analysis(report, aliases);
    }

    private record Analysis(ValidationReport report, AliasTable aliases) {
    }
}
