package io.github.cyfko.hpl.core.validation;

import io.github.cyfko.hpl.core.api.ComparisonOperator;
import io.github.cyfko.hpl.core.api.Diagnostic;
import io.github.cyfko.hpl.core.api.DiagnosticCode;
import io.github.cyfko.hpl.core.api.ValueType;
import io.github.cyfko.hpl.core.ast.PatternKind;
import io.github.cyfko.hpl.core.ast.Predicate;
import io.github.cyfko.hpl.core.ast.Property;
import io.github.cyfko.hpl.core.ast.Scope;
import io.github.cyfko.hpl.core.ast.Specification;
import io.github.cyfko.hpl.core.ast.event.AtomicEvent;
import io.github.cyfko.hpl.core.ast.event.EventDisjunction;
import io.github.cyfko.hpl.core.ast.expr.And;
import io.github.cyfko.hpl.core.ast.expr.ArrayAccess;
import io.github.cyfko.hpl.core.ast.expr.Comparison;
import io.github.cyfko.hpl.core.ast.expr.Expression;
import io.github.cyfko.hpl.core.ast.expr.FieldAccess;
import io.github.cyfko.hpl.core.ast.expr.FunctionCall;
import io.github.cyfko.hpl.core.ast.expr.Literal;
import io.github.cyfko.hpl.core.ast.expr.Not;
import io.github.cyfko.hpl.core.ast.expr.Quantifier;
import io.github.cyfko.hpl.core.ast.expr.RangeValue;
import io.github.cyfko.hpl.core.ast.expr.SetValue;
import io.github.cyfko.hpl.core.ast.expr.VariableReference;
import io.github.cyfko.hpl.core.config.PatternCatalog;
import io.github.cyfko.hpl.core.config.PatternRules;
import io.github.cyfko.hpl.core.config.ValidationPolicy;
import io.github.cyfko.hpl.core.exception.PropertyValidationException;
import io.github.cyfko.hpl.core.spi.FunctionRegistry;
import io.github.cyfko.hpl.core.spi.FunctionSignature;
import io.github.cyfko.hpl.core.spi.MessageSchema;
import io.github.cyfko.hpl.core.spi.SchemaProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Test suite for {@link PropertyValidator}.
 * <p>
 * Covers the three passes (structure, alias binding, pattern sanity), the acceptance lifecycle and
 * schema-aware typing with a mocked {@link SchemaProvider}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@DisplayName("PropertyValidator Tests")
class PropertyValidatorTest {

    private PropertyValidator validator;

    @BeforeEach
    void setUp() {
        validator = new PropertyValidator();
    }

    private static Predicate where(Expression condition) {
        return new Predicate(condition);
    }

    private static Expression sameId(String alias) {
        return new Comparison(ComparisonOperator.EQ, FieldAccess.self("id"), FieldAccess.of(alias, "id"));
    }

    private static Expression positive(String field) {
        return new Comparison(ComparisonOperator.GT, FieldAccess.self(field), Literal.of(0));
    }

    private static List<DiagnosticCode> codes(ValidationReport report) {
        return report.getDiagnostics().stream().map(Diagnostic::code).toList();
    }

    // ========== Alias Binding Tests ==========

    @Nested
    @DisplayName("Alias binding")
    class AliasBinding {

        @Test
        @DisplayName("Should report a reference to an alias bound nowhere")
        void testUnboundAlias() {
            Property property = Property.requirement(Scope.globally(),
                    AtomicEvent.on("a", null, "x"),
                    AtomicEvent.on("b", where(sameId("y"))));

            ValidationReport report = validator.validate(property);

            assertEquals(1, report.getErrors().size());
            Diagnostic error = report.getErrors().get(0);
            assertEquals(DiagnosticCode.UNBOUND_ALIAS, error.code());
            assertEquals("y", error.subject());
            assertFalse(report.isAccepted());
        }

        @Test
        @DisplayName("Should accept a reference to the trigger alias")
        void testBoundAlias() {
            Property property = Property.requirement(Scope.globally(),
                    AtomicEvent.on("a", null, "x"),
                    AtomicEvent.on("b", where(sameId("x"))));

            ValidationReport report = validator.validate(property);

            assertTrue(report.getErrors().isEmpty());
            assertTrue(report.getWarnings().isEmpty());
            assertTrue(report.isAccepted());
        }

        @Test
        @DisplayName("Should report an unbound alias once per event")
        void testUnboundAliasReportedOnce() {
            Property property = Property.existence(Scope.globally(), AtomicEvent.on("/b",
                    where(And.of(sameId("ghost"), new Comparison(ComparisonOperator.GT,
                            FieldAccess.of("ghost", "t"), Literal.of(1))))));

            ValidationReport report = validator.validate(property);

            assertEquals(1, report.withCode(DiagnosticCode.UNBOUND_ALIAS).size());
        }

        @Test
        @DisplayName("Should report an alias bound twice")
        void testDuplicateAlias() {
            AtomicEvent behaviour = AtomicEvent.on("/b", null, "x");
            Property property = Property.response(Scope.globally(), AtomicEvent.on("/a", null, "x"), behaviour);

            ValidationReport report = validator.validate(property);

            List<Diagnostic> duplicates = report.withCode(DiagnosticCode.DUPLICATE_ALIAS);
            assertEquals(1, duplicates.size());
            assertEquals("x", duplicates.get(0).subject());
            assertEquals(behaviour.id(), duplicates.get(0).node());
        }

        @Test
        @DisplayName("Should let the terminator see activator aliases only")
        void testTerminatorVisibility() {
            Property seesTrigger = Property.response(
                    Scope.afterUntil(AtomicEvent.on("/start", null, "s"), AtomicEvent.on("/stop", where(sameId("x")))),
                    AtomicEvent.on("/a", null, "x"),
                    AtomicEvent.on("/b", where(sameId("x"))));
            Property seesActivator = Property.response(
                    Scope.afterUntil(AtomicEvent.on("/start", null, "s"), AtomicEvent.on("/stop", where(sameId("s")))),
                    AtomicEvent.on("/a", null, "x"),
                    AtomicEvent.on("/b", where(sameId("x"))));

            List<Diagnostic> unbound = validator.validate(seesTrigger).withCode(DiagnosticCode.UNBOUND_ALIAS);

            assertEquals(1, unbound.size());
            assertEquals("x", unbound.get(0).subject());
            assertTrue(validator.validate(seesActivator).isAccepted());
        }

        @Test
        @DisplayName("Should bind an alias shared by disjuncts to the disjunction")
        void testSharedDisjunctionAlias() {
            EventDisjunction trigger = EventDisjunction.of(AtomicEvent.on("/a", null, "x"), AtomicEvent.on("/b", null, "x"));
            Property property = Property.response(Scope.globally(), trigger, AtomicEvent.on("/c", where(sameId("x"))));

            ValidationOutcome outcome = validator.accept(property);

            assertTrue(outcome.isAccepted());
            assertSame(trigger, outcome.aliasTable().bindingOf("x").orElseThrow());
            assertEquals(List.of("/a", "/b"), outcome.aliasTable().channelsOf("x"));
        }

        @Test
        @DisplayName("Should bind the trigger before the response of a requirement")
        void testRequirementBindingOrder() {
            AtomicEvent trigger = AtomicEvent.on("/a", null, "x");
            Property property = Property.requirement(Scope.globally(), trigger,
                    AtomicEvent.on("/b", where(sameId("x")), "y"));

            AliasTable aliases = validator.accept(property).aliasTable();

            assertEquals(List.of("x", "y"), aliases.aliases());
            assertSame(trigger, aliases.bindingOf("x").orElseThrow());
        }
    }

    // ========== Structural Tests ==========

    @Nested
    @DisplayName("Structure")
    class Structure {

        @Test
        @DisplayName("Should report a disjunct channel duplicated by an edit")
        void testDuplicateChannelAfterEdit() {
            AtomicEvent second = AtomicEvent.on("topic/y");
            EventDisjunction disjunction = EventDisjunction.of(AtomicEvent.on("topic/x"), second);
            Property property = Property.existence(Scope.globally(), disjunction);
            disjunction.replaceChild(second.id(), AtomicEvent.on("topic/x"));

            ValidationReport report = validator.validate(property);

            List<Diagnostic> duplicates = report.withCode(DiagnosticCode.NON_UNIQUE_DISJUNCT_CHANNEL);
            assertEquals(1, duplicates.size());
            assertEquals("topic/x", duplicates.get(0).subject());
            assertEquals(disjunction.id(), duplicates.get(0).node());
        }

        @Test
        @DisplayName("Should report an arity mismatch for a two-argument function")
        void testFunctionArity() {
            Property property = Property.existence(Scope.globally(), AtomicEvent.on("/imu", where(
                    new Comparison(ComparisonOperator.GT, FunctionCall.of("atan2", FieldAccess.self("y")), Literal.of(0)))));

            ValidationReport report = validator.validate(property);

            assertEquals(List.of(DiagnosticCode.FUNCTION_ARITY_MISMATCH), codes(report));
            assertEquals("atan2", report.getErrors().get(0).subject());
        }

        @Test
        @DisplayName("Should check calls against a custom registry")
        void testCustomRegistry() {
            FunctionRegistry registry = FunctionRegistry.withBuiltins();
            registry.register(FunctionSignature.of("dist", ValueType.NUMBER, FunctionSignature.Parameters.of(
                    ValueType.of(ValueType.MESSAGE), ValueType.of(ValueType.MESSAGE))));
            PropertyValidator custom = new PropertyValidator(ValidationPolicy.defaults(), registry);
            Property property = Property.existence(Scope.globally(), AtomicEvent.on("/odom", where(
                    new Comparison(ComparisonOperator.LT,
                            FunctionCall.of("dist", FieldAccess.self("pose"), FieldAccess.self("goal")), Literal.of(0.5)))));

            assertTrue(registry.isFrozen());
            assertTrue(custom.validate(property).isAccepted());
            assertTrue(validator.validate(property).hasCode(DiagnosticCode.UNKNOWN_FUNCTION));
        }

        @Test
        @DisplayName("Should report a comparison between incompatible types")
        void testTypeMismatch() {
            Property property = Property.existence(Scope.globally(), AtomicEvent.on("/status", where(
                    new Comparison(ComparisonOperator.LT, Literal.of("fast"), Literal.of(10)))));

            assertEquals(List.of(DiagnosticCode.TYPE_MISMATCH), codes(validator.validate(property)));
        }

        @Test
        @DisplayName("Should report slots emptied by moves")
        void testMissingChild() {
            Expression moved = positive("speed");
            Property property = Property.existence(Scope.globally(), AtomicEvent.on("/odom", where(new Not(moved))));

            And.of(moved, positive("altitude"));
            ValidationReport report = validator.validate(property);

            List<Diagnostic> missing = report.withCode(DiagnosticCode.MISSING_CHILD);
            assertEquals(1, missing.size());
            assertEquals("operand", missing.get(0).subject());
        }

        @Test
        @DisplayName("Should report a trigger moved out of a triggered pattern")
        void testMissingTrigger() {
            AtomicEvent trigger = AtomicEvent.on("/a", null, "x");
            Property property = Property.response(Scope.globally(), trigger, AtomicEvent.on("/b"));

            EventDisjunction.of(trigger, AtomicEvent.on("/c"));

            assertTrue(validator.validate(property).hasCode(DiagnosticCode.MISSING_TRIGGER));
        }

        @Test
        @DisplayName("Should report a trigger added to an untriggered pattern")
        void testUnexpectedTrigger() {
            Property property = Property.existence(Scope.globally(), AtomicEvent.on("/b"));
            property.setTrigger(AtomicEvent.on("/a"));

            assertEquals(List.of(DiagnosticCode.UNEXPECTED_TRIGGER), codes(validator.validate(property)));
        }

        @Test
        @DisplayName("Should honour catalog restrictions on disjunctions")
        void testDisjunctionNotAllowed() {
            PatternCatalog catalog = PatternCatalog.defaults().with(PatternKind.RESPONSE, new PatternRules(false, true, false));
            PropertyValidator restricted = new PropertyValidator(ValidationPolicy.builder().patternCatalog(catalog).build());
            Property property = Property.response(Scope.globally(),
                    EventDisjunction.of(AtomicEvent.on("/a"), AtomicEvent.on("/b")), AtomicEvent.on("/c"));

            List<Diagnostic> diagnostics = restricted.validate(property).withCode(DiagnosticCode.DISJUNCTION_NOT_ALLOWED);

            assertEquals(1, diagnostics.size());
            assertEquals("trigger", diagnostics.get(0).subject());
            assertTrue(validator.validate(property).isAccepted());
        }
    }

    // ========== Sanity Tests ==========

    @Nested
    @DisplayName("Pattern sanity")
    class Sanity {

        @Test
        @DisplayName("Should warn once when a requirement response ignores the trigger")
        void testSuspiciousUnboundResponse() {
            Property property = Property.requirement(Scope.globally(),
                    AtomicEvent.on("a", null, "x"),
                    AtomicEvent.on("b", where(positive("speed"))));

            ValidationReport report = validator.validate(property);

            assertTrue(report.getErrors().isEmpty());
            assertEquals(1, report.getWarnings().size());
            assertEquals(DiagnosticCode.SUSPICIOUS_UNBOUND_RESPONSE, report.getWarnings().get(0).code());
            assertEquals(property.behaviour().id(), report.getWarnings().get(0).node());
            assertTrue(report.isAccepted());
        }

        @Test
        @DisplayName("Should reject warnings under the strict policy")
        void testStrictPolicy() {
            Property property = Property.requirement(Scope.globally(),
                    AtomicEvent.on("a", null, "x"),
                    AtomicEvent.on("b", where(positive("speed"))));

            ValidationReport report = new PropertyValidator(ValidationPolicy.strict()).validate(property);

            assertTrue(report.getErrors().isEmpty());
            assertEquals(1, report.getWarnings().size());
            assertFalse(report.isAccepted());
        }

        @Test
        @DisplayName("Should not warn for response patterns by default")
        void testResponseNotWarned() {
            Property property = Property.response(Scope.globally(),
                    AtomicEvent.on("a", null, "x"),
                    AtomicEvent.on("b", where(positive("speed"))));

            assertTrue(validator.validate(property).getDiagnostics().isEmpty());
        }

        @Test
        @DisplayName("Should warn on predicates that never read their own message")
        void testPredicateIgnoresOwnMessage() {
            Predicate foreign = where(new Comparison(ComparisonOperator.GT, FieldAccess.of("x", "t"), Literal.of(0)));
            Property property = Property.response(Scope.globally(),
                    AtomicEvent.on("/a", where(positive("t")), "x"),
                    AtomicEvent.on("/b", foreign));

            ValidationReport strict = new PropertyValidator(ValidationPolicy.strict()).validate(property);

            List<Diagnostic> warnings = strict.withCode(DiagnosticCode.PREDICATE_IGNORES_OWN_MESSAGE);
            assertEquals(1, warnings.size());
            assertEquals(foreign.id(), warnings.get(0).node());
            assertEquals("/b", warnings.get(0).subject());
            assertFalse(validator.validate(property).hasCode(DiagnosticCode.PREDICATE_IGNORES_OWN_MESSAGE));
        }
    }

    // ========== Acceptance Tests ==========

    @Nested
    @DisplayName("Acceptance")
    class Acceptance {

        @Test
        @DisplayName("Should freeze accepted properties")
        void testAcceptFreezes() {
            Property property = Property.absence(Scope.globally(), AtomicEvent.on("/collision"));

            ValidationOutcome outcome = validator.accept(property);

            assertTrue(outcome.isAccepted());
            assertSame(property, outcome.accepted().orElseThrow());
            assertTrue(property.isFrozen());
            assertTrue(property.behaviour().isFrozen());
        }

        @Test
        @DisplayName("Should leave rejected properties editable")
        void testRejectedStaysMutable() {
            Property property = Property.existence(Scope.globally(), AtomicEvent.on("/b", where(sameId("ghost"))));

            ValidationOutcome outcome = validator.accept(property);

            assertFalse(outcome.isAccepted());
            assertTrue(outcome.accepted().isEmpty());
            assertFalse(property.isFrozen());
            assertDoesNotThrow(() -> property.setBehaviour(AtomicEvent.on("/b")));
            assertTrue(validator.accept(property).isAccepted());
        }

        @Test
        @DisplayName("Should throw with the report when acceptance is required")
        void testRequireAccepted() {
            Property property = Property.existence(Scope.globally(), AtomicEvent.on("/b", where(sameId("ghost"))));

            PropertyValidationException exception = assertThrows(PropertyValidationException.class,
                    () -> validator.requireAccepted(property));

            assertTrue(exception.getReport().hasCode(DiagnosticCode.UNBOUND_ALIAS));
            assertTrue(exception.getMessage().startsWith("Property rejected with 1 error(s)"));
        }

        @Test
        @DisplayName("Should validate every property of a specification")
        void testValidateAll() {
            Specification specification = new Specification(List.of(
                    Property.absence(Scope.globally(), AtomicEvent.on("/collision")),
                    Property.existence(Scope.globally(), AtomicEvent.on("/b", where(sameId("ghost"))))));

            List<ValidationReport> reports = validator.validateAll(specification);

            assertEquals(2, reports.size());
            assertTrue(reports.get(0).isAccepted());
            assertFalse(reports.get(1).isAccepted());
        }
    }

    // ========== Quantified Variable Tests ==========

    @Nested
    @DisplayName("Quantified variables")
    class QuantifiedVariables {

        private Expression greater(Expression left, Number bound) {
            return new Comparison(ComparisonOperator.GT, left, Literal.of(bound));
        }

        private RangeValue upTo(Expression max) {
            return RangeValue.closed(Literal.of(0), max);
        }

        @Test
        @DisplayName("Should report a variable bound by no quantifier")
        void testUnboundVariable() {
            Property property = Property.existence(Scope.globally(),
                    AtomicEvent.on("/scan", where(greater(VariableReference.of("i"), 0))));

            ValidationReport report = validator.validate(property);

            assertEquals(List.of(DiagnosticCode.UNBOUND_VARIABLE), codes(report));
            assertEquals("i", report.getErrors().get(0).subject());
            assertFalse(report.isAccepted());
        }

        @Test
        @DisplayName("Should report a variable read in its own domain")
        void testVariableInOwnDomain() {
            Property property = Property.existence(Scope.globally(), AtomicEvent.on("/scan", where(
                    Quantifier.forall("i", upTo(VariableReference.of("i")), greater(VariableReference.of("i"), 0)))));

            ValidationReport report = validator.validate(property);

            assertEquals(List.of(DiagnosticCode.UNBOUND_VARIABLE), codes(report));
            assertTrue(report.getErrors().get(0).message().contains("domain"));
        }

        @Test
        @DisplayName("Should report a variable bound again by a nested quantifier")
        void testShadowedVariable() {
            // Given
            Quantifier inner = Quantifier.exists("i", upTo(Literal.of(1)), greater(VariableReference.of("i"), 1));
            Quantifier outer = Quantifier.forall("i", upTo(Literal.of(3)),
                    And.of(greater(VariableReference.of("i"), 0), inner));
            Property property = Property.existence(Scope.globally(), AtomicEvent.on("/scan", where(outer)));

            // When
            ValidationReport report = validator.validate(property);

            // Then
            assertEquals(List.of(DiagnosticCode.SHADOWED_VARIABLE), codes(report));
            assertEquals(inner.id(), report.getErrors().get(0).node());
        }

        @Test
        @DisplayName("Should warn about a variable its condition never reads")
        void testUnusedVariable() {
            Property property = Property.existence(Scope.globally(), AtomicEvent.on("/scan", where(
                    Quantifier.exists("j", upTo(Literal.of(3)), positive("speed")))));

            ValidationReport report = validator.validate(property);

            assertEquals(List.of(DiagnosticCode.UNUSED_VARIABLE), codes(report));
            assertEquals(1, report.getWarnings().size());
            assertTrue(report.isAccepted());
        }

        @Test
        @DisplayName("Should accept quantifiers over an array field")
        void testQuantifiedArray() {
            Property property = Property.existence(Scope.globally(), AtomicEvent.on("/scan", where(And.of(
                    Quantifier.forall("i", upTo(Literal.of(3)),
                            greater(new ArrayAccess(FieldAccess.self("ranges"), VariableReference.of("i")), 0.1)),
                    Quantifier.exists("r", FieldAccess.self("ranges"), greater(VariableReference.of("r"), 2))))));

            ValidationReport report = validator.validate(property);

            assertTrue(report.getDiagnostics().isEmpty());
            assertTrue(report.isAccepted());
        }

        @Test
        @DisplayName("Should report a variable used as another type than its domain elements")
        void testVariableTypeMismatch() {
            Property property = Property.existence(Scope.globally(), AtomicEvent.on("/status", where(
                    Quantifier.exists("x", new SetValue(List.of(Literal.of("idle"), Literal.of("busy"))),
                            greater(VariableReference.of("x"), 0)))));

            ValidationReport report = validator.validate(property);

            assertEquals(List.of(DiagnosticCode.TYPE_MISMATCH), codes(report));
            assertEquals("x", report.getErrors().get(0).subject());
        }
    }

    // ========== Reference Type Tests ==========

    @Nested
    @DisplayName("Reference types")
    class ReferenceTypeAgreement {

        @Test
        @DisplayName("Should report a field read both as a number and as a string")
        void testConflictingReads() {
            Property property = Property.existence(Scope.globally(), AtomicEvent.on("/odom", where(And.of(
                    positive("speed"),
                    new Comparison(ComparisonOperator.EQ, FieldAccess.self("speed"), Literal.of("fast"))))));

            ValidationReport report = validator.validate(property);

            assertEquals(List.of(DiagnosticCode.TYPE_MISMATCH), codes(report));
            assertEquals("speed", report.getErrors().get(0).subject());
        }

        @Test
        @DisplayName("Should accept reads of one field with one type")
        void testConsistentReads() {
            Property property = Property.existence(Scope.globally(), AtomicEvent.on("/odom", where(And.of(
                    positive("speed"),
                    new Comparison(ComparisonOperator.LT, FieldAccess.self("speed"), Literal.of(10)),
                    new Comparison(ComparisonOperator.NE, FieldAccess.self("frame"), Literal.of("map"))))));

            assertTrue(validator.validate(property).getDiagnostics().isEmpty());
        }

        @Test
        @DisplayName("Should check each event predicate on its own")
        void testReadsInSeparateEvents() {
            Property property = Property.response(Scope.globally(),
                    AtomicEvent.on("/odom", where(positive("speed"))),
                    AtomicEvent.on("/cmd", where(new Comparison(ComparisonOperator.EQ,
                            FieldAccess.self("speed"), Literal.of("stop")))));

            assertFalse(validator.validate(property).hasCode(DiagnosticCode.TYPE_MISMATCH));
        }
    }

    // ========== Determinism Tests ==========

    @Test
    @DisplayName("Should produce identical reports for repeated validations")
    void testDeterminism() {
        Property property = Property.response(
                Scope.until(AtomicEvent.on("/stop", where(sameId("nobody")))),
                AtomicEvent.on("/a", null, "x"),
                AtomicEvent.on("/b", where(And.of(sameId("y"), new Comparison(ComparisonOperator.LT,
                        Literal.of("s"), Literal.of(1))))));

        ValidationReport first = validator.validate(property);
        ValidationReport second = validator.validate(property);

        assertEquals(first, second);
        assertEquals(List.of(DiagnosticCode.TYPE_MISMATCH, DiagnosticCode.UNBOUND_ALIAS, DiagnosticCode.UNBOUND_ALIAS),
                codes(first));
    }

    @Test
    @DisplayName("Should validate concurrently with the same results")
    void testConcurrentValidation() throws Exception {
        List<Property> properties = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            properties.add(Property.requirement(Scope.globally(),
                    AtomicEvent.on("/a" + i, null, "x"),
                    AtomicEvent.on("/b" + i, where(sameId(i % 2 == 0 ? "x" : "y")))));
        }
        List<ValidationReport> expected = properties.stream().map(validator::validate).toList();

        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<ValidationReport>> futures = new ArrayList<>();
            for (Property property : properties) {
                futures.add(executor.submit(() -> validator.validate(property)));
            }
            for (int i = 0; i < properties.size(); i++) {
                assertEquals(expected.get(i), futures.get(i).get());
            }
        } finally {
            executor.shutdownNow();
        }
    }

    // ========== Schema Tests ==========

    @Nested
    @DisplayName("Message schemas")
    class Schemas {

        @Mock
        private SchemaProvider provider;

        @Mock
        private MessageSchema odometry;

        private PropertyValidator schemaValidator;

        @BeforeEach
        void setUp() {
            MockitoAnnotations.openMocks(this);
            when(provider.schemaFor("/odom")).thenReturn(Optional.of(odometry));
            when(odometry.fieldType(List.of("speed"))).thenReturn(Optional.of(ValueType.NUMBER));
            when(odometry.fieldType(List.of("frame"))).thenReturn(Optional.of(ValueType.STRING));
            schemaValidator = new PropertyValidator(ValidationPolicy.builder().schemaProvider(provider).build());
        }

        @Test
        @DisplayName("Should accept fields known to the schema")
        void testKnownField() {
            Property property = Property.existence(Scope.globally(), AtomicEvent.on("/odom", where(positive("speed"))));

            assertTrue(schemaValidator.validate(property).getDiagnostics().isEmpty());
            verify(provider, times(1)).schemaFor("/odom");
        }

        @Test
        @DisplayName("Should report fields missing from the schema")
        void testUnknownField() {
            Property property = Property.existence(Scope.globally(), AtomicEvent.on("/odom", where(positive("sped"))));

            ValidationReport report = schemaValidator.validate(property);

            assertEquals(List.of(DiagnosticCode.UNKNOWN_FIELD), codes(report));
            assertEquals("sped", report.getErrors().get(0).subject());
        }

        @Test
        @DisplayName("Should type fields from the schema")
        void testSchemaTypeMismatch() {
            Property property = Property.existence(Scope.globally(), AtomicEvent.on("/odom", where(positive("frame"))));

            assertEquals(List.of(DiagnosticCode.TYPE_MISMATCH), codes(schemaValidator.validate(property)));
            assertTrue(validator.validate(property).isAccepted());
        }

        @Test
        @DisplayName("Should resolve aliased fields through the binding event's channel")
        void testAliasedField() {
            Property property = Property.response(Scope.globally(),
                    AtomicEvent.on("/odom", null, "o"),
                    AtomicEvent.on("/cmd", where(new Comparison(ComparisonOperator.GT,
                            FieldAccess.of("o", "sped"), Literal.of(1)))));

            ValidationReport report = schemaValidator.validate(property);

            assertEquals(1, report.withCode(DiagnosticCode.UNKNOWN_FIELD).size());
            assertEquals(1, report.withCode(DiagnosticCode.UNKNOWN_CHANNEL_SCHEMA).size());
            assertEquals("/cmd", report.withCode(DiagnosticCode.UNKNOWN_CHANNEL_SCHEMA).get(0).subject());
        }

        @Test
        @DisplayName("Should warn about channels without schema")
        void testUnknownChannelSchema() {
            Property property = Property.existence(Scope.globally(), AtomicEvent.on("/lidar", where(positive("range"))));

            ValidationReport report = schemaValidator.validate(property);

            assertEquals(List.of(DiagnosticCode.UNKNOWN_CHANNEL_SCHEMA), codes(report));
            assertTrue(report.isAccepted());
        }

        @Test
        @DisplayName("Should treat a null schema answer as an unknown schema")
        void testNullSchemaAnswer() {
            // Given
            when(provider.schemaFor("/raw")).thenReturn(null);
            when(odometry.fieldType(List.of("heading"))).thenReturn(null);
            Property raw = Property.existence(Scope.globally(), AtomicEvent.on("/raw", where(positive("range"))));
            Property odom = Property.existence(Scope.globally(), AtomicEvent.on("/odom", where(positive("heading"))));

            // When
            ValidationReport rawReport = assertDoesNotThrow(() -> schemaValidator.validate(raw));
            ValidationReport odomReport = assertDoesNotThrow(() -> schemaValidator.validate(odom));

            // Then
            assertEquals(List.of(DiagnosticCode.UNKNOWN_CHANNEL_SCHEMA), codes(rawReport));
            assertEquals(List.of(DiagnosticCode.UNKNOWN_FIELD), codes(odomReport));
        }
    }
}
