package io.github.cyfko.hpl.core.ast.event;

import io.github.cyfko.hpl.core.api.ComparisonOperator;
import io.github.cyfko.hpl.core.ast.Predicate;
import io.github.cyfko.hpl.core.ast.expr.Comparison;
import io.github.cyfko.hpl.core.ast.expr.FieldAccess;
import io.github.cyfko.hpl.core.ast.expr.Literal;
import io.github.cyfko.hpl.core.exception.AstConstructionException;
import io.github.cyfko.hpl.core.exception.ConstructionError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for {@link AtomicEvent} and {@link EventDisjunction}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@DisplayName("Event Tests")
class EventDisjunctionTest {

    private static Predicate readsAlias(String alias) {
        return new Predicate(new Comparison(ComparisonOperator.EQ, FieldAccess.self("id"), FieldAccess.of(alias, "id")));
    }

    // ========== Construction Tests ==========

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("Should reject a disjunction listing a channel twice")
        void testDuplicateChannel() {
            AstConstructionException exception = assertThrows(AstConstructionException.class,
                    () -> EventDisjunction.of(AtomicEvent.on("topic/x"), AtomicEvent.on("topic/x")));

            assertEquals(ConstructionError.NON_UNIQUE_DISJUNCT_CHANNEL, exception.getError());
            assertEquals("topic/x", exception.getSubject());
            assertTrue(exception.getMessage().contains("topic/x"));
        }

        @Test
        @DisplayName("Should check channel uniqueness across nested disjunctions")
        void testNestedDuplicateChannel() {
            EventDisjunction inner = EventDisjunction.of(AtomicEvent.on("/a"), AtomicEvent.on("/b"));

            AstConstructionException exception = assertThrows(AstConstructionException.class,
                    () -> EventDisjunction.of(inner, AtomicEvent.on("/a")));

            assertEquals("/a", exception.getSubject());
            assertEquals(2, inner.events().size());
            assertDoesNotThrow(() -> EventDisjunction.of(inner, AtomicEvent.on("/c")));
        }

        @Test
        @DisplayName("Should require at least two events")
        void testArity() {
            AstConstructionException exception = assertThrows(AstConstructionException.class,
                    () -> new EventDisjunction(List.of(AtomicEvent.on("/a"))));
            assertEquals(ConstructionError.INVALID_DISJUNCTION_ARITY, exception.getError());
        }

        @Test
        @DisplayName("Should reject blank channels and aliases")
        void testBlankNames() {
            assertEquals(ConstructionError.BLANK_CHANNEL,
                    assertThrows(AstConstructionException.class, () -> AtomicEvent.on(" ")).getError());
            assertEquals(ConstructionError.BLANK_CHANNEL,
                    assertThrows(AstConstructionException.class, () -> AtomicEvent.on(null)).getError());
            assertEquals(ConstructionError.BLANK_ALIAS,
                    assertThrows(AstConstructionException.class, () -> AtomicEvent.on("/a", null, "")).getError());
        }

        @Test
        @DisplayName("Should default to the vacuous predicate")
        void testVacuousDefault() {
            AtomicEvent event = AtomicEvent.on("/scan");

            assertTrue(event.predicate().isVacuous());
            assertTrue(event.alias().isEmpty());
            assertFalse(event.isDisjunction());
        }
    }

    // ========== Query Tests ==========

    @Test
    @DisplayName("Should flatten channels and aliases of nested disjunctions")
    void testFlattening() {
        EventDisjunction disjunction = EventDisjunction.of(
                EventDisjunction.of(AtomicEvent.on("/a", null, "x"), AtomicEvent.on("/b", null, "y")),
                AtomicEvent.on("/c", null, "x"));

        assertEquals(List.of("/a", "/b", "/c"), disjunction.channels());
        assertEquals(List.of("x", "y"), disjunction.aliases());
        assertEquals(3, disjunction.atomicEvents().size());
        assertTrue(disjunction.isDisjunction());
    }

    @Test
    @DisplayName("Should list references to aliases bound elsewhere")
    void testExternalReferences() {
        AtomicEvent selfReference = AtomicEvent.on("/a", readsAlias("me"), "me");
        AtomicEvent foreign = AtomicEvent.on("/b", readsAlias("trigger"));

        assertTrue(selfReference.externalReferences().isEmpty());
        assertEquals(Set.of("trigger"), foreign.externalReferences());
        assertEquals(Set.of("trigger"), EventDisjunction.of(selfReference, foreign).externalReferences());
        assertTrue(foreign.containsReference("trigger"));
        assertFalse(foreign.containsReference("me"));
    }

    @Test
    @DisplayName("Should expose a duplicate channel introduced by replacement")
    void testDuplicateChannelAfterReplacement() {
        AtomicEvent second = AtomicEvent.on("topic/y");
        EventDisjunction disjunction = EventDisjunction.of(AtomicEvent.on("topic/x"), second);

        disjunction.replaceChild(second.id(), AtomicEvent.on("topic/x"));

        assertEquals(Set.of("topic/x"), disjunction.duplicateChannels());
    }

    @Test
    @DisplayName("Should compare disjuncts in order")
    void testOrderSensitiveEquality() {
        EventDisjunction ab = EventDisjunction.of(AtomicEvent.on("/a"), AtomicEvent.on("/b"));
        EventDisjunction ba = EventDisjunction.of(AtomicEvent.on("/b"), AtomicEvent.on("/a"));

        assertTrue(ab.structurallyEquals(ab.duplicate()));
        assertFalse(ab.structurallyEquals(ba));
    }

    @Test
    @DisplayName("Should distinguish events by predicate and alias")
    void testAtomicEquality() {
        Predicate fast = new Predicate(new Comparison(ComparisonOperator.GT, FieldAccess.self("v"), Literal.of(3)));

        assertFalse(AtomicEvent.on("/a", null, "x").structurallyEquals(AtomicEvent.on("/a")));
        assertFalse(AtomicEvent.on("/a", fast).structurallyEquals(AtomicEvent.on("/a")));
        assertTrue(AtomicEvent.on("/a", fast.duplicate()).structurallyEquals(AtomicEvent.on("/a", fast)));
    }
}
