package io.github.cyfko.hpl.core.ast;

import io.github.cyfko.hpl.core.api.AstNode;
import io.github.cyfko.hpl.core.api.AstVisitor;
import io.github.cyfko.hpl.core.api.ComparisonOperator;
import io.github.cyfko.hpl.core.api.NodeId;
import io.github.cyfko.hpl.core.ast.event.AtomicEvent;
import io.github.cyfko.hpl.core.ast.event.EventDisjunction;
import io.github.cyfko.hpl.core.ast.expr.And;
import io.github.cyfko.hpl.core.ast.expr.Comparison;
import io.github.cyfko.hpl.core.ast.expr.Expression;
import io.github.cyfko.hpl.core.ast.expr.FieldAccess;
import io.github.cyfko.hpl.core.ast.expr.Literal;
import io.github.cyfko.hpl.core.ast.expr.Not;
import io.github.cyfko.hpl.core.ast.expr.Or;
import io.github.cyfko.hpl.core.exception.AstConstructionException;
import io.github.cyfko.hpl.core.exception.ConstructionError;
import io.github.cyfko.hpl.core.exception.NotAChildException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests of the parent/child contract shared by every node: single ownership, deep duplication,
 * child replacement and freezing.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@DisplayName("AST Ownership Tests")
class AstOwnershipTest {

    private static Expression speedAbove(int threshold) {
        return new Comparison(ComparisonOperator.GT, FieldAccess.self("speed"), Literal.of(threshold));
    }

    private static Property sampleProperty() {
        return Property.response(
                Scope.after(AtomicEvent.on("/mission/start")),
                AtomicEvent.on("/cmd", new Predicate(speedAbove(0)), "cmd"),
                AtomicEvent.on("/odom", new Predicate(new Comparison(ComparisonOperator.EQ,
                        FieldAccess.self("speed"), FieldAccess.of("cmd", "speed")))));
    }

    // ========== Duplication Tests ==========

    @Nested
    @DisplayName("Duplication")
    class Duplication {

        @Test
        @DisplayName("Should produce a structurally equal tree with fresh identities")
        void testDuplicateIsEqual() {
            Property original = sampleProperty();
            Property copy = original.duplicate();

            assertTrue(copy.structurallyEquals(original));
            assertTrue(original.structurallyEquals(copy));

            Set<NodeId> originalIds = AstWalker.preorder(original).map(AstNode::id).collect(Collectors.toSet());
            assertTrue(AstWalker.preorder(copy).map(AstNode::id).noneMatch(originalIds::contains));
        }

        @Test
        @DisplayName("Should isolate the copy from the original")
        void testDuplicateIsolation() {
            Property original = sampleProperty();
            Property snapshot = original.duplicate();
            Property copy = original.duplicate();

            copy.setBehaviour(AtomicEvent.on("/elsewhere"));
            ((AtomicEvent) copy.trigger().orElseThrow()).setPredicate(Predicate.vacuous());

            assertTrue(original.structurallyEquals(snapshot));
            assertFalse(copy.structurallyEquals(original));
        }

        @Test
        @DisplayName("Should not carry the frozen flag to copies")
        void testDuplicateOfFrozen() {
            Property original = sampleProperty();
            original.freeze();

            Property copy = original.duplicate();

            assertFalse(copy.isFrozen());
            assertTrue(AstWalker.preorder(copy).noneMatch(AstNode::isFrozen));
            assertDoesNotThrow(() -> copy.setTimeWindow(0, 5));
        }
    }

    // ========== Ownership Tests ==========

    @Nested
    @DisplayName("Ownership transfer")
    class Ownership {

        @Test
        @DisplayName("Should detach a child attached to a new parent")
        void testMoveBetweenConnectives() {
            Expression moved = speedAbove(1);
            And and = And.of(moved, speedAbove(2));

            Or or = Or.of(moved, speedAbove(3));

            assertEquals(1, and.operands().size());
            assertFalse(and.operands().contains(moved));
            assertSame(moved, or.operands().get(0));
        }

        @Test
        @DisplayName("Should leave an empty single slot after a move")
        void testMoveLeavesMissingSlot() {
            Expression moved = speedAbove(1);
            Not not = new Not(moved);

            And.of(moved, speedAbove(2));

            assertNull(not.operand());
            assertTrue(not.children().isEmpty());
            assertEquals(List.of("operand"), not.missingSlots());
        }

        @Test
        @DisplayName("Should leave an empty trigger slot after moving the trigger")
        void testMoveTrigger() {
            Property property = sampleProperty();
            AtomicEvent trigger = (AtomicEvent) property.trigger().orElseThrow();

            EventDisjunction disjunction = EventDisjunction.of(trigger, AtomicEvent.on("/other"));

            assertTrue(property.trigger().isEmpty());
            assertSame(trigger, disjunction.events().get(0));
            assertEquals(2, property.children().size());
        }

        @Test
        @DisplayName("Should reject a node attached below itself")
        void testCycle() {
            And and = And.of(speedAbove(1), speedAbove(2));
            Not not = new Not(and);

            AstConstructionException exception = assertThrows(AstConstructionException.class, () -> and.addOperand(not));
            assertEquals(ConstructionError.CYCLIC_ATTACHMENT, exception.getError());
        }

        @Test
        @DisplayName("Should reject the same instance twice in one parent")
        void testSameInstanceTwice() {
            Expression leaf = speedAbove(1);

            AstConstructionException exception = assertThrows(AstConstructionException.class, () -> And.of(leaf, leaf));
            assertEquals(ConstructionError.CYCLIC_ATTACHMENT, exception.getError());
        }
    }

    // ========== Replacement Tests ==========

    @Nested
    @DisplayName("Child replacement")
    class Replacement {

        @Test
        @DisplayName("Should replace a direct child by identity")
        void testReplaceChild() {
            Comparison comparison = (Comparison) speedAbove(1);
            Literal replacement = Literal.of(5);

            comparison.replaceChild(comparison.left().id(), replacement);

            assertSame(replacement, comparison.left());
            assertEquals(2, comparison.children().size());
        }

        @Test
        @DisplayName("Should keep the position of a replaced operand")
        void testReplaceInList() {
            Expression first = speedAbove(1);
            Expression second = speedAbove(2);
            Or or = Or.of(first, second);
            Expression replacement = speedAbove(9);

            or.replaceChild(first.id(), replacement);

            assertEquals(List.of(replacement, second), or.operands());
        }

        @Test
        @DisplayName("Should throw NotAChildException for an unknown identity")
        void testNotAChild() {
            Comparison comparison = (Comparison) speedAbove(1);
            NodeId stranger = Literal.of(3).id();

            NotAChildException exception = assertThrows(NotAChildException.class,
                    () -> comparison.replaceChild(stranger, Literal.of(4)));
            assertEquals(comparison.id(), exception.getParent());
            assertEquals(stranger, exception.getChild());
        }

        @Test
        @DisplayName("Should reject a replacement of the wrong kind")
        void testIncompatibleChild() {
            AtomicEvent event = AtomicEvent.on("/odom");

            AstConstructionException exception = assertThrows(AstConstructionException.class,
                    () -> event.replaceChild(event.predicate().id(), Literal.of(1)));
            assertEquals(ConstructionError.INCOMPATIBLE_CHILD, exception.getError());
            assertEquals("predicate", exception.getSubject());
        }

        @Test
        @DisplayName("Should reject foreign node implementations")
        void testForeignImplementation() {
            Property property = sampleProperty();
            AstNode foreign = mock(AstNode.class);
            when(foreign.id()).thenReturn(NodeId.next());

            AstConstructionException exception = assertThrows(AstConstructionException.class,
                    () -> property.replaceChild(property.behaviour().id(), foreign));
            assertEquals(ConstructionError.INCOMPATIBLE_CHILD, exception.getError());
        }
    }

    // ========== Freeze Tests ==========

    @Nested
    @DisplayName("Freezing")
    class Freezing {

        @Test
        @DisplayName("Should freeze the whole subtree")
        void testFreezeSubtree() {
            Property property = sampleProperty();

            property.freeze();

            assertTrue(AstWalker.preorder(property).allMatch(AstNode::isFrozen));
        }

        @Test
        @DisplayName("Should reject edits of a frozen tree")
        void testFrozenEdits() {
            Property property = sampleProperty();
            property.freeze();
            AtomicEvent behaviour = (AtomicEvent) property.behaviour();

            assertThrows(IllegalStateException.class, () -> property.setBehaviour(AtomicEvent.on("/x")));
            assertThrows(IllegalStateException.class, () -> property.putMetadata("id", "P1"));
            assertThrows(IllegalStateException.class, () -> behaviour.setPredicate(Predicate.vacuous()));
            assertThrows(IllegalStateException.class, () -> Scope.until(behaviour));
        }
    }

    // ========== Traversal Tests ==========

    @Test
    @DisplayName("Should walk parents before children in grammar order")
    void testPreorder() {
        Property property = sampleProperty();

        List<Class<?>> kinds = AstWalker.preorder(property).limit(5).map(Object::getClass).collect(Collectors.toList());

        assertEquals(List.of(Property.class, Scope.class, AtomicEvent.class, Predicate.class,
                io.github.cyfko.hpl.core.ast.expr.BoolValue.class), kinds);
        assertEquals(3, AstWalker.collect(property, AtomicEvent.class).size());
    }

    @Test
    @DisplayName("Should dispatch visitors on the concrete node kind")
    void testVisitorDispatch() {
        Property property = sampleProperty();
        AstVisitor<Integer> comparisons = new AstVisitor<>() {
            @Override
            public Integer visitNode(AstNode node) {
                return 0;
            }

            @Override
            public Integer visitComparison(Comparison node) {
                return 1;
            }
        };

        int count = AstWalker.preorder(property).mapToInt(node -> node.accept(comparisons)).sum();

        assertEquals(2, count);
    }
}
