package io.github.cyfko.hpl.core.exception;

import io.github.cyfko.hpl.core.api.Diagnostic;
import io.github.cyfko.hpl.core.api.DiagnosticCode;
import io.github.cyfko.hpl.core.api.NodeId;
import io.github.cyfko.hpl.core.validation.ValidationReport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Exception Tests")
class ExceptionTest {

    @Test
    @DisplayName("Should carry the violated invariant and its subject")
    void testAstConstructionException() {
        AstConstructionException exception = new AstConstructionException(
                ConstructionError.BLANK_CHANNEL, null, "An atomic event needs a channel");

        assertEquals(ConstructionError.BLANK_CHANNEL, exception.getError());
        assertEquals("", exception.getSubject());
        assertEquals("An atomic event needs a channel", exception.getMessage());
        assertInstanceOf(RuntimeException.class, exception);
    }

    @Test
    @DisplayName("Should name both nodes when a child is missing")
    void testNotAChildException() {
        NodeId parent = new NodeId(4);
        NodeId child = new NodeId(9);

        NotAChildException exception = new NotAChildException(parent, child);

        assertEquals("Node #9 is not a child of node #4", exception.getMessage());
        assertSame(parent, exception.getParent());
        assertSame(child, exception.getChild());
    }

    @Test
    @DisplayName("Should summarize the errors of a rejected property")
    void testPropertyValidationException() {
        NodeId node = NodeId.next();
        ValidationReport report = ValidationReport.of(List.of(
                Diagnostic.of(DiagnosticCode.UNBOUND_ALIAS, node, "y", "undefined alias 'y'"),
                Diagnostic.of(DiagnosticCode.UNKNOWN_FUNCTION, node, "f", "unknown function 'f'"),
                Diagnostic.of(DiagnosticCode.UNKNOWN_CHANNEL_SCHEMA, node, "/c", "no schema")), false);

        PropertyValidationException exception = new PropertyValidationException(report);

        assertEquals("Property rejected with 2 error(s): undefined alias 'y'; unknown function 'f'", exception.getMessage());
        assertSame(report, exception.getReport());
        assertThrows(NullPointerException.class, () -> new PropertyValidationException(null));
    }
}
