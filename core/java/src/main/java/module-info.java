module io.github.cyfko.hpl.core {
    requires java.logging;

    exports io.github.cyfko.hpl.core.api;
    exports io.github.cyfko.hpl.core.ast;
    exports io.github.cyfko.hpl.core.ast.event;
    exports io.github.cyfko.hpl.core.ast.expr;
    exports io.github.cyfko.hpl.core.config;
    exports io.github.cyfko.hpl.core.exception;
    exports io.github.cyfko.hpl.core.logic;
    exports io.github.cyfko.hpl.core.spi;
    exports io.github.cyfko.hpl.core.validation;
}
