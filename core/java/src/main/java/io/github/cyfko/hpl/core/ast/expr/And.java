package io.github.cyfko.hpl.core.ast.expr;

import io.github.cyfko.hpl.core.api.AstVisitor;

import java.util.Arrays;
import java.util.List;

/**
 * Boolean conjunction.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class And extends Connective {

    public And(List<? extends Expression> operands) {
        super(operands);
    }

    private And(And source) {
        super(source);
    }

    public static And of(Expression first, Expression... rest) {
        Expression[] all = new Expression[rest.length + 1];
        all[0] = first;
        System.arraycopy(rest, 0, all, 1, rest.length);
        return new And(Arrays.asList(all));
    }

    @Override
    public String keyword() {
        return "and";
    }

    @Override
    public And duplicate() {
        return new And(this);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitAnd(this);
    }
}
