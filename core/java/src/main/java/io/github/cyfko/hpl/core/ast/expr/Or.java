package io.github.cyfko.hpl.core.ast.expr;

import io.github.cyfko.hpl.core.api.AstVisitor;

import java.util.Arrays;
import java.util.List;

/**
 * Boolean disjunction.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Or extends Connective {

    public Or(List<? extends Expression> operands) {
        super(operands);
    }

    private Or(Or source) {
        super(source);
    }

    public static Or of(Expression first, Expression... rest) {
        Expression[] all = new Expression[rest.length + 1];
        all[0] = first;
        System.arraycopy(rest, 0, all, 1, rest.length);
        return new Or(Arrays.asList(all));
    }

    @Override
    public String keyword() {
        return "or";
    }

    @Override
    public Or duplicate() {
        return new Or(this);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitOr(this);
    }
}
