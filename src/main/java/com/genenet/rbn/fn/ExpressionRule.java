package com.genenet.rbn.fn;

import com.genenet.rbn.api.Rule;

/**
 * Rule backed by an arbitrary {@link Expr} tree, e.g. one read from a
 * {@code .bnet} file.
 */
public final class ExpressionRule implements Rule {
    private final int arity;
    private final Expr expr;
    private final String expression;

    public ExpressionRule(int arity, Expr expr) {
        this.arity = arity;
        this.expr = expr;
        StringBuilder sb = new StringBuilder();
        expr.render(sb);
        this.expression = sb.toString();
    }

    public Expr expr() {
        return expr;
    }

    @Override
    public int arity() {
        return arity;
    }

    @Override
    public boolean evaluate(boolean[] parentValues) {
        return expr.evaluate(parentValues);
    }

    @Override
    public String expression() {
        return expression;
    }

    @Override
    public String toString() {
        return "ExpressionRule[" + expression + "]";
    }
}
