package com.genenet.rbn.fn;

import com.genenet.rbn.api.Rule;

import java.util.Arrays;
import java.util.List;

/**
 * Rule built by folding optionally negated parent literals left to right with
 * AND/OR, then optionally negating the whole result.
 *
 * <p>
 * For parents {@code p0..pk-1}, literal negations {@code n0..nk-1},
 * connectives {@code op1..opk-1} and whole negation {@code w}:
 *
 * <pre>
 * out = lit(p0)
 * out = out op1 lit(p1)
 * ...
 * return w ? !out : out
 * </pre>
 *
 * The fold never re-associates or short-circuits out of order, so
 * {@link #evaluate(boolean[])} always matches {@link #expression()}.
 * All choices are fixed at construction; the rule is an immutable value.
 */
public final class FoldRule implements Rule {
    private final List<String> operands;
    private final boolean[] negations;
    private final BoolOp[] ops;
    private final boolean wholeNegation;
    private final String expression;

    /**
     * @param operands      parent names, in parent order. At least one.
     * @param negations     per-operand negation flags, same length as operands.
     * @param ops           connectives, one fewer than operands.
     * @param wholeNegation whether the folded result is negated.
     */
    public FoldRule(List<String> operands, boolean[] negations, BoolOp[] ops, boolean wholeNegation) {
        if (operands.isEmpty())
            throw new IllegalArgumentException("FoldRule needs at least one operand; use ConstantRule");
        if (negations.length != operands.size())
            throw new IllegalArgumentException(
                    "Expected " + operands.size() + " negation flags, got " + negations.length);
        if (ops.length != operands.size() - 1)
            throw new IllegalArgumentException(
                    "Expected " + (operands.size() - 1) + " connectives, got " + ops.length);
        this.operands = List.copyOf(operands);
        this.negations = negations.clone();
        this.ops = ops.clone();
        this.wholeNegation = wholeNegation;
        this.expression = render();
    }

    private String render() {
        String expr = literal(0);
        for (int i = 1; i < operands.size(); i++)
            expr = "(" + expr + " " + ops[i - 1].symbol() + " " + literal(i) + ")";
        return wholeNegation ? "¬(" + expr + ")" : expr;
    }

    private String literal(int i) {
        return negations[i] ? "¬" + operands.get(i) : operands.get(i);
    }

    @Override
    public int arity() {
        return operands.size();
    }

    @Override
    public boolean evaluate(boolean[] parentValues) {
        boolean out = parentValues[0] ^ negations[0];
        for (int i = 1; i < negations.length; i++)
            out = ops[i - 1].apply(out, parentValues[i] ^ negations[i]);
        return out ^ wholeNegation;
    }

    @Override
    public String expression() {
        return expression;
    }

    public List<String> operands() {
        return operands;
    }

    public boolean isNegated(int operand) {
        return negations[operand];
    }

    public BoolOp op(int i) {
        return ops[i];
    }

    public boolean wholeNegation() {
        return wholeNegation;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        return o instanceof FoldRule other
                && wholeNegation == other.wholeNegation
                && operands.equals(other.operands)
                && Arrays.equals(negations, other.negations)
                && Arrays.equals(ops, other.ops);
    }

    @Override
    public int hashCode() {
        return expression.hashCode();
    }

    @Override
    public String toString() {
        return "FoldRule[" + expression + "]";
    }
}
