package com.genenet.rbn.fn;

/**
 * Propositional expression tree over a node's parents, used for rules read
 * from rule files. Variables refer to parents by position.
 */
public interface Expr {

    boolean evaluate(boolean[] parentValues);

    /** Appends the symbolic form using {@code ¬}, {@code ∧} and {@code ∨}. */
    void render(StringBuilder sb);

    static Expr constant(boolean value) {
        return new Const(value);
    }

    static Expr var(int position, String name) {
        return new Var(position, name);
    }

    static Expr not(Expr operand) {
        return new Not(operand);
    }

    static Expr binary(BoolOp op, Expr left, Expr right) {
        return new Binary(op, left, right);
    }

    record Const(boolean value) implements Expr {
        @Override
        public boolean evaluate(boolean[] parentValues) {
            return value;
        }

        @Override
        public void render(StringBuilder sb) {
            sb.append(value ? '1' : '0');
        }
    }

    record Var(int position, String name) implements Expr {
        @Override
        public boolean evaluate(boolean[] parentValues) {
            return parentValues[position];
        }

        @Override
        public void render(StringBuilder sb) {
            sb.append(name);
        }
    }

    record Not(Expr operand) implements Expr {
        @Override
        public boolean evaluate(boolean[] parentValues) {
            return !operand.evaluate(parentValues);
        }

        @Override
        public void render(StringBuilder sb) {
            sb.append('¬');
            operand.render(sb);
        }
    }

    record Binary(BoolOp op, Expr left, Expr right) implements Expr {
        @Override
        public boolean evaluate(boolean[] parentValues) {
            return op.apply(left.evaluate(parentValues), right.evaluate(parentValues));
        }

        @Override
        public void render(StringBuilder sb) {
            sb.append('(');
            left.render(sb);
            sb.append(' ').append(op.symbol()).append(' ');
            right.render(sb);
            sb.append(')');
        }
    }
}
