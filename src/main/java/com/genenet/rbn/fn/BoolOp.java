package com.genenet.rbn.fn;

/**
 * Binary connective used between the operands of a {@link FoldRule}.
 */
public enum BoolOp {
    AND("∧", "&") {
        @Override
        public boolean apply(boolean a, boolean b) {
            return a && b;
        }
    },
    OR("∨", "|") {
        @Override
        public boolean apply(boolean a, boolean b) {
            return a || b;
        }
    };

    private final String symbol;
    private final String bnetSymbol;

    BoolOp(String symbol, String bnetSymbol) {
        this.symbol = symbol;
        this.bnetSymbol = bnetSymbol;
    }

    public abstract boolean apply(boolean a, boolean b);

    /** Symbol used in rule expressions. */
    public String symbol() {
        return symbol;
    }

    /** Symbol used in {@code .bnet} rule files. */
    public String bnetSymbol() {
        return bnetSymbol;
    }
}
