package com.genenet.rbn.fn;

import com.genenet.rbn.api.Rule;

/**
 * Zero-arity rule that always yields the same value.
 */
public final class ConstantRule implements Rule {
    public static final ConstantRule FALSE = new ConstantRule(false);
    public static final ConstantRule TRUE = new ConstantRule(true);

    private final boolean value;

    private ConstantRule(boolean value) {
        this.value = value;
    }

    public static ConstantRule of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public boolean value() {
        return value;
    }

    @Override
    public int arity() {
        return 0;
    }

    @Override
    public boolean evaluate(boolean[] parentValues) {
        return value;
    }

    @Override
    public String expression() {
        return value ? "1" : "0";
    }

    @Override
    public String toString() {
        return "ConstantRule[" + expression() + "]";
    }
}
