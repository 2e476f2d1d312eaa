package com.genenet.rbn.engine;

import com.genenet.rbn.api.Rule;
import com.genenet.rbn.fn.BoolOp;
import com.genenet.rbn.fn.ConstantRule;
import com.genenet.rbn.fn.FoldRule;

import java.util.List;
import java.util.Random;

/**
 * Draws random Boolean update rules.
 *
 * <ul>
 * <li>{@code k = 0}: a constant rule, 0 or 1 with equal probability.</li>
 * <li>{@code k > 0}: a {@link FoldRule}. One AND/OR per fold step, one
 * negation flag per parent and one whole-expression negation flag, each a fair
 * coin flip.</li>
 * </ul>
 *
 * All random choices are made here, once. The returned rule is a fixed value
 * and consumes no randomness when evaluated.
 */
public final class RuleGenerator {
    private final Random random;

    public RuleGenerator(Random random) {
        this.random = random;
    }

    /**
     * Generates a rule for a node with {@code parentNames.size()} parents.
     *
     * @param parentNames parent identifiers, in parent order.
     * @return the new rule.
     */
    public Rule generate(List<String> parentNames) {
        int k = parentNames.size();
        if (k == 0)
            return ConstantRule.of(random.nextBoolean());

        BoolOp[] ops = new BoolOp[k - 1];
        for (int i = 0; i < ops.length; i++)
            ops[i] = random.nextBoolean() ? BoolOp.AND : BoolOp.OR;

        boolean[] negations = new boolean[k];
        for (int i = 0; i < k; i++)
            negations[i] = random.nextBoolean();

        boolean wholeNegation = random.nextBoolean();
        return new FoldRule(parentNames, negations, ops, wholeNegation);
    }
}
