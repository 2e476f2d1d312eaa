package com.genenet.rbn.engine;

import com.genenet.rbn.api.Rule;
import com.genenet.rbn.fn.BoolOp;
import com.genenet.rbn.fn.ConstantRule;
import com.genenet.rbn.fn.Expr;
import com.genenet.rbn.fn.FoldRule;
import com.genenet.rbn.io.BnetExpressionParser;
import org.junit.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.Assert.*;

public class RuleGeneratorTest {

    private static List<String> names(int k) {
        List<String> names = new ArrayList<>();
        for (int i = 0; i < k; i++)
            names.add("X" + i);
        return names;
    }

    @Test
    public void testNoParentsGivesConstant() {
        RuleGenerator gen = new RuleGenerator(new Random(1));
        boolean sawTrue = false;
        boolean sawFalse = false;
        for (int i = 0; i < 200; i++) {
            Rule rule = gen.generate(List.of());
            assertTrue(rule instanceof ConstantRule);
            assertEquals(0, rule.arity());
            if (((ConstantRule) rule).value())
                sawTrue = true;
            else
                sawFalse = true;
        }
        assertTrue(sawTrue);
        assertTrue(sawFalse);
    }

    @Test
    public void testArityAndOperandsFollowParents() {
        RuleGenerator gen = new RuleGenerator(new Random(2));
        for (int k = 1; k <= 5; k++) {
            Rule rule = gen.generate(names(k));
            assertEquals(k, rule.arity());
            for (String name : names(k))
                assertTrue(rule.expression(), rule.expression().contains(name));
        }
    }

    @Test
    public void testAllChoicesAreDrawn() {
        RuleGenerator gen = new RuleGenerator(new Random(3));
        boolean and = false, or = false, negated = false, plain = false, whole = false;
        for (int i = 0; i < 200; i++) {
            FoldRule rule = (FoldRule) gen.generate(names(3));
            for (int j = 0; j < 2; j++) {
                and |= rule.op(j) == BoolOp.AND;
                or |= rule.op(j) == BoolOp.OR;
            }
            for (int j = 0; j < 3; j++) {
                negated |= rule.isNegated(j);
                plain |= !rule.isNegated(j);
            }
            whole |= rule.wholeNegation();
        }
        assertTrue(and && or && negated && plain && whole);
    }

    @Test
    public void testSeededGenerationIsReproducible() {
        RuleGenerator a = new RuleGenerator(new Random(42));
        RuleGenerator b = new RuleGenerator(new Random(42));
        for (int k = 0; k < 6; k++)
            assertEquals(a.generate(names(k)).expression(), b.generate(names(k)).expression());
    }

    @Test
    public void testEvaluationMatchesExpression() {
        RuleGenerator gen = new RuleGenerator(new Random(7));
        for (int trial = 0; trial < 50; trial++) {
            int k = 1 + trial % 4;
            Rule rule = gen.generate(names(k));

            Map<String, Integer> positions = new HashMap<>();
            for (int j = 0; j < k; j++)
                positions.put("X" + j, j);
            Expr parsed = BnetExpressionParser.parse(rule.expression(), positions);

            for (int mask = 0; mask < (1 << k); mask++) {
                boolean[] bits = new boolean[k];
                for (int j = 0; j < k; j++)
                    bits[j] = ((mask >> j) & 1) == 1;
                assertEquals(rule.expression() + " at " + mask, parsed.evaluate(bits), rule.evaluate(bits));
            }
        }
    }
}
