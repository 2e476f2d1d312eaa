package com.genenet.rbn.io;

import com.genenet.rbn.api.Network;
import com.genenet.rbn.api.State;
import com.genenet.rbn.api.TranslationException;
import com.genenet.rbn.engine.DynamicsEngine;
import com.genenet.rbn.engine.NetworkBuilder;
import com.genenet.rbn.fn.BoolOp;
import com.genenet.rbn.fn.ConstantRule;
import com.genenet.rbn.fn.Expr;
import com.genenet.rbn.fn.ExpressionRule;
import com.genenet.rbn.fn.FoldRule;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.file.Path;
import java.util.List;
import java.util.Random;

import static org.junit.Assert.*;

public class BnetFormatTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testNodeIds() {
        assertEquals("v12", BnetFormat.nodeId(12));
        assertEquals(12, BnetFormat.nodeIndex("v12", 13));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNodeIdOutOfRange() {
        BnetFormat.nodeIndex("v3", 3);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNodeIdWrongPrefix() {
        BnetFormat.nodeIndex("x1", 3);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNodeIdNotNumeric() {
        BnetFormat.nodeIndex("v1a", 3);
    }

    @Test
    public void testTranslateFoldExpression() {
        Network network = new NetworkBuilder(new Random(0)).build(12, 2);
        String expression = "¬((X10 ∧ ¬X1) ∨ X2)";
        assertEquals("!((v10 & !v1) | v2)", BnetFormat.translate(expression, network));
    }

    @Test
    public void testTranslateUsesNameTableNotPrefix() {
        // X1 must not be confused with the prefix of X10
        Network network = new NetworkBuilder(new Random(0)).build(11, 2);
        assertEquals("v1 | v10", BnetFormat.translate("X1 ∨ X10", network));
    }

    @Test(expected = TranslationException.class)
    public void testTranslateUnknownNode() {
        Network network = new NetworkBuilder(new Random(0)).build(3, 2);
        BnetFormat.translate("X0 ∧ Y", network);
    }

    @Test(expected = TranslationException.class)
    public void testTranslateUnsupportedSymbol() {
        Network network = new NetworkBuilder(new Random(0)).build(3, 2);
        BnetFormat.translate("X0 → X1", network);
    }

    @Test
    public void testToBnet() {
        Network network = NetworkBuilder.manual()
                .addNode(ConstantRule.FALSE)
                .addNode(new FoldRule(List.of("X0", "X2"), new boolean[] { true, false },
                        new BoolOp[] { BoolOp.AND }, true), 0, 2)
                .addNode(ConstantRule.TRUE)
                .build();
        assertEquals("v0, 0\nv1, !(!v0 & v2)\nv2, 1\n", BnetFormat.toBnet(network));
    }

    @Test
    public void testParse() {
        String text = "# comment\n"
                + "targets, factors\n"
                + "\n"
                + "A, !B & C\n"
                + "B, A | ext\n"
                + "C, 1\n";
        Network network = BnetFormat.parse(text);

        assertEquals(List.of("A", "B", "C", "ext"), network.nodeNames());
        assertArrayEquals(new int[] { 1, 2 }, network.parents(0));
        assertArrayEquals(new int[] { 0, 3 }, network.parents(1));
        assertTrue(network.rule(2) instanceof ConstantRule);
        // undefined inputs keep their value
        assertArrayEquals(new int[] { 3 }, network.parents(3));
        assertTrue(network.rule(3).evaluate(new boolean[] { true }));
        assertFalse(network.rule(3).evaluate(new boolean[] { false }));
    }

    @Test
    public void testParseBuildsExpressionTree() {
        Network network = BnetFormat.parse("A, B | !C & A\nB, A\nC, B\n");

        assertArrayEquals(new int[] { 0, 1, 2 }, network.parents(0));
        Expr expected = Expr.binary(BoolOp.OR,
                Expr.var(1, "B"),
                Expr.binary(BoolOp.AND, Expr.not(Expr.var(2, "C")), Expr.var(0, "A")));
        assertEquals(expected, ((ExpressionRule) network.rule(0)).expr());
    }

    @Test
    public void testTrueAndFalseAreConstants() {
        Network network = BnetFormat.parse("A, True\nB, A & !False\n");

        assertEquals(List.of("A", "B"), network.nodeNames());
        assertSame(ConstantRule.TRUE, network.rule(0));
        assertArrayEquals(new int[] { 0 }, network.parents(1));
        assertEquals(Expr.binary(BoolOp.AND, Expr.var(0, "A"), Expr.not(Expr.constant(false))),
                ((ExpressionRule) network.rule(1)).expr());
        assertEquals("v0, 1\nv1, (v0 & !0)\n", BnetFormat.toBnet(network));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testReservedWordInExpression() {
        BnetFormat.parse("A, not B\nB, A\n");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testReservedWordAsTarget() {
        BnetFormat.parse("True, A\nA, A\n");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testParseDuplicateTarget() {
        BnetFormat.parse("a, b\na, !b\nb, a\n");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testParseEmpty() {
        BnetFormat.parse("# nothing\n");
    }

    @Test
    public void testRandomNetworkSurvivesRoundTrip() throws Exception {
        Network network = new NetworkBuilder(new Random(23)).build(8, 3);
        Path file = folder.getRoot().toPath().resolve("net.bnet");
        BnetFormat.write(network, file);
        Network loaded = BnetFormat.load(file);

        assertEquals(network.size(), loaded.size());
        DynamicsEngine engine = new DynamicsEngine(new Random(0));
        for (int index = 0; index < (1 << 8); index++) {
            State s = State.fromIndex(index, 8);
            assertEquals(engine.updateSync(s, network), engine.updateSync(s, loaded));
        }
    }
}
