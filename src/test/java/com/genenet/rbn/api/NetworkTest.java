package com.genenet.rbn.api;

import com.genenet.rbn.fn.BoolOp;
import com.genenet.rbn.fn.ConstantRule;
import com.genenet.rbn.fn.FoldRule;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class NetworkTest {

    private static Rule copy(String parent) {
        return new FoldRule(List.of(parent), new boolean[] { false }, new BoolOp[0], false);
    }

    @Test
    public void testAccessors() {
        Network network = new Network(List.of(
                new NetworkNode(0, "A", new int[0], ConstantRule.TRUE),
                new NetworkNode(1, "B", new int[] { 0 }, copy("A"))));

        assertEquals(2, network.size());
        assertEquals(List.of("A", "B"), network.nodeNames());
        assertEquals(1, network.indexOf("B"));
        assertEquals(1, network.maxArity());
        assertFalse(network.hasSelfLoops());
    }

    @Test
    public void testParentsAreCopied() {
        int[] parents = { 0 };
        NetworkNode node = new NetworkNode(1, "B", parents, copy("A"));
        parents[0] = 5;
        assertEquals(0, node.parent(0));
        node.parents()[0] = 7;
        assertEquals(0, node.parent(0));
    }

    @Test
    public void testNodeEqualityComparesParentContents() {
        Rule rule = copy("A");
        NetworkNode a = new NetworkNode(1, "B", new int[] { 0 }, rule);
        NetworkNode b = new NetworkNode(1, "B", new int[] { 0 }, rule);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, new NetworkNode(1, "B", new int[] { 2 }, rule));
        assertTrue(a.toString().contains("parents=[0]"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateParent() {
        Rule and = new FoldRule(List.of("A", "A"), new boolean[2], new BoolOp[] { BoolOp.AND }, false);
        new Network(List.of(
                new NetworkNode(0, "A", new int[0], ConstantRule.TRUE),
                new NetworkNode(1, "B", new int[] { 0, 0 }, and)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownParent() {
        new Network(List.of(new NetworkNode(0, "A", new int[] { 3 }, copy("D"))));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateName() {
        new Network(List.of(
                new NetworkNode(0, "A", new int[0], ConstantRule.TRUE),
                new NetworkNode(1, "A", new int[0], ConstantRule.TRUE)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownName() {
        new Network(List.of(new NetworkNode(0, "A", new int[0], ConstantRule.TRUE))).indexOf("Z");
    }
}
