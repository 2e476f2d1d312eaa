package com.genenet.rbn.engine;

import com.genenet.rbn.api.ConfigurationException;
import com.genenet.rbn.api.Network;
import com.genenet.rbn.api.NetworkNode;
import com.genenet.rbn.fn.ConstantRule;
import org.junit.Test;

import java.util.Random;

import static org.junit.Assert.*;

public class NetworkBuilderTest {

    @Test
    public void testDefaultPolicyExcludesSelfAndRequiresParents() {
        NetworkBuilder builder = new NetworkBuilder(new Random(11));
        assertEquals(ParentPolicy.EXCLUDE_SELF, builder.policy());

        for (int trial = 0; trial < 20; trial++) {
            Network network = builder.build(6, 3);
            assertEquals(6, network.size());
            assertFalse(network.hasSelfLoops());
            for (NetworkNode node : network.nodes()) {
                assertTrue(node.parentCount() >= 1);
                assertTrue(node.parentCount() <= 3);
                assertEquals(node.parentCount(), node.rule().arity());
                for (int p : node.parents())
                    assertNotEquals(node.index(), p);
            }
        }
    }

    @Test
    public void testNodeNames() {
        Network network = new NetworkBuilder(new Random(1)).build(4, 2);
        for (int i = 0; i < 4; i++) {
            assertEquals("X" + i, network.nodeName(i));
            assertEquals(i, network.indexOf("X" + i));
        }
    }

    @Test
    public void testEveryParentCountIsDrawn() {
        NetworkBuilder builder = new NetworkBuilder(new Random(5));
        boolean[] seen = new boolean[4];
        for (int trial = 0; trial < 50; trial++) {
            for (NetworkNode node : builder.build(8, 3).nodes())
                seen[node.parentCount()] = true;
        }
        assertFalse(seen[0]);
        assertTrue(seen[1] && seen[2] && seen[3]);
    }

    @Test
    public void testFullParentSetWhenMaxParentsIsNMinusOne() {
        Network network = new NetworkBuilder(new Random(9)).build(2, 1);
        assertArrayEquals(new int[] { 1 }, network.parents(0));
        assertArrayEquals(new int[] { 0 }, network.parents(1));
    }

    @Test
    public void testRelaxedPolicyAllowsSelfAndEmpty() {
        NetworkBuilder builder = new NetworkBuilder(new Random(13)).policy(ParentPolicy.ALLOW_SELF_AND_EMPTY);
        boolean sawEmpty = false;
        boolean sawSelf = false;
        for (int trial = 0; trial < 100; trial++) {
            Network network = builder.build(3, 3);
            for (NetworkNode node : network.nodes()) {
                if (!node.hasParents()) {
                    sawEmpty = true;
                    assertTrue(node.rule() instanceof ConstantRule);
                }
            }
            sawSelf |= network.hasSelfLoops();
        }
        assertTrue(sawEmpty);
        assertTrue(sawSelf);
    }

    @Test
    public void testSeededBuildIsReproducible() {
        Network a = new NetworkBuilder(new Random(21)).build(7, 3);
        Network b = new NetworkBuilder(new Random(21)).build(7, 3);
        for (int i = 0; i < 7; i++) {
            assertArrayEquals(a.parents(i), b.parents(i));
            assertEquals(a.rule(i).expression(), b.rule(i).expression());
        }
    }

    @Test(expected = ConfigurationException.class)
    public void testSingleNodeCannotExcludeSelf() {
        new NetworkBuilder(new Random(0)).build(1, 1);
    }

    @Test(expected = ConfigurationException.class)
    public void testMaxParentsAboveCandidates() {
        new NetworkBuilder(new Random(0)).build(4, 4);
    }

    @Test(expected = ConfigurationException.class)
    public void testZeroMaxParents() {
        new NetworkBuilder(new Random(0)).build(4, 0);
    }

    @Test(expected = ConfigurationException.class)
    public void testZeroNodes() {
        new NetworkBuilder(new Random(0)).build(0, 1);
    }

    @Test
    public void testSingleSelfLoopNodeUnderRelaxedPolicy() {
        Network network = new NetworkBuilder(new Random(0)).policy(ParentPolicy.ALLOW_SELF_AND_EMPTY).build(1, 1);
        assertEquals(1, network.size());
        assertTrue(network.node(0).parentCount() <= 1);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testManualArityMismatch() {
        NetworkBuilder.manual().addNode(ConstantRule.TRUE, 0);
    }
}
