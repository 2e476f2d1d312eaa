package com.genenet.rbn.engine;

import com.genenet.rbn.api.Attractor;
import com.genenet.rbn.api.Network;
import com.genenet.rbn.api.ResourceExceededException;
import com.genenet.rbn.api.State;
import com.genenet.rbn.api.UpdateScheme;
import com.genenet.rbn.fn.ConstantRule;
import org.junit.Test;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static com.genenet.rbn.engine.DynamicsEngineTest.copy;
import static com.genenet.rbn.engine.DynamicsEngineTest.negate;
import static org.junit.Assert.*;

public class SyncAttractorFinderTest {

    private final SyncAttractorFinder finder = new SyncAttractorFinder();
    private final DynamicsEngine engine = new DynamicsEngine(new Random(0));

    private static Attractor attractor(State... states) {
        return new Attractor(Set.of(states));
    }

    @Test
    public void testChainHasSingleFixedPoint() {
        Network chain = NetworkBuilder.manual()
                .addNode(ConstantRule.TRUE)
                .addNode(copy("X0"), 0)
                .addNode(copy("X1"), 1)
                .build();

        List<Attractor> attractors = finder.find(chain);

        assertEquals(1, attractors.size());
        assertTrue(attractors.get(0).isFixedPoint());
        assertEquals(attractor(State.ofBits(1, 1, 1)), attractors.get(0));
    }

    @Test
    public void testSwapNetwork() {
        // X0 = X1, X1 = X0: two fixed points and one 2-cycle
        Network swap = NetworkBuilder.manual()
                .addNode(copy("X1"), 1)
                .addNode(copy("X0"), 0)
                .build();

        Set<Attractor> found = new HashSet<>(finder.find(swap));

        assertEquals(Set.of(
                attractor(State.ofBits(0, 0)),
                attractor(State.ofBits(1, 1)),
                attractor(State.ofBits(0, 1), State.ofBits(1, 0))), found);
    }

    @Test
    public void testRingIsSingleFourCycle() {
        // X0 = ¬X1, X1 = X0: 00 -> 10 -> 11 -> 01 -> 00
        Network ring = NetworkBuilder.manual()
                .addNode(negate("X1"), 1)
                .addNode(copy("X0"), 0)
                .build();

        List<Attractor> attractors = finder.find(ring);

        assertEquals(1, attractors.size());
        assertEquals(4, attractors.get(0).size());
    }

    @Test
    public void testAttractorsAreClosedAndDisjoint() {
        NetworkBuilder builder = new NetworkBuilder(new Random(31));
        for (int trial = 0; trial < 10; trial++) {
            Network network = builder.build(8, 3);
            List<Attractor> attractors = finder.find(network);
            assertFalse(attractors.isEmpty());

            Set<State> seen = new HashSet<>();
            for (Attractor a : attractors) {
                for (State s : a.states()) {
                    assertTrue(a.contains(engine.updateSync(s, network)));
                    assertTrue("attractors overlap", seen.add(s));
                }
            }
        }
    }

    @Test
    public void testEveryTrajectoryEndsInAnAttractor() {
        Network network = new NetworkBuilder(new Random(4)).build(6, 2);
        ProportionAnalyzer analyzer = new ProportionAnalyzer(finder.find(network));
        DynamicsEngine sim = new DynamicsEngine(new Random(5));
        for (int i = 0; i < 20; i++) {
            // 2^6 steps is enough to leave any transient
            State last = sim.simulate(network, 64, UpdateScheme.SYNCHRONOUS).last();
            assertTrue(analyzer.isAttractorState(last));
        }
    }

    @Test
    public void testIdempotent() {
        Network network = new NetworkBuilder(new Random(77)).build(10, 3);
        assertEquals(new HashSet<>(finder.find(network)), new HashSet<>(finder.find(network)));
    }

    @Test(expected = ResourceExceededException.class)
    public void testStateBound() {
        Network network = new NetworkBuilder(new Random(1)).build(6, 2);
        new SyncAttractorFinder(32, null).find(network);
    }

    @Test
    public void testTimeout() {
        Network network = new NetworkBuilder(new Random(1)).build(16, 3);
        try {
            new SyncAttractorFinder(SyncAttractorFinder.DEFAULT_MAX_STATES, Duration.ofNanos(1)).find(network);
            fail("Should have timed out");
        } catch (ResourceExceededException e) {
            assertEquals("ResourceExceeded", e.kind());
        }
    }
}
