package com.genenet.rbn.engine;

import com.genenet.rbn.api.Attractor;
import com.genenet.rbn.api.Proportions;
import com.genenet.rbn.api.State;
import com.genenet.rbn.api.Trajectory;
import com.genenet.rbn.api.UpdateScheme;
import org.junit.Test;

import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.Assert.*;

public class ProportionAnalyzerTest {

    private static final double EPS = 1e-12;

    private static Trajectory trajectory(State... states) {
        return new Trajectory(UpdateScheme.SYNCHRONOUS, List.of(states));
    }

    @Test
    public void testNoAttractorsIsAllTransient() {
        Trajectory t = trajectory(State.ofBits(1, 1), State.ofBits(1, 1));
        Proportions p = ProportionAnalyzer.proportions(t, List.of());
        assertEquals(1.0, p.transientFraction(), EPS);
        assertEquals(0.0, p.attractorFraction(), EPS);
        assertEquals(Proportions.ALL_TRANSIENT, p);
    }

    @Test
    public void testInitialStateIsCounted() {
        Attractor fixed = new Attractor(Set.of(State.ofBits(1, 1)));
        Trajectory t = trajectory(State.ofBits(0, 0), State.ofBits(1, 0), State.ofBits(1, 1), State.ofBits(1, 1));

        Proportions p = ProportionAnalyzer.proportions(t, List.of(fixed));

        assertEquals(0.5, p.transientFraction(), EPS);
        assertEquals(0.5, p.attractorFraction(), EPS);
    }

    @Test
    public void testMembershipIsOverUnionOfAttractors() {
        ProportionAnalyzer analyzer = new ProportionAnalyzer(List.of(
                new Attractor(Set.of(State.ofBits(0, 0))),
                new Attractor(Set.of(State.ofBits(0, 1), State.ofBits(1, 0)))));

        assertEquals(3, analyzer.attractorStateCount());
        Trajectory t = trajectory(State.ofBits(1, 1), State.ofBits(0, 1), State.ofBits(0, 0));
        assertArrayEquals(new boolean[] { false, true, true }, analyzer.classify(t));
        assertEquals(2.0 / 3, analyzer.analyze(t).attractorFraction(), EPS);
    }

    @Test
    public void testFractionsSumToOne() {
        Random random = new Random(6);
        ProportionAnalyzer analyzer = new ProportionAnalyzer(List.of(
                new Attractor(Set.of(State.ofBits(1, 0, 1), State.ofBits(0, 0, 0)))));
        for (int trial = 0; trial < 100; trial++) {
            int length = 1 + random.nextInt(30);
            State[] states = new State[length];
            for (int i = 0; i < length; i++)
                states[i] = State.random(3, random);
            Proportions p = analyzer.analyze(trajectory(states));
            assertEquals(1.0, p.transientFraction() + p.attractorFraction(), 1e-9);
        }
    }

    @Test
    public void testFormatting() {
        assertEquals("0.250, 0.750", Proportions.ofCounts(3, 4).toString());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testProportionsOutOfRange() {
        new Proportions(1.5, -0.5);
    }
}
