package com.genenet.rbn.api;

import org.junit.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.junit.Assert.*;

public class TrapSpaceTest {

    private static final int F = TrapSpace.FREE;

    @Test
    public void testExpand() {
        TrapSpace space = new TrapSpace(new int[] { 1, F, 0, F });

        assertEquals(List.of(1, 3), space.freeNodes());
        assertEquals("1-0-", space.toString());
        assertEquals(Set.of(State.ofBits(1, 0, 0, 0), State.ofBits(1, 1, 0, 0),
                State.ofBits(1, 0, 0, 1), State.ofBits(1, 1, 0, 1)), space.expand());
    }

    @Test
    public void testFullyFixedExpandsToOneState() {
        assertEquals(Set.of(State.ofBits(0, 1)), new TrapSpace(new int[] { 0, 1 }).expand());
    }

    @Test
    public void testContainsAndIncludes() {
        TrapSpace wide = new TrapSpace(new int[] { 1, F, F });
        TrapSpace narrow = new TrapSpace(new int[] { 1, 0, F });

        assertTrue(wide.includes(narrow));
        assertFalse(narrow.includes(wide));
        assertTrue(wide.includes(wide));
        assertTrue(narrow.contains(State.ofBits(1, 0, 1)));
        assertFalse(narrow.contains(State.ofBits(1, 1, 1)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidValue() {
        new TrapSpace(new int[] { 0, 2 });
    }

    @Test(expected = ResourceExceededException.class)
    public void testTooManyFreeNodes() {
        int[] values = new int[31];
        Arrays.fill(values, F);
        new TrapSpace(values).expand();
    }
}
