package com.genenet.rbn.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A subspace of the state space given by a partial assignment: some nodes
 * fixed to 0 or 1, the rest free.
 *
 * Values are stored per node as {@code 0}, {@code 1} or {@link #FREE}.
 */
public final class TrapSpace {
    public static final int FREE = -1;

    private final int[] values;

    public TrapSpace(int[] values) {
        for (int i = 0; i < values.length; i++) {
            int v = values[i];
            if (v != 0 && v != 1 && v != FREE)
                throw new IllegalArgumentException("Node " + i + " has invalid value " + v);
        }
        this.values = values.clone();
    }

    public int size() {
        return values.length;
    }

    public int value(int node) {
        return values[node];
    }

    public boolean isFree(int node) {
        return values[node] == FREE;
    }

    public List<Integer> freeNodes() {
        List<Integer> free = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            if (values[i] == FREE)
                free.add(i);
        }
        return free;
    }

    public boolean contains(State state) {
        for (int i = 0; i < values.length; i++) {
            if (values[i] != FREE && values[i] != state.bit(i))
                return false;
        }
        return true;
    }

    /** True if every state of {@code other} is also in this subspace. */
    public boolean includes(TrapSpace other) {
        for (int i = 0; i < values.length; i++) {
            if (values[i] != FREE && values[i] != other.values[i])
                return false;
        }
        return true;
    }

    /**
     * Every complete state consistent with the assignment. The result has
     * {@code 2^freeCount} elements.
     */
    public Set<State> expand() {
        List<Integer> free = freeNodes();
        if (free.size() > 30)
            throw new ResourceExceededException("Trap space with " + free.size() + " free nodes is too large to expand");
        boolean[] bits = new boolean[values.length];
        for (int i = 0; i < values.length; i++)
            bits[i] = values[i] == 1;
        int combinations = 1 << free.size();
        Set<State> states = new LinkedHashSet<>(combinations * 2);
        for (int mask = 0; mask < combinations; mask++) {
            for (int j = 0; j < free.size(); j++)
                bits[free.get(j)] = ((mask >> j) & 1) == 1;
            states.add(State.of(bits));
        }
        return Collections.unmodifiableSet(states);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TrapSpace other && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    /** Compact form, e.g. {@code 1-0} for node 1 free. */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(values.length);
        for (int v : values)
            sb.append(v == FREE ? '-' : (char) ('0' + v));
        return sb.toString();
    }
}
