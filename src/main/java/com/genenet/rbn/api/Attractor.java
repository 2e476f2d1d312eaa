package com.genenet.rbn.api;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A non-empty set of states closed under an update scheme and minimal with
 * that property. Under synchronous update this is a cycle of the
 * deterministic transition map (a fixed point when it has one state). Under
 * asynchronous update it is the state set of a minimal trap space.
 *
 * Two attractors are equal when their state sets are equal.
 */
public final class Attractor {
    private final Set<State> states;

    public Attractor(Set<State> states) {
        if (states.isEmpty())
            throw new IllegalArgumentException("Attractor must contain at least one state");
        this.states = Collections.unmodifiableSet(new LinkedHashSet<>(states));
    }

    public Set<State> states() {
        return states;
    }

    public int size() {
        return states.size();
    }

    public boolean contains(State state) {
        return states.contains(state);
    }

    public boolean isFixedPoint() {
        return states.size() == 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        return o instanceof Attractor other && states.equals(other.states);
    }

    @Override
    public int hashCode() {
        return states.hashCode();
    }

    @Override
    public String toString() {
        return "Attractor" + states;
    }
}
