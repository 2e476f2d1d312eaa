package com.genenet.rbn.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A finite, ordered sequence of states produced from one initial state by
 * repeated application of one update scheme. The first element is the
 * initial state.
 */
public final class Trajectory {
    private final UpdateScheme scheme;
    private final List<State> states;

    public Trajectory(UpdateScheme scheme, List<State> states) {
        if (states.isEmpty())
            throw new IllegalArgumentException("Trajectory must contain at least the initial state");
        this.scheme = scheme;
        this.states = Collections.unmodifiableList(new ArrayList<>(states));
    }

    public UpdateScheme scheme() {
        return scheme;
    }

    public List<State> states() {
        return states;
    }

    public State get(int t) {
        return states.get(t);
    }

    public State initial() {
        return states.get(0);
    }

    public State last() {
        return states.get(states.size() - 1);
    }

    public int length() {
        return states.size();
    }

    public int nodeCount() {
        return states.get(0).size();
    }

    /**
     * Keeps every {@code stride}-th state starting with the initial one.
     *
     * @param stride sampling stride, at least 1.
     * @return the sampled trajectory.
     */
    public Trajectory sample(int stride) {
        if (stride < 1)
            throw new IllegalArgumentException("Sampling stride must be >= 1, got " + stride);
        if (stride == 1)
            return this;
        List<State> sampled = new ArrayList<>(states.size() / stride + 1);
        for (int t = 0; t < states.size(); t += stride)
            sampled.add(states.get(t));
        return new Trajectory(scheme, sampled);
    }

    @Override
    public String toString() {
        return "Trajectory[" + scheme.label() + ", " + states.size() + " states]";
    }
}
