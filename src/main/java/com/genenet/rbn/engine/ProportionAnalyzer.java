package com.genenet.rbn.engine;

import com.genenet.rbn.api.Attractor;
import com.genenet.rbn.api.Proportions;
import com.genenet.rbn.api.State;
import com.genenet.rbn.api.Trajectory;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Splits the states of a trajectory into transient states and attractor
 * members.
 *
 * The union of all attractor state sets is built once on construction and is
 * read-only afterwards, so one analyzer can score any number of trajectories,
 * from any number of threads.
 *
 * With no attractors at all, every trajectory is reported as entirely
 * transient, {@code (1.0, 0.0)}.
 */
public final class ProportionAnalyzer {
    private final Set<State> attractorStates;
    private final boolean empty;

    public ProportionAnalyzer(List<Attractor> attractors) {
        Set<State> union = new HashSet<>();
        for (Attractor a : attractors)
            union.addAll(a.states());
        this.attractorStates = Collections.unmodifiableSet(union);
        this.empty = attractors.isEmpty();
    }

    public static Proportions proportions(Trajectory trajectory, List<Attractor> attractors) {
        return new ProportionAnalyzer(attractors).analyze(trajectory);
    }

    /** True if {@code state} belongs to some attractor. */
    public boolean isAttractorState(State state) {
        return attractorStates.contains(state);
    }

    /**
     * Per-state classification: element {@code t} is true when the
     * {@code t}-th state is an attractor member.
     */
    public boolean[] classify(Trajectory trajectory) {
        boolean[] members = new boolean[trajectory.length()];
        for (int t = 0; t < members.length; t++)
            members[t] = attractorStates.contains(trajectory.get(t));
        return members;
    }

    /**
     * Fractions of transient and attractor states over the whole trajectory,
     * initial state included.
     */
    public Proportions analyze(Trajectory trajectory) {
        if (empty)
            return Proportions.ALL_TRANSIENT;
        int inAttractor = 0;
        for (State s : trajectory.states()) {
            if (attractorStates.contains(s))
                inAttractor++;
        }
        return Proportions.ofCounts(inAttractor, trajectory.length());
    }

    /** Size of the union of all attractor state sets. */
    public int attractorStateCount() {
        return attractorStates.size();
    }
}
