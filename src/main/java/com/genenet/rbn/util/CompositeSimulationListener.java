package com.genenet.rbn.util;

import com.genenet.rbn.api.SimulationListener;
import com.genenet.rbn.api.State;
import com.genenet.rbn.api.Trajectory;
import com.genenet.rbn.api.UpdateScheme;

import java.util.Arrays;

/**
 * Aggregates multiple {@link SimulationListener} instances with
 * zero-allocation iteration.
 */
public class CompositeSimulationListener implements SimulationListener {
    private SimulationListener[] listeners = new SimulationListener[0];

    public void add(SimulationListener listener) {
        SimulationListener[] old = listeners;
        SimulationListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onTrajectoryStart(long run, UpdateScheme scheme, State initial) {
        for (SimulationListener l : listeners)
            l.onTrajectoryStart(run, scheme, initial);
    }

    @Override
    public void onStep(long run, int step, State previous, State next) {
        for (SimulationListener l : listeners)
            l.onStep(run, step, previous, next);
    }

    @Override
    public void onError(long run, int step, Throwable error) {
        for (SimulationListener l : listeners)
            l.onError(run, step, error);
    }

    @Override
    public void onTrajectoryEnd(long run, Trajectory trajectory) {
        for (SimulationListener l : listeners)
            l.onTrajectoryEnd(run, trajectory);
    }
}
