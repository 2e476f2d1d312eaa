package com.genenet.rbn.engine;

import com.genenet.rbn.api.Network;
import com.genenet.rbn.api.NetworkNode;
import com.genenet.rbn.api.SimulationListener;
import com.genenet.rbn.api.State;
import com.genenet.rbn.api.Trajectory;
import com.genenet.rbn.api.UpdateScheme;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Advances network states and produces trajectories.
 *
 * <p>
 * Update semantics:
 * <ul>
 * <li><b>Synchronous</b>: every node is recomputed from the pre-step state.
 * Zero-parent nodes evaluate their constant rule on every step, so a constant
 * node takes its rule's value after the first step whatever its initial
 * value.</li>
 * <li><b>Asynchronous</b>: one node, chosen uniformly among all {@code n}, is
 * recomputed from the pre-step state. At most one bit changes per step.</li>
 * </ul>
 *
 * <p>
 * All randomness (initial states, asynchronous node choice) comes from the
 * {@link Random} handed to the constructor, so a seeded engine reproduces its
 * trajectories exactly. The network is never modified.
 *
 * <p>
 * Circuit breaker: if a step fails (a listener or rule throws), listeners are
 * notified, the engine is marked unhealthy and further simulation is refused
 * until {@link #resetHealth()}.
 *
 * <p>
 * Not thread-safe. Use one engine, with its own random source, per thread.
 */
public final class DynamicsEngine {
    private static final Logger log = LogManager.getLogger(DynamicsEngine.class);

    private final Random random;
    private SimulationListener listener;

    // Scratch buffer for parent values, grown to the widest rule seen.
    private boolean[] scratch = new boolean[8];

    private boolean healthy = true;
    private long runs;

    public DynamicsEngine(Random random) {
        this.random = random;
    }

    public void setListener(SimulationListener listener) {
        this.listener = listener;
    }

    /**
     * One synchronous step.
     *
     * @param state   current state.
     * @param network the network.
     * @return the state after all nodes were recomputed simultaneously.
     */
    public State updateSync(State state, Network network) {
        checkSize(state, network);
        int n = network.size();
        boolean[] next = new boolean[n];
        for (int i = 0; i < n; i++)
            next[i] = evaluate(network.node(i), state);
        return State.of(next);
    }

    /**
     * One asynchronous step: recomputes a uniformly chosen node. A chosen node
     * without parents keeps its current value.
     *
     * @param state   current state.
     * @param network the network.
     * @return the state with at most one node changed.
     */
    public State updateAsync(State state, Network network) {
        checkSize(state, network);
        int chosen = random.nextInt(network.size());
        if (!network.node(chosen).hasParents())
            return state;
        return updateNode(state, network, chosen);
    }

    /**
     * Recomputes a single node from {@code state}, leaving all others as they
     * are.
     */
    public State updateNode(State state, Network network, int node) {
        return state.with(node, evaluate(network.node(node), state));
    }

    public State update(State state, Network network, UpdateScheme scheme) {
        return switch (scheme) {
            case SYNCHRONOUS -> updateSync(state, network);
            case ASYNCHRONOUS -> updateAsync(state, network);
        };
    }

    private boolean evaluate(NetworkNode node, State state) {
        int k = node.parentCount();
        if (scratch.length < k)
            scratch = new boolean[Math.max(k, scratch.length * 2)];
        for (int j = 0; j < k; j++)
            scratch[j] = state.get(node.parent(j));
        return node.rule().evaluate(scratch);
    }

    private static void checkSize(State state, Network network) {
        if (state.size() != network.size())
            throw new IllegalArgumentException(
                    "State has " + state.size() + " nodes but network has " + network.size());
    }

    /**
     * Simulates one trajectory from a uniform random initial state.
     *
     * @param network the network.
     * @param steps   number of updates to apply, at least 0.
     * @param scheme  update scheme.
     * @return {@code steps + 1} states, the initial state first.
     * @throws IllegalStateException if the engine is unhealthy, or becomes so
     *                               during this run.
     */
    public Trajectory simulate(Network network, int steps, UpdateScheme scheme) {
        return simulateFrom(State.random(network.size(), random), network, steps, scheme);
    }

    /**
     * Simulates {@code (samples - 1) * stride} steps and keeps every
     * {@code stride}-th state, giving {@code samples} states.
     */
    public Trajectory simulateSampled(Network network, int samples, int stride, UpdateScheme scheme) {
        if (samples < 1)
            throw new IllegalArgumentException("Sample count must be >= 1, got " + samples);
        if (stride < 1)
            throw new IllegalArgumentException("Sampling stride must be >= 1, got " + stride);
        return simulate(network, (samples - 1) * stride, scheme).sample(stride);
    }

    /** Simulates from a given initial state. */
    public Trajectory simulateFrom(State initial, Network network, int steps, UpdateScheme scheme) {
        if (!healthy) {
            throw new IllegalStateException(
                    "Engine is in unhealthy state due to previous errors. Manual reset required.");
        }
        if (steps < 0)
            throw new IllegalArgumentException("Steps must be >= 0, got " + steps);
        checkSize(initial, network);

        final long run = ++runs;
        final SimulationListener l = this.listener;
        final boolean hasListener = l != null;

        List<State> states = new ArrayList<>(steps + 1);
        states.add(initial);
        if (hasListener)
            l.onTrajectoryStart(run, scheme, initial);

        State state = initial;
        int step = 0;
        try {
            for (step = 1; step <= steps; step++) {
                State next = update(state, network, scheme);
                if (hasListener)
                    l.onStep(run, step, state, next);
                states.add(next);
                state = next;
            }
        } catch (RuntimeException e) {
            healthy = false;
            log.error("Simulation run {} failed at step {}", run, step, e);
            if (hasListener)
                l.onError(run, step, e);
            throw new IllegalStateException("Simulation failed at step " + step + ". Engine is now unhealthy.", e);
        }

        Trajectory trajectory = new Trajectory(scheme, states);
        if (hasListener)
            l.onTrajectoryEnd(run, trajectory);
        return trajectory;
    }

    public boolean isHealthy() {
        return healthy;
    }

    public void resetHealth() {
        this.healthy = true;
    }

    /** Number of trajectories started by this engine. */
    public long runs() {
        return runs;
    }
}
