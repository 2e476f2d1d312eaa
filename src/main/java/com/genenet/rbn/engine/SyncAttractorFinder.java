package com.genenet.rbn.engine;

import com.genenet.rbn.api.Attractor;
import com.genenet.rbn.api.Network;
import com.genenet.rbn.api.ResourceExceededException;
import com.genenet.rbn.api.State;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Finds all attractors of a network under synchronous update by exhaustive
 * traversal of its state space.
 *
 * <p>
 * Synchronous update is a total deterministic map on the {@code 2^n} states,
 * so every state lies on exactly one path that ends in a cycle. The finder
 * walks forward from every not yet visited state, recording the walk that
 * first reached each state and the state's depth in that walk:
 * <ul>
 * <li>reaching a state from the current walk closes a cycle: the states from
 * that state's depth onward form a new attractor;</li>
 * <li>reaching a state from an earlier walk means the path drains into an
 * already known attractor, and the walk stops.</li>
 * </ul>
 * Each state is transitioned from at most once, so the whole run costs
 * {@code O(2^n)} update evaluations and {@code O(2^n)} memory.
 *
 * <p>
 * <b>Exponential cost is inherent.</b> The search is exact and is only meant
 * for small networks (around 20 nodes or fewer). A network whose state space
 * exceeds {@code maxStates}, or a search running past {@code timeout}, fails
 * with {@link ResourceExceededException} instead of hanging or returning a
 * truncated result.
 */
public final class SyncAttractorFinder {
    private static final Logger log = LogManager.getLogger(SyncAttractorFinder.class);

    /** Default state-space bound: 2^22 states. */
    public static final long DEFAULT_MAX_STATES = 1L << 22;

    // Arrays indexed by state index cap the search at 2^30 states.
    private static final int HARD_MAX_NODES = 30;
    private static final int CLOCK_CHECK_MASK = 0xFFF;

    private final long maxStates;
    private final Duration timeout;
    // The synchronous step never draws random numbers.
    private final DynamicsEngine dynamics = new DynamicsEngine(new Random(0));

    public SyncAttractorFinder() {
        this(DEFAULT_MAX_STATES, null);
    }

    /**
     * @param maxStates largest state space to enumerate.
     * @param timeout   wall-clock bound for one {@link #find(Network)} call, or
     *                  {@code null} for none.
     */
    public SyncAttractorFinder(long maxStates, Duration timeout) {
        if (maxStates < 1)
            throw new IllegalArgumentException("maxStates must be >= 1, got " + maxStates);
        this.maxStates = maxStates;
        this.timeout = timeout;
    }

    /**
     * Enumerates the synchronous attractors.
     *
     * @param network the network.
     * @return attractors in discovery order, pairwise distinct.
     * @throws ResourceExceededException if the state space or time bound is
     *                                   exceeded.
     */
    public List<Attractor> find(Network network) {
        final int n = network.size();
        if (n > HARD_MAX_NODES || (1L << n) > maxStates) {
            throw new ResourceExceededException("Synchronous attractor search over 2^" + n
                    + " states exceeds the bound of " + maxStates + " states");
        }
        final int total = 1 << n;
        final long deadline = timeout == null ? Long.MAX_VALUE : System.nanoTime() + timeout.toNanos();

        // walk[s] == 0: unvisited; otherwise the id of the walk that reached s.
        final int[] walk = new int[total];
        final int[] depth = new int[total];
        final Set<Attractor> attractors = new LinkedHashSet<>();
        final List<State> path = new ArrayList<>();

        long transitions = 0;
        int walkId = 0;
        for (int start = 0; start < total; start++) {
            if (walk[start] != 0)
                continue;
            walkId++;
            path.clear();

            State state = State.fromIndex(start, n);
            int idx = start;
            while (walk[idx] == 0) {
                walk[idx] = walkId;
                depth[idx] = path.size();
                path.add(state);

                state = dynamics.updateSync(state, network);
                idx = (int) state.index();

                if ((++transitions & CLOCK_CHECK_MASK) == 0 && System.nanoTime() > deadline) {
                    throw new ResourceExceededException("Synchronous attractor search timed out after "
                            + transitions + " transitions (limit " + timeout + ")");
                }
            }

            if (walk[idx] == walkId) {
                Attractor cycle = new Attractor(new LinkedHashSet<>(path.subList(depth[idx], path.size())));
                if (attractors.add(cycle))
                    log.debug("Attractor of size {} found from state {}", cycle.size(), State.fromIndex(start, n));
            }
        }

        log.debug("Synchronous search over {} states: {} attractor(s), {} transitions",
                total, attractors.size(), transitions);
        return List.copyOf(attractors);
    }
}
