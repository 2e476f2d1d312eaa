package com.genenet.rbn.solver;

import com.genenet.rbn.api.Network;
import com.genenet.rbn.api.NetworkNode;
import com.genenet.rbn.api.ResourceExceededException;
import com.genenet.rbn.api.SolverFailureException;
import com.genenet.rbn.api.State;
import com.genenet.rbn.api.TrapSpace;
import com.genenet.rbn.api.TrapSpaceSolver;
import com.genenet.rbn.io.BnetFormat;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Exact in-process minimal trap-space solver for small networks.
 *
 * <p>
 * For a state {@code x}, the smallest trap space containing it is found by
 * closure: start with every node fixed to its value in {@code x}, then keep
 * freeing any fixed node whose rule is not constantly equal to its fixed
 * value over the current subspace. A node freed this way must be free in
 * every trap space containing {@code x}, so the fixpoint is the smallest one.
 *
 * <p>
 * Every minimal trap space is the closure of any of its states, so the
 * minimal trap spaces are exactly the inclusion-minimal closures over all
 * {@code 2^n} states. Cost is exponential in {@code n}; networks whose state
 * space exceeds {@code maxStates} are rejected with
 * {@link ResourceExceededException}.
 */
@Log4j2
public final class ExhaustiveTrapSpaceSolver implements TrapSpaceSolver {
    public static final long DEFAULT_MAX_STATES = 1L << 20;

    private final long maxStates;

    public ExhaustiveTrapSpaceSolver() {
        this(DEFAULT_MAX_STATES);
    }

    public ExhaustiveTrapSpaceSolver(long maxStates) {
        this.maxStates = maxStates;
    }

    @Override
    public List<Map<String, Integer>> computeMinimalTrapSpaces(String bnetRules) {
        Network network;
        try {
            network = BnetFormat.parse(bnetRules);
        } catch (IllegalArgumentException e) {
            throw new SolverFailureException("Cannot parse rule set: " + e.getMessage(), e);
        }

        List<Map<String, Integer>> result = new ArrayList<>();
        for (TrapSpace space : minimalTrapSpaces(network)) {
            Map<String, Integer> assignment = new LinkedHashMap<>();
            for (int i = 0; i < space.size(); i++) {
                if (!space.isFree(i))
                    assignment.put(network.nodeName(i), space.value(i));
            }
            result.add(assignment);
        }
        return result;
    }

    /** Minimal trap spaces of a network, fewest free nodes first. */
    public List<TrapSpace> minimalTrapSpaces(Network network) {
        int n = network.size();
        if (n > 30 || (1L << n) > maxStates) {
            throw new ResourceExceededException(
                    "Trap-space search over 2^" + n + " states exceeds the bound of " + maxStates + " states");
        }

        Set<TrapSpace> closures = new LinkedHashSet<>();
        for (long x = 0; x < (1L << n); x++)
            closures.add(closure(network, State.fromIndex(x, n)));

        // Minimal trap spaces are pairwise disjoint and each is the closure of its
        // own states, so scanning by increasing free-node count, a closure is
        // minimal iff it includes none of the minimal ones accepted so far.
        List<TrapSpace> ordered = new ArrayList<>(closures);
        ordered.sort(Comparator.comparingInt(t -> t.freeNodes().size()));
        List<TrapSpace> minimal = new ArrayList<>();
        for (TrapSpace candidate : ordered) {
            boolean isMinimal = true;
            for (TrapSpace accepted : minimal) {
                if (candidate.includes(accepted)) {
                    isMinimal = false;
                    break;
                }
            }
            if (isMinimal)
                minimal.add(candidate);
        }
        log.debug("{} distinct closure(s), {} minimal trap space(s)", closures.size(), minimal.size());
        return minimal;
    }

    /** Smallest trap space containing {@code state}. */
    static TrapSpace closure(Network network, State state) {
        int n = network.size();
        int[] values = new int[n];
        for (int i = 0; i < n; i++)
            values[i] = state.bit(i);

        boolean changed = true;
        while (changed) {
            changed = false;
            for (int i = 0; i < n; i++) {
                if (values[i] != TrapSpace.FREE && !constantOver(network.node(i), values, values[i] == 1)) {
                    values[i] = TrapSpace.FREE;
                    changed = true;
                }
            }
        }
        return new TrapSpace(values);
    }

    // True if the node's rule yields `expected` for every assignment of its free parents.
    private static boolean constantOver(NetworkNode node, int[] values, boolean expected) {
        int k = node.parentCount();
        boolean[] bits = new boolean[k];
        int[] freePositions = new int[k];
        int free = 0;
        for (int j = 0; j < k; j++) {
            int v = values[node.parent(j)];
            if (v == TrapSpace.FREE)
                freePositions[free++] = j;
            else
                bits[j] = v == 1;
        }
        for (int mask = 0; mask < (1 << free); mask++) {
            for (int f = 0; f < free; f++)
                bits[freePositions[f]] = ((mask >> f) & 1) == 1;
            if (node.rule().evaluate(bits) != expected)
                return false;
        }
        return true;
    }
}
