package com.genenet.rbn.engine;

import com.genenet.rbn.api.AnalysisException;
import com.genenet.rbn.api.Attractor;
import com.genenet.rbn.api.Network;
import com.genenet.rbn.api.SolverFailureException;
import com.genenet.rbn.api.TrapSpace;
import com.genenet.rbn.api.TrapSpaceSolver;
import com.genenet.rbn.io.BnetFormat;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Characterises the asynchronous attractors of a network as its minimal trap
 * spaces.
 *
 * <ol>
 * <li>Translate every rule expression to the {@code .bnet} grammar.</li>
 * <li>Call the {@link TrapSpaceSolver} once for the whole network.</li>
 * <li>Turn each returned partial assignment into a {@link TrapSpace} and
 * expand it into every complete state it contains.</li>
 * </ol>
 *
 * Minimality is the solver's contract and is not re-checked here. Solver
 * errors and malformed solver output raise {@link SolverFailureException}; an
 * empty list is only returned when the solver itself reported no trap spaces.
 */
public final class AsyncAttractorFinder {
    private static final Logger log = LogManager.getLogger(AsyncAttractorFinder.class);

    private final TrapSpaceSolver solver;

    public AsyncAttractorFinder(TrapSpaceSolver solver) {
        this.solver = solver;
    }

    /**
     * Computes the asynchronous attractors.
     *
     * @param network the network.
     * @return one attractor per minimal trap space, in solver order.
     * @throws SolverFailureException                           if the solver
     *                                                          fails or returns
     *                                                          malformed data.
     * @throws com.genenet.rbn.api.ResourceExceededException    if the solver
     *                                                          hits a bound.
     * @throws com.genenet.rbn.api.TranslationException         if a rule cannot
     *                                                          be translated.
     */
    public List<Attractor> find(Network network) {
        List<TrapSpace> spaces = findTrapSpaces(network);
        List<Attractor> attractors = new ArrayList<>(spaces.size());
        for (TrapSpace space : spaces)
            attractors.add(new Attractor(space.expand()));
        log.debug("Asynchronous analysis: {} minimal trap space(s)", attractors.size());
        return attractors;
    }

    /** The minimal trap spaces reported by the solver, duplicates removed. */
    public List<TrapSpace> findTrapSpaces(Network network) {
        String bnet = BnetFormat.toBnet(network);

        List<Map<String, Integer>> assignments;
        try {
            assignments = solver.computeMinimalTrapSpaces(bnet);
        } catch (AnalysisException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SolverFailureException("Trap-space solver failed: " + e.getMessage(), e);
        }
        if (assignments == null)
            throw new SolverFailureException("Trap-space solver returned no result");

        Set<TrapSpace> spaces = new LinkedHashSet<>();
        for (Map<String, Integer> assignment : assignments)
            spaces.add(toTrapSpace(assignment, network.size()));
        return List.copyOf(spaces);
    }

    private static TrapSpace toTrapSpace(Map<String, Integer> assignment, int n) {
        if (assignment == null)
            throw new SolverFailureException("Trap-space solver returned a null assignment");
        int[] values = new int[n];
        Arrays.fill(values, TrapSpace.FREE);
        for (Map.Entry<String, Integer> e : assignment.entrySet()) {
            int node;
            try {
                node = BnetFormat.nodeIndex(e.getKey(), n);
            } catch (IllegalArgumentException ex) {
                throw new SolverFailureException("Solver returned unknown node identifier '" + e.getKey() + "'", ex);
            }
            Integer v = e.getValue();
            if (v == null || (v != 0 && v != 1))
                throw new SolverFailureException("Solver returned value " + v + " for node " + e.getKey());
            values[node] = v;
        }
        return new TrapSpace(values);
    }
}
