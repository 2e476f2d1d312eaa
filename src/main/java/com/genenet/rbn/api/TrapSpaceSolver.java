package com.genenet.rbn.api;

import java.util.List;
import java.util.Map;

/**
 * Capability interface for a minimal trap-space solver.
 *
 * The input is a complete rule set in the {@code .bnet} text grammar: one
 * {@code <node-id>, <expression>} line per node, with {@code !}, {@code &}
 * and {@code |} as NOT, AND and OR. The output is one partial assignment per
 * minimal trap space, mapping the fixed node identifiers to 0 or 1; nodes
 * missing from an assignment are free.
 *
 * Implementations must return inclusion-minimal trap spaces only. Failures
 * must surface as {@link SolverFailureException} (or
 * {@link ResourceExceededException} when a bound is hit), never as an empty
 * result.
 */
@FunctionalInterface
public interface TrapSpaceSolver {

    /**
     * Computes the minimal trap spaces of a rule set.
     *
     * @param bnetRules the rule file contents.
     * @return partial assignments, one per minimal trap space.
     */
    List<Map<String, Integer>> computeMinimalTrapSpaces(String bnetRules);
}
