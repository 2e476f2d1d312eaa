package com.genenet.rbn.api;

/**
 * The update rule of a single node.
 *
 * A rule maps the current values of the node's parents (in parent-list order)
 * to the node's next value. Rules are immutable and pure: evaluating the same
 * input twice always yields the same output, so one rule can be shared across
 * any number of simulated trajectories.
 *
 * Every rule also carries a human-readable symbolic expression over its
 * parents, written with {@code ¬}, {@code ∧} and {@code ∨}. This expression is
 * what gets translated into the rule-file grammar of trap-space solvers, so it
 * must describe exactly the function computed by {@link #evaluate(boolean[])}.
 */
public interface Rule {

    /**
     * Number of parent values this rule reads. Zero for constant rules.
     *
     * @return the arity of the rule.
     */
    int arity();

    /**
     * Computes the next value of the node.
     *
     * The input array is a scratch buffer owned by the caller and may be
     * reused between invocations. Implementations must not retain it.
     *
     * @param parentValues current values of the parents, length {@link #arity()}.
     * @return the new node value.
     */
    boolean evaluate(boolean[] parentValues);

    /**
     * Symbolic form of the rule, e.g. {@code ¬((X1 ∧ ¬X2) ∨ X0)}.
     * Constant rules render as {@code 0} or {@code 1}.
     */
    String expression();
}
