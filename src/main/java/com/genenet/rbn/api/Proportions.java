package com.genenet.rbn.api;

import java.util.Locale;

/**
 * Share of a trajectory's states that are transient versus attractor members.
 * Both fractions lie in {@code [0, 1]} and sum to 1.
 *
 * @param transientFraction fraction of states outside every attractor.
 * @param attractorFraction fraction of states inside some attractor.
 */
public record Proportions(double transientFraction, double attractorFraction) {

    /** Result used when no attractors are known: everything counts as transient. */
    public static final Proportions ALL_TRANSIENT = new Proportions(1.0, 0.0);

    public Proportions {
        if (transientFraction < 0.0 || transientFraction > 1.0 || attractorFraction < 0.0 || attractorFraction > 1.0)
            throw new IllegalArgumentException(
                    "Fractions must lie in [0, 1]: " + transientFraction + ", " + attractorFraction);
    }

    public static Proportions ofCounts(int attractorStates, int total) {
        if (total <= 0)
            throw new IllegalArgumentException("Trajectory length must be positive, got " + total);
        double a = (double) attractorStates / total;
        return new Proportions(1.0 - a, a);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%.3f, %.3f", transientFraction, attractorFraction);
    }
}
