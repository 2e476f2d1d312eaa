package com.genenet.rbn.api;

import java.util.List;

/**
 * Outcome of attractor analysis for one network under one update scheme:
 * either the complete attractor list (possibly empty) or the reason analysis
 * is unavailable. The two are never conflated.
 */
public final class AnalysisResult {
    private final UpdateScheme scheme;
    private final List<Attractor> attractors;
    private final AnalysisException failure;

    private AnalysisResult(UpdateScheme scheme, List<Attractor> attractors, AnalysisException failure) {
        this.scheme = scheme;
        this.attractors = attractors;
        this.failure = failure;
    }

    public static AnalysisResult found(UpdateScheme scheme, List<Attractor> attractors) {
        return new AnalysisResult(scheme, List.copyOf(attractors), null);
    }

    public static AnalysisResult unavailable(UpdateScheme scheme, AnalysisException failure) {
        return new AnalysisResult(scheme, null, failure);
    }

    public UpdateScheme scheme() {
        return scheme;
    }

    public boolean isAvailable() {
        return failure == null;
    }

    /**
     * @return the attractors.
     * @throws IllegalStateException if analysis failed.
     */
    public List<Attractor> attractors() {
        if (failure != null)
            throw new IllegalStateException("Attractor analysis unavailable: " + describe(), failure);
        return attractors;
    }

    public AnalysisException failure() {
        return failure;
    }

    /** Report text, e.g. {@code 3} or {@code unavailable (SolverFailure: ...)}. */
    public String describe() {
        if (failure == null)
            return String.valueOf(attractors.size());
        return "unavailable (" + failure.kind() + ": " + failure.getMessage() + ")";
    }

    @Override
    public String toString() {
        return "AnalysisResult[" + scheme.label() + ", " + describe() + "]";
    }
}
