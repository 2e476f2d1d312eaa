package com.genenet.rbn.api;

/**
 * Attractor analysis of a network could not be completed. Analysis is
 * all-or-nothing: when this is thrown no partial attractor list exists.
 */
public abstract class AnalysisException extends RuntimeException {
    protected AnalysisException(String message) {
        super(message);
    }

    protected AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Short kind label for reports, e.g. {@code ResourceExceeded}. */
    public abstract String kind();
}
