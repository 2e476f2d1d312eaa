package com.genenet.rbn.api;

/**
 * The trap-space solver failed or returned data that could not be
 * interpreted.
 */
public class SolverFailureException extends AnalysisException {
    public SolverFailureException(String message) {
        super(message);
    }

    public SolverFailureException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String kind() {
        return "SolverFailure";
    }
}
