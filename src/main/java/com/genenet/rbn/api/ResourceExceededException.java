package com.genenet.rbn.api;

/**
 * State-space enumeration or a solver call went past its configured state
 * count or wall-clock bound.
 */
public class ResourceExceededException extends AnalysisException {
    public ResourceExceededException(String message) {
        super(message);
    }

    public ResourceExceededException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String kind() {
        return "ResourceExceeded";
    }
}
