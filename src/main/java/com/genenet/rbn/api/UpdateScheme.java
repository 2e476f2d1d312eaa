package com.genenet.rbn.api;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * Update discipline used to advance a network by one step.
 */
public enum UpdateScheme {
    /** All nodes recomputed simultaneously from the same prior state. */
    SYNCHRONOUS("sync"),
    /** One uniformly chosen node recomputed per step. */
    ASYNCHRONOUS("async");

    private final String label;

    UpdateScheme(String label) {
        this.label = label;
    }

    /** Short label used in file names and reports. */
    public String label() {
        return label;
    }

    @JsonCreator
    public static UpdateScheme fromString(String value) {
        for (UpdateScheme s : values()) {
            if (s.label.equalsIgnoreCase(value) || s.name().equalsIgnoreCase(value))
                return s;
        }
        throw new IllegalArgumentException("Unknown update scheme: " + value);
    }
}
