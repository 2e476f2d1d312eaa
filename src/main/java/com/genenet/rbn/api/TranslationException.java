package com.genenet.rbn.api;

/**
 * A rule expression could not be mapped to the solver grammar. This means the
 * rule generator and the translator disagree and is a programming defect.
 */
public class TranslationException extends IllegalStateException {
    public TranslationException(String message) {
        super(message);
    }
}
