package com.scanprev.script.error;

/**
 * Abstract base for the scan engine's failures. Never thrown directly; the concrete subclasses
 * say whether the problem was found while enabling a function or while evaluating a sequence.
 */
public abstract class ScanException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        TRANSFORM,
        EVALUATION
    }

    private final Phase phase;

    protected ScanException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
