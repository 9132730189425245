package com.scanprev.script.error;

/** A scan without a start value was asked for its first output but the source had no element. */
public final class EmptySourceException extends ScanException {

    private static final long serialVersionUID = 1L;

    public EmptySourceException() {
        super("scan() without a start value needs a non-empty source", Phase.EVALUATION);
    }
}
