package com.scanprev.script.error;

/** last() was given a sequence that yielded nothing. */
public final class EmptySequenceException extends ScanException {

    private static final long serialVersionUID = 1L;

    public EmptySequenceException() {
        super("last() of an empty sequence", Phase.EVALUATION);
    }
}
