package com.scanprev.script.error;

/** The placeholder is free in more than one clause source of a single builder expression. */
public final class AmbiguousPlaceholderUseException extends PlaceholderException {

    private static final long serialVersionUID = 1L;

    public AmbiguousPlaceholderUseException(String message, String placeholder, String unitName, int line) {
        super(message, placeholder, unitName, line);
    }
}
