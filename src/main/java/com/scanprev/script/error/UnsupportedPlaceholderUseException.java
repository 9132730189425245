package com.scanprev.script.error;

/** The placeholder is used in the filter of a builder that is being turned into a scan. */
public final class UnsupportedPlaceholderUseException extends PlaceholderException {

    private static final long serialVersionUID = 1L;

    public UnsupportedPlaceholderUseException(String message, String placeholder, String unitName, int line) {
        super(message, placeholder, unitName, line);
    }
}
