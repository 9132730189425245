package com.scanprev.script.error;

/** Base for enabling-time errors tied to a placeholder name and a source line. */
public abstract class PlaceholderException extends ScanException {

    private static final long serialVersionUID = 1L;

    private final String placeholder;
    private final String unitName;
    private final int line;

    protected PlaceholderException(String message, String placeholder, String unitName, int line) {
        super("[line " + line + "] " + message + " (placeholder '" + placeholder + "' in " + unitName + ")",
                Phase.TRANSFORM);
        this.placeholder = placeholder;
        this.unitName = unitName;
        this.line = line;
    }

    public String placeholder() {
        return placeholder;
    }

    /** Name of the function being enabled. */
    public String unitName() {
        return unitName;
    }

    public int line() {
        return line;
    }
}
