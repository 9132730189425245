package com.scanprev.script.error;

/** The placeholder collides with a name the enabled function binds itself. */
public final class NameConflictException extends PlaceholderException {

    private static final long serialVersionUID = 1L;

    public NameConflictException(String message, String placeholder, String unitName, int line) {
        super(message, placeholder, unitName, line);
    }
}
