package com.scanprev.script.scan;

import java.util.HashSet;
import java.util.Set;

/** Names bound while walking a tree. Lookups fall back to the enclosing scope. */
final class LexicalScope {
    private final LexicalScope parent;
    private final Set<String> names = new HashSet<>();

    private LexicalScope(LexicalScope parent) {
        this.parent = parent;
    }

    static LexicalScope root() {
        return new LexicalScope(null);
    }

    LexicalScope child() {
        return new LexicalScope(this);
    }

    LexicalScope bind(String name) {
        names.add(name);
        return this;
    }

    boolean isBound(String name) {
        for (LexicalScope s = this; s != null; s = s.parent) {
            if (s.names.contains(name)) return true;
        }
        return false;
    }
}
