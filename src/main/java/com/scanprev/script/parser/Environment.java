package com.scanprev.script.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class Environment {

    public final Environment parent;

    // LIFO of local scopes for THIS environment frame
    public final Deque<Map<String, Value>> scopes = new ArrayDeque<>();

    public Environment() {
        this.parent = null;
        scopes.push(new LinkedHashMap<>()); // root scope
    }

    public Environment(Map<String, Value> initial) {
        this.parent = null;
        scopes.push(new LinkedHashMap<>()); // root scope

        if (initial != null) {
            scopes.peek().putAll(initial);
        }
    }

    private Environment(Environment parent) {
        this.parent = parent;
        scopes.push(new LinkedHashMap<>()); // root scope for this frame
    }

    // -------------------------
    // Block-scoping (LIFO)
    // -------------------------
    public void pushBlock() {
        scopes.push(new LinkedHashMap<>());
    }

    public void popBlock() {
        if (scopes.size() <= 1) {
            throw new RuntimeException("Cannot pop root scope of environment frame");
        }
        scopes.pop();
    }

    private Map<String, Value> topScope() {
        Map<String, Value> top = scopes.peek();
        if (top == null) throw new RuntimeException("Environment scope stack is empty (bug)");
        return top;
    }

    // -------------------------
    // Vars API
    // -------------------------
    public void define(String name, Value value) {
        Map<String, Value> top = topScope();
        if (top.containsKey(name)) {
            throw new RuntimeException("Variable already defined: " + name);
        }
        top.put(name, value);
    }

    public Value get(String name) {
        // nearest scope in this env frame
        for (Map<String, Value> s : scopes) {
            if (s.containsKey(name)) return s.get(name);
        }

        // parent chain (function closures, builder bindings)
        if (parent != null) {
            return parent.get(name);
        }

        throw new RuntimeException("Undefined variable: " + name);
    }

    public boolean exists(String name) {
        for (Map<String, Value> s : scopes) {
            if (s.containsKey(name)) return true;
        }
        return parent != null && parent.exists(name);
    }

    public void assign(String name, Value value) {
        for (Map<String, Value> s : scopes) {
            if (s.containsKey(name)) {
                s.put(name, value);
                return;
            }
        }

        if (parent != null && parent.exists(name)) {
            parent.assign(name, value);
            return;
        }

        throw new RuntimeException("Undefined variable: " + name);
    }

    /** New frame whose lookups fall back to this one. */
    public Environment childScope() {
        return new Environment(this);
    }

    /** Merged view of this frame's scopes (bottom->top so top shadows). */
    public Map<String, Value> snapshot() {
        List<Map<String, Value>> bottomToTop = new ArrayList<>(scopes);
        Collections.reverse(bottomToTop);

        Map<String, Value> out = new LinkedHashMap<>();
        for (Map<String, Value> s : bottomToTop) {
            out.putAll(s);
        }
        return out;
    }
}
