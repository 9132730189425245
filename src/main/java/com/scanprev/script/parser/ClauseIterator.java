package com.scanprev.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import com.scanprev.script.parser.Expr.Clause;

/**
 * Walks the clauses of a builder depth-first and yields one scope per accepted combination of
 * loop variables. Filters run before anything deeper is evaluated, and nothing past the first
 * source is evaluated until the consumer asks for it.
 *
 * <p>With {@code headFirst} the first yielded scope binds only the first clause: the first accepted
 * element of the first source, without descending into later clauses. Iteration then resumes at
 * the next element of the first source.
 */
final class ClauseIterator implements Iterator<Environment> {
    private final Interpreter interpreter;
    private final List<Clause> clauses;
    private final Environment parent;
    private final List<Iterator<Value>> iterators;
    private final Environment[] scopes;
    private boolean headPending;

    private int depth = 0;
    private Environment pending;
    private boolean exhausted;

    /**
     * @param sourceEnv where the first clause's source is evaluated (right away)
     * @param parent    parent of the scopes that bind the loop variables
     */
    ClauseIterator(Interpreter interpreter, List<Clause> clauses, Environment sourceEnv, Environment parent) {
        this(interpreter, clauses, sourceEnv, parent, false);
    }

    ClauseIterator(Interpreter interpreter, List<Clause> clauses, Environment sourceEnv, Environment parent,
                   boolean headFirst) {
        this.interpreter = interpreter;
        this.headPending = headFirst;
        this.clauses = clauses;
        this.parent = parent;
        this.iterators = new ArrayList<>(Collections.nCopies(clauses.size(), (Iterator<Value>) null));
        this.scopes = new Environment[clauses.size()];
        iterators.set(0, iterate(clauses.get(0), sourceEnv));
    }

    @Override
    public boolean hasNext() {
        if (pending == null && !exhausted) {
            pending = advance();
            exhausted = (pending == null);
        }
        return pending != null;
    }

    @Override
    public Environment next() {
        if (!hasNext()) throw new NoSuchElementException();
        Environment out = pending;
        pending = null;
        return out;
    }

    private Environment advance() {
        while (depth >= 0) {
            Iterator<Value> it = iterators.get(depth);
            if (!it.hasNext()) {
                depth--;
                continue;
            }
            Clause clause = clauses.get(depth);
            Environment scope = (depth == 0 ? parent : scopes[depth - 1]).childScope();
            scope.define(clause.name.lexeme, it.next());
            if (!accepts(clause, scope)) continue;

            if (headPending) {
                headPending = false;
                return scope;
            }
            scopes[depth] = scope;
            if (depth == clauses.size() - 1) return scope;
            depth++;
            iterators.set(depth, iterate(clauses.get(depth), scope));
        }
        return null;
    }

    private boolean accepts(Clause clause, Environment scope) {
        for (Expr.ExprInterface filter : clause.filters) {
            if (!Interpreter.isTruthy(interpreter.evalIn(filter, scope))) return false;
        }
        return true;
    }

    private Iterator<Value> iterate(Clause clause, Environment scope) {
        Value source = interpreter.evalIn(clause.source, scope);
        if (!source.isIterable()) {
            throw new RuntimeException("[line " + clause.name.line + "] Cannot iterate over "
                    + source.getType() + " in 'for " + clause.name.lexeme + "'");
        }
        return source.iterator();
    }
}
