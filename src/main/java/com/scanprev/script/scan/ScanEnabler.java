package com.scanprev.script.scan;

import java.util.Collections;
import java.util.List;
import java.util.function.UnaryOperator;

import com.scanprev.debug.Debug;
import com.scanprev.script.parser.Lexer;
import com.scanprev.script.parser.Statement.Decorator;
import com.scanprev.script.parser.Statement.FunctionStmt;
import com.scanprev.script.parser.Statement.Stmt;

/**
 * Turns every builder of a function whose term reads {@code placeholder} into a running scan, where
 * {@code placeholder} is the output produced just before.
 *
 * <pre>
 *   &#64;scan(prev)
 *   function sums(xs) { return [prev + x for x in xs]; }   // sums([1, 2, 3]) == [1, 3, 6]
 * </pre>
 *
 * The whole function is checked for names that collide with the placeholder before anything is
 * rewritten, so a failing function is never half transformed. The input tree is not modified.
 */
public final class ScanEnabler implements UnaryOperator<FunctionStmt> {
    private static final String TAG = "ScanEnabler";

    /** Name of the decorator that enables scanning. */
    public static final String DECORATOR = "scan";

    private final String placeholder;

    private ScanEnabler(String placeholder) {
        this.placeholder = placeholder;
    }

    /**
     * @throws IllegalArgumentException if {@code placeholder} is not a plain identifier
     */
    public static ScanEnabler enableScan(String placeholder) {
        if (!Lexer.isIdentifier(placeholder)) {
            throw new IllegalArgumentException("Placeholder must be an identifier: " + placeholder);
        }
        return new ScanEnabler(placeholder);
    }

    public String placeholder() {
        return placeholder;
    }

    @Override
    public FunctionStmt apply(FunctionStmt fn) {
        String unitName = fn.name.lexeme;

        new ConflictChecker(placeholder, unitName).check(fn);

        ScanRewriter rewriter = new ScanRewriter(placeholder, unitName);
        List<Stmt> body = rewriter.rewriteAll(fn.body);

        Debug.get().d(TAG, "enabled '" + placeholder + "' in " + unitName + ": "
                + rewriter.rewrites() + " builder(s) rewritten");
        return new FunctionStmt(fn.name, fn.params, body, Collections.<Decorator>emptyList());
    }

    /**
     * Applies the decorators written in front of {@code fn}. Only a single {@code @scan(name)} is
     * recognised; a function without decorators is returned as is.
     */
    public static FunctionStmt applyDecorators(FunctionStmt fn) {
        if (fn.decorators == null || fn.decorators.isEmpty()) return fn;

        for (Decorator d : fn.decorators) {
            if (!DECORATOR.equals(d.name.lexeme)) {
                throw new RuntimeException("[line " + d.name.line + "] Unknown decorator: @" + d.name.lexeme);
            }
        }
        if (fn.decorators.size() > 1) {
            Decorator second = fn.decorators.get(1);
            throw new RuntimeException("[line " + second.name.line + "] Only one @" + DECORATOR
                    + " decorator is allowed on " + fn.name.lexeme);
        }

        return enableScan(fn.decorators.get(0).argumentText()).apply(fn);
    }
}
