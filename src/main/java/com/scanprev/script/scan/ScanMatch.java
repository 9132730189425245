package com.scanprev.script.scan;

import java.util.Collections;
import java.util.List;

import com.scanprev.script.parser.Expr.ExprInterface;

/**
 * Result of matching one builder. For a scan, the step is {@code (stepParams) -> term} with the
 * placeholder as first parameter, applied over the bindings drawn from {@code source}.
 */
public final class ScanMatch {
    private static final ScanMatch NONE = new ScanMatch(false, null, Collections.<String>emptyList(), null);

    private final boolean scan;
    private final ExprInterface term;
    private final List<String> stepParams;
    private final ExprInterface source;

    private ScanMatch(boolean scan, ExprInterface term, List<String> stepParams, ExprInterface source) {
        this.scan = scan;
        this.term = term;
        this.stepParams = stepParams;
        this.source = source;
    }

    public static ScanMatch none() {
        return NONE;
    }

    public static ScanMatch of(ExprInterface term, List<String> stepParams, ExprInterface source) {
        return new ScanMatch(true, term, Collections.unmodifiableList(stepParams), source);
    }

    public boolean isScan() { return scan; }

    public ExprInterface term() { return term; }

    public List<String> stepParams() { return stepParams; }

    /** Source of the first clause. */
    public ExprInterface source() { return source; }

    @Override
    public String toString() {
        return scan ? "scan" + stepParams : "none";
    }
}
