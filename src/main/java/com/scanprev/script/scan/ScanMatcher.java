package com.scanprev.script.scan;

import java.util.ArrayList;
import java.util.List;

import com.scanprev.script.error.AmbiguousPlaceholderUseException;
import com.scanprev.script.error.UnsupportedPlaceholderUseException;
import com.scanprev.script.parser.Expr.Builder;
import com.scanprev.script.parser.Expr.Clause;
import com.scanprev.script.parser.Expr.ExprInterface;

/**
 * Decides whether a builder reads the placeholder as "previous output".
 *
 * <p>A builder is a scan iff the placeholder occurs free in its term. Free means not bound by the
 * builder's own clauses, by a builder nested inside the term, or by an enclosing builder
 * ({@code enclosing}). A placeholder read in more than one clause source is rejected, and so is one
 * read in a filter of a builder that is a scan.
 */
public final class ScanMatcher {
    private final String placeholder;
    private final String unitName;

    public ScanMatcher(String placeholder, String unitName) {
        this.placeholder = placeholder;
        this.unitName = unitName;
    }

    public ScanMatch match(Builder builder) {
        return match(builder, LexicalScope.root());
    }

    ScanMatch match(Builder builder, LexicalScope enclosing) {
        int line = builder.bracket.line;
        LexicalScope scope = enclosing;
        int sourcesReading = 0;
        List<String> stepParams = new ArrayList<>();
        stepParams.add(placeholder);
        boolean filterReads = false;

        for (Clause clause : builder.clauses) {
            if (FreeReferenceScanner.occursFree(placeholder, clause.source, scope)) sourcesReading++;
            scope = scope.child().bind(clause.name.lexeme);
            stepParams.add(clause.name.lexeme);
            for (ExprInterface filter : clause.filters) {
                if (FreeReferenceScanner.occursFree(placeholder, filter, scope)) filterReads = true;
            }
        }

        if (sourcesReading > 1) {
            throw new AmbiguousPlaceholderUseException(
                    "Placeholder read in " + sourcesReading + " clause sources of one builder",
                    placeholder, unitName, line);
        }

        if (!FreeReferenceScanner.occursFree(placeholder, builder.term, scope)) {
            return ScanMatch.none();
        }

        if (filterReads) {
            throw new UnsupportedPlaceholderUseException(
                    "Placeholder read in a filter of a scanned builder", placeholder, unitName, line);
        }

        return ScanMatch.of(builder.term, stepParams, builder.clauses.get(0).source);
    }
}
