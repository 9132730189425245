package com.scanprev.script.scan;

import java.util.List;

import com.scanprev.script.parser.Expr;
import com.scanprev.script.parser.Expr.Assign;
import com.scanprev.script.parser.Expr.Binary;
import com.scanprev.script.parser.Expr.Builder;
import com.scanprev.script.parser.Expr.Call;
import com.scanprev.script.parser.Expr.CallArg;
import com.scanprev.script.parser.Expr.Clause;
import com.scanprev.script.parser.Expr.ExprInterface;
import com.scanprev.script.parser.Expr.IndexExpr;
import com.scanprev.script.parser.Expr.Literal;
import com.scanprev.script.parser.Expr.Logical;
import com.scanprev.script.parser.Expr.ScanExpr;
import com.scanprev.script.parser.Expr.SetIndexExpr;
import com.scanprev.script.parser.Expr.SetLiteral;
import com.scanprev.script.parser.Expr.Unary;
import com.scanprev.script.parser.Expr.Variable;

/**
 * Answers whether a name is referenced free in an expression. Builder clauses bind their names for
 * the clauses after them and for the term; a rewritten {@link ScanExpr} binds its placeholder
 * everywhere except in its first clause source, which is evaluated outside the accumulator.
 */
final class FreeReferenceScanner implements Expr.ExprVisitor<Boolean> {
    private final String name;
    private LexicalScope scope;

    private FreeReferenceScanner(String name, LexicalScope scope) {
        this.name = name;
        this.scope = scope;
    }

    static boolean occursFree(String name, ExprInterface expr, LexicalScope scope) {
        if (expr == null) return false;
        return expr.accept(new FreeReferenceScanner(name, scope));
    }

    private boolean in(ExprInterface expr) {
        return expr != null && expr.accept(this);
    }

    private boolean anyIn(List<ExprInterface> exprs) {
        for (ExprInterface e : exprs) {
            if (in(e)) return true;
        }
        return false;
    }

    @Override
    public Boolean visitBinaryExpr(Binary expr) {
        return in(expr.left) || in(expr.right);
    }

    @Override
    public Boolean visitUnaryExpr(Unary expr) {
        return in(expr.right);
    }

    @Override
    public Boolean visitLiteralExpr(Literal expr) {
        if (expr.value instanceof List) {
            @SuppressWarnings("unchecked")
            List<ExprInterface> items = (List<ExprInterface>) expr.value;
            return anyIn(items);
        }
        return false;
    }

    @Override
    public Boolean visitSetLiteralExpr(SetLiteral expr) {
        return anyIn(expr.items);
    }

    @Override
    public Boolean visitVariableExpr(Variable expr) {
        return expr.name.lexeme.equals(name) && !scope.isBound(name);
    }

    @Override
    public Boolean visitAssignExpr(Assign expr) {
        return (expr.name.lexeme.equals(name) && !scope.isBound(name)) || in(expr.value);
    }

    @Override
    public Boolean visitLogicalExpr(Logical expr) {
        return in(expr.left) || in(expr.right);
    }

    @Override
    public Boolean visitCallExpr(Call expr) {
        if (in(expr.callee)) return true;
        for (CallArg a : expr.arguments) {
            if (in(a.expr)) return true;
        }
        return false;
    }

    @Override
    public Boolean visitIndexExpr(IndexExpr expr) {
        return in(expr.target) || in(expr.index);
    }

    @Override
    public Boolean visitSetIndexExpr(SetIndexExpr expr) {
        return in(expr.target) || in(expr.index) || in(expr.value);
    }

    @Override
    public Boolean visitBuilderExpr(Builder expr) {
        return inBuilder(expr, null);
    }

    @Override
    public Boolean visitScanExpr(ScanExpr expr) {
        return inBuilder(expr.builder, expr.placeholder);
    }

    private boolean inBuilder(Builder builder, String accumulator) {
        LexicalScope saved = scope;
        try {
            for (int i = 0; i < builder.clauses.size(); i++) {
                Clause clause = builder.clauses.get(i);
                if (in(clause.source)) return true;
                if (i == 0 && accumulator != null) scope = scope.child().bind(accumulator);
                scope = scope.child().bind(clause.name.lexeme);
                if (anyIn(clause.filters)) return true;
            }
            return in(builder.term);
        } finally {
            scope = saved;
        }
    }
}
