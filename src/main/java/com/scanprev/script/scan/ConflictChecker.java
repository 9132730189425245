package com.scanprev.script.scan;

import java.util.List;

import com.scanprev.script.error.NameConflictException;
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
import com.scanprev.script.parser.Statement.Block;
import com.scanprev.script.parser.Statement.ExprStmt;
import com.scanprev.script.parser.Statement.FunctionStmt;
import com.scanprev.script.parser.Statement.If;
import com.scanprev.script.parser.Statement.ReturnStmt;
import com.scanprev.script.parser.Statement.Stmt;
import com.scanprev.script.parser.Statement.VarStmt;
import com.scanprev.script.parser.Statement.While;
import com.scanprev.script.parser.Token;

/**
 * Rejects functions that bind the placeholder themselves: as a parameter, with {@code let}, by
 * assignment, or as a clause variable of a builder that is not nested in another builder.
 */
final class ConflictChecker implements Expr.ExprVisitor<Void> {
    private final String placeholder;
    private final String unitName;
    private int builderDepth = 0;

    ConflictChecker(String placeholder, String unitName) {
        this.placeholder = placeholder;
        this.unitName = unitName;
    }

    void check(FunctionStmt fn) {
        for (Token param : fn.params) {
            if (param.lexeme.equals(placeholder)) conflict("Parameter", param);
        }
        checkAll(fn.body);
    }

    private void checkAll(List<Stmt> statements) {
        for (Stmt s : statements) check(s);
    }

    private void check(Stmt s) {
        if (s == null) return;
        if (s instanceof ExprStmt) {
            visit(((ExprStmt) s).expression);
        } else if (s instanceof VarStmt) {
            VarStmt vs = (VarStmt) s;
            if (vs.name.lexeme.equals(placeholder)) conflict("Variable declaration", vs.name);
            visit(vs.initializer);
        } else if (s instanceof Block) {
            checkAll(((Block) s).statements);
        } else if (s instanceof If) {
            If is = (If) s;
            visit(is.condition);
            check(is.thenBranch);
            check(is.elseBranch);
        } else if (s instanceof While) {
            While ws = (While) s;
            visit(ws.condition);
            check(ws.body);
        } else if (s instanceof ReturnStmt) {
            visit(((ReturnStmt) s).value);
        }
        // BreakStmt: nothing to check
    }

    private void conflict(String what, Token token) {
        throw new NameConflictException(what + " '" + token.lexeme + "' shadows the placeholder",
                placeholder, unitName, token.line);
    }

    private void visit(ExprInterface expr) {
        if (expr != null) expr.accept(this);
    }

    @Override
    public Void visitBinaryExpr(Binary expr) {
        visit(expr.left);
        visit(expr.right);
        return null;
    }

    @Override
    public Void visitUnaryExpr(Unary expr) {
        visit(expr.right);
        return null;
    }

    @Override
    public Void visitLiteralExpr(Literal expr) {
        if (expr.value instanceof List) {
            @SuppressWarnings("unchecked")
            List<ExprInterface> items = (List<ExprInterface>) expr.value;
            for (ExprInterface e : items) visit(e);
        }
        return null;
    }

    @Override
    public Void visitSetLiteralExpr(SetLiteral expr) {
        for (ExprInterface e : expr.items) visit(e);
        return null;
    }

    @Override
    public Void visitVariableExpr(Variable expr) {
        return null;
    }

    @Override
    public Void visitAssignExpr(Assign expr) {
        if (expr.name.lexeme.equals(placeholder)) conflict("Assignment to", expr.name);
        visit(expr.value);
        return null;
    }

    @Override
    public Void visitLogicalExpr(Logical expr) {
        visit(expr.left);
        visit(expr.right);
        return null;
    }

    @Override
    public Void visitCallExpr(Call expr) {
        visit(expr.callee);
        for (CallArg a : expr.arguments) visit(a.expr);
        return null;
    }

    @Override
    public Void visitIndexExpr(IndexExpr expr) {
        visit(expr.target);
        visit(expr.index);
        return null;
    }

    @Override
    public Void visitSetIndexExpr(SetIndexExpr expr) {
        visit(expr.target);
        visit(expr.index);
        visit(expr.value);
        return null;
    }

    @Override
    public Void visitBuilderExpr(Builder expr) {
        if (builderDepth == 0) {
            for (Clause clause : expr.clauses) {
                if (clause.name.lexeme.equals(placeholder)) conflict("Loop variable", clause.name);
            }
        }
        builderDepth++;
        try {
            for (Clause clause : expr.clauses) {
                visit(clause.source);
                for (ExprInterface f : clause.filters) visit(f);
            }
            visit(expr.term);
        } finally {
            builderDepth--;
        }
        return null;
    }

    @Override
    public Void visitScanExpr(ScanExpr expr) {
        return visitBuilderExpr(expr.builder);
    }
}
