package com.scanprev.script.scan;

import java.util.ArrayList;
import java.util.List;

import com.scanprev.debug.Debug;
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
import com.scanprev.script.parser.Statement.If;
import com.scanprev.script.parser.Statement.ReturnStmt;
import com.scanprev.script.parser.Statement.Stmt;
import com.scanprev.script.parser.Statement.VarStmt;
import com.scanprev.script.parser.Statement.While;

/**
 * Bottom-up rewrite of every builder whose term reads the placeholder into a {@link ScanExpr}.
 *
 * <p>A node is rebuilt only when one of its children changed; otherwise the very same instance is
 * returned, so code that does not mention the placeholder is left untouched.
 */
final class ScanRewriter implements Expr.ExprVisitor<ExprInterface> {
    private static final String TAG = "ScanRewriter";

    private final String placeholder;
    private final String unitName;
    private final ScanMatcher matcher;
    private LexicalScope scope = LexicalScope.root();
    private int rewrites = 0;

    ScanRewriter(String placeholder, String unitName) {
        this.placeholder = placeholder;
        this.unitName = unitName;
        this.matcher = new ScanMatcher(placeholder, unitName);
    }

    int rewrites() {
        return rewrites;
    }

    // -------------------------
    // Statements
    // -------------------------

    List<Stmt> rewriteAll(List<Stmt> statements) {
        List<Stmt> out = null;
        for (int i = 0; i < statements.size(); i++) {
            Stmt before = statements.get(i);
            Stmt after = rewrite(before);
            if (after != before && out == null) out = new ArrayList<>(statements.subList(0, i));
            if (out != null) out.add(after);
        }
        return out == null ? statements : out;
    }

    private Stmt rewrite(Stmt s) {
        if (s == null) return null;
        if (s instanceof ExprStmt) {
            ExprStmt es = (ExprStmt) s;
            ExprInterface e = map(es.expression);
            return e == es.expression ? s : new ExprStmt(e);
        }
        if (s instanceof VarStmt) {
            VarStmt vs = (VarStmt) s;
            ExprInterface init = map(vs.initializer);
            return init == vs.initializer ? s : new VarStmt(vs.name, init);
        }
        if (s instanceof Block) {
            Block b = (Block) s;
            List<Stmt> body = rewriteAll(b.statements);
            return body == b.statements ? s : new Block(body);
        }
        if (s instanceof If) {
            If is = (If) s;
            ExprInterface cond = map(is.condition);
            Stmt then = rewrite(is.thenBranch);
            Stmt otherwise = rewrite(is.elseBranch);
            if (cond == is.condition && then == is.thenBranch && otherwise == is.elseBranch) return s;
            return new If(cond, then, otherwise);
        }
        if (s instanceof While) {
            While ws = (While) s;
            ExprInterface cond = map(ws.condition);
            Stmt body = rewrite(ws.body);
            if (cond == ws.condition && body == ws.body) return s;
            return new While(cond, body);
        }
        if (s instanceof ReturnStmt) {
            ReturnStmt rs = (ReturnStmt) s;
            ExprInterface value = map(rs.value);
            return value == rs.value ? s : new ReturnStmt(rs.keyword, value);
        }
        return s;
    }

    // -------------------------
    // Expressions
    // -------------------------

    ExprInterface map(ExprInterface expr) {
        return expr == null ? null : expr.accept(this);
    }

    private List<ExprInterface> mapAll(List<ExprInterface> exprs) {
        List<ExprInterface> out = null;
        for (int i = 0; i < exprs.size(); i++) {
            ExprInterface before = exprs.get(i);
            ExprInterface after = map(before);
            if (after != before && out == null) out = new ArrayList<>(exprs.subList(0, i));
            if (out != null) out.add(after);
        }
        return out == null ? exprs : out;
    }

    @Override
    public ExprInterface visitBinaryExpr(Binary expr) {
        ExprInterface left = map(expr.left);
        ExprInterface right = map(expr.right);
        if (left == expr.left && right == expr.right) return expr;
        return new Binary(left, expr.operator, right);
    }

    @Override
    public ExprInterface visitUnaryExpr(Unary expr) {
        ExprInterface right = map(expr.right);
        return right == expr.right ? expr : new Unary(expr.operator, right);
    }

    @Override
    public ExprInterface visitLiteralExpr(Literal expr) {
        if (!(expr.value instanceof List)) return expr;
        @SuppressWarnings("unchecked")
        List<ExprInterface> items = (List<ExprInterface>) expr.value;
        List<ExprInterface> mapped = mapAll(items);
        return mapped == items ? expr : new Literal(mapped);
    }

    @Override
    public ExprInterface visitSetLiteralExpr(SetLiteral expr) {
        List<ExprInterface> items = mapAll(expr.items);
        return items == expr.items ? expr : new SetLiteral(items, expr.brace);
    }

    @Override
    public ExprInterface visitVariableExpr(Variable expr) {
        return expr;
    }

    @Override
    public ExprInterface visitAssignExpr(Assign expr) {
        ExprInterface value = map(expr.value);
        return value == expr.value ? expr : new Assign(expr.name, value);
    }

    @Override
    public ExprInterface visitLogicalExpr(Logical expr) {
        ExprInterface left = map(expr.left);
        ExprInterface right = map(expr.right);
        if (left == expr.left && right == expr.right) return expr;
        return new Logical(left, expr.operator, right);
    }

    @Override
    public ExprInterface visitCallExpr(Call expr) {
        ExprInterface callee = map(expr.callee);
        List<CallArg> args = null;
        for (int i = 0; i < expr.arguments.size(); i++) {
            CallArg a = expr.arguments.get(i);
            ExprInterface e = map(a.expr);
            if (e != a.expr && args == null) args = new ArrayList<>(expr.arguments.subList(0, i));
            if (args != null) args.add(e == a.expr ? a : new CallArg(a.spread, e, a.spreadToken));
        }
        if (callee == expr.callee && args == null) return expr;
        return new Call(callee, expr.paren, args == null ? expr.arguments : args);
    }

    @Override
    public ExprInterface visitIndexExpr(IndexExpr expr) {
        ExprInterface target = map(expr.target);
        ExprInterface index = map(expr.index);
        if (target == expr.target && index == expr.index) return expr;
        return new IndexExpr(target, index, expr.bracket);
    }

    @Override
    public ExprInterface visitSetIndexExpr(SetIndexExpr expr) {
        ExprInterface target = map(expr.target);
        ExprInterface index = map(expr.index);
        ExprInterface value = map(expr.value);
        if (target == expr.target && index == expr.index && value == expr.value) return expr;
        return new SetIndexExpr(target, index, value, expr.bracket);
    }

    @Override
    public ExprInterface visitBuilderExpr(Builder expr) {
        LexicalScope enclosing = scope;
        Builder builder;
        try {
            builder = rewriteParts(expr);
        } finally {
            scope = enclosing;
        }

        ScanMatch match = matcher.match(builder, enclosing);
        if (!match.isScan()) return builder;

        rewrites++;
        Debug.get().d(TAG, unitName + ": builder at line " + builder.bracket.line + " becomes "
                + builder.kind + " " + match + " over '" + placeholder + "'");
        return new ScanExpr(builder, placeholder);
    }

    @Override
    public ExprInterface visitScanExpr(ScanExpr expr) {
        // Already rewritten; only its parts may still hold builders.
        LexicalScope enclosing = scope;
        try {
            Builder builder = rewriteParts(expr.builder);
            return builder == expr.builder ? expr : new ScanExpr(builder, expr.placeholder);
        } finally {
            scope = enclosing;
        }
    }

    /** Rewrites sources, filters and term, each under the clause names visible to it. */
    private Builder rewriteParts(Builder expr) {
        boolean changed = false;
        List<Clause> clauses = new ArrayList<>(expr.clauses.size());
        for (Clause clause : expr.clauses) {
            ExprInterface source = map(clause.source);
            scope = scope.child().bind(clause.name.lexeme);
            List<ExprInterface> filters = mapAll(clause.filters);
            if (source == clause.source && filters == clause.filters) {
                clauses.add(clause);
            } else {
                clauses.add(new Clause(clause.name, source, filters));
                changed = true;
            }
        }
        ExprInterface term = map(expr.term);
        if (!changed && term == expr.term) return expr;
        return new Builder(expr.kind, term, clauses, expr.bracket);
    }
}
