package com.scanprev.script.parser;

import java.util.List;

public class Expr {

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);
    }

    public interface ExprVisitor<R> {
        R visitBinaryExpr(Binary expr);
        R visitUnaryExpr(Unary expr);
        R visitLiteralExpr(Literal expr);
        R visitSetLiteralExpr(SetLiteral expr);
        R visitVariableExpr(Variable expr);
        R visitAssignExpr(Assign expr);
        R visitLogicalExpr(Logical expr);
        R visitCallExpr(Call expr);
        R visitIndexExpr(IndexExpr expr);
        R visitSetIndexExpr(SetIndexExpr expr);
        R visitBuilderExpr(Builder expr);
        R visitScanExpr(ScanExpr expr);
    }

    // -------------------------
    // Core expression nodes
    // -------------------------

    public static final class Binary implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Binary(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinaryExpr(this);
        }
    }

    public static final class Unary implements ExprInterface {
        public final Token operator;
        public final ExprInterface right;

        public Unary(Token operator, ExprInterface right) {
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnaryExpr(this);
        }
    }

    /** Scalar literal, or an array literal when {@code value} is a {@code List<ExprInterface>}. */
    public static final class Literal implements ExprInterface {
        public final Object value;

        public Literal(Object value) {
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLiteralExpr(this);
        }
    }

    public static final class SetLiteral implements ExprInterface {
        public final List<ExprInterface> items;
        public final Token brace;

        public SetLiteral(List<ExprInterface> items, Token brace) {
            this.items = items;
            this.brace = brace;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitSetLiteralExpr(this);
        }
    }

    public static final class Variable implements ExprInterface {
        public final Token name;

        public Variable(Token name) {
            this.name = name;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitVariableExpr(this);
        }
    }

    public static final class Assign implements ExprInterface {
        public final Token name;
        public final ExprInterface value;

        public Assign(Token name, ExprInterface value) {
            this.name = name;
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitAssignExpr(this);
        }
    }

    public static final class Logical implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Logical(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLogicalExpr(this);
        }
    }

    // -------------------------
    // Calls
    // -------------------------

    public static final class Call implements ExprInterface {
        public final ExprInterface callee;
        public final Token paren;
        public final List<CallArg> arguments;

        public Call(ExprInterface callee, Token paren, List<CallArg> arguments) {
            this.callee = callee;
            this.paren = paren;
            this.arguments = arguments;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCallExpr(this);
        }
    }

    /**
     * Function-call argument wrapper to support spread:
     *   fn(1, **arr, 4)
     */
    public static final class CallArg {
        public final boolean spread;
        public final ExprInterface expr;
        public final Token spreadToken; // may be null

        public CallArg(boolean spread, ExprInterface expr, Token spreadToken) {
            this.spread = spread;
            this.expr = expr;
            this.spreadToken = spreadToken;
        }
    }

    // -------------------------
    // Indexing
    // -------------------------

    public static final class IndexExpr implements ExprInterface {
        public final ExprInterface target;
        public final ExprInterface index;
        public final Token bracket;

        public IndexExpr(ExprInterface target, ExprInterface index, Token bracket) {
            this.target = target;
            this.index = index;
            this.bracket = bracket;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIndexExpr(this);
        }
    }

    public static final class SetIndexExpr implements ExprInterface {
        public final ExprInterface target;
        public final ExprInterface index;
        public final ExprInterface value;
        public final Token bracket;

        public SetIndexExpr(ExprInterface target, ExprInterface index, ExprInterface value, Token bracket) {
            this.target = target;
            this.index = index;
            this.value = value;
            this.bracket = bracket;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitSetIndexExpr(this);
        }
    }

    // -------------------------
    // Builders (comprehensions)
    // -------------------------

    /** What a builder produces: {@code [..]} an array, {@code {..}} a set, {@code (..)} a lazy sequence. */
    public enum ContainerKind {
        LIST,
        SET,
        LAZY
    }

    /** One {@code for name in source if f1 if f2} clause of a builder. */
    public static final class Clause {
        public final Token name;
        public final ExprInterface source;
        public final List<ExprInterface> filters;

        public Clause(Token name, ExprInterface source, List<ExprInterface> filters) {
            this.name = name;
            this.source = source;
            this.filters = filters;
        }
    }

    /**
     * {@code [term for a in s1 if c for b in s2]} and its set and lazy forms.
     *
     * <p>Clause {@code i}'s source sees the names bound by clauses {@code 0..i-1}; its filters and the
     * clauses after it also see its own name; the term sees all of them. Equivalent to:
     *
     * <pre>
     *   for a in s1:
     *     if c:
     *       for b in s2:
     *         emit(term)
     * </pre>
     */
    public static final class Builder implements ExprInterface {
        public final ContainerKind kind;
        public final ExprInterface term;
        public final List<Clause> clauses;
        public final Token bracket;

        public Builder(ContainerKind kind, ExprInterface term, List<Clause> clauses, Token bracket) {
            this.kind = kind;
            this.term = term;
            this.clauses = clauses;
            this.bracket = bracket;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBuilderExpr(this);
        }
    }

    /**
     * A builder rewritten into a running scan: {@code placeholder} holds the previously produced
     * output while the term is evaluated. Only produced by the scan rewriter, never by the parser.
     */
    public static final class ScanExpr implements ExprInterface {
        public final Builder builder;
        public final String placeholder;

        public ScanExpr(Builder builder, String placeholder) {
            this.builder = builder;
            this.placeholder = placeholder;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitScanExpr(this);
        }
    }
}
