package com.scanprev.script.parser;

import java.util.List;

public class Statement {

    public interface Stmt {
        void accept(StmtVisitor visitor);
    }

    public interface StmtVisitor {
        void visitExprStmt(ExprStmt stmt);
        void visitVarStmt(VarStmt stmt);
        void visitBlockStmt(Block stmt);
        void visitIfStmt(If stmt);
        void visitWhileStmt(While stmt);
        void visitFunctionStmt(FunctionStmt stmt);
        void visitReturnStmt(ReturnStmt stmt);
        void visitBreakStmt(BreakStmt stmt);
    }

    public static final class ExprStmt implements Stmt {
        public final Expr.ExprInterface expression;
        public ExprStmt(Expr.ExprInterface expression) { this.expression = expression; }
        public void accept(StmtVisitor visitor) { visitor.visitExprStmt(this); }
    }

    public static final class VarStmt implements Stmt {
        public final Token name;
        public final Expr.ExprInterface initializer;
        public VarStmt(Token name, Expr.ExprInterface initializer) { this.name = name; this.initializer = initializer; }
        public void accept(StmtVisitor visitor) { visitor.visitVarStmt(this); }
    }

    public static final class Block implements Stmt {
        public final List<Stmt> statements;
        public Block(List<Stmt> statements) { this.statements = statements; }
        public void accept(StmtVisitor visitor) { visitor.visitBlockStmt(this); }
    }

    public static final class If implements Stmt {
        public final Expr.ExprInterface condition;
        public final Stmt thenBranch;
        public final Stmt elseBranch;
        public If(Expr.ExprInterface condition, Stmt thenBranch, Stmt elseBranch) {
            this.condition = condition;
            this.thenBranch = thenBranch;
            this.elseBranch = elseBranch;
        }
        public void accept(StmtVisitor visitor) { visitor.visitIfStmt(this); }
    }

    public static final class While implements Stmt {
        public final Expr.ExprInterface condition;
        public final Stmt body;
        public While(Expr.ExprInterface condition, Stmt body) {
            this.condition = condition;
            this.body = body;
        }
        public void accept(StmtVisitor visitor) { visitor.visitWhileStmt(this); }
    }

    /** {@code @name(argument)} in front of a function declaration. */
    public static final class Decorator {
        public final Token name;
        public final Token argument;

        public Decorator(Token name, Token argument) {
            this.name = name;
            this.argument = argument;
        }

        /** The argument as written, without quotes for string arguments. */
        public String argumentText() {
            return argument.type == TokenType.STRING ? (String) argument.literal : argument.lexeme;
        }
    }

    public static final class FunctionStmt implements Stmt {
        public final Token name;
        public final List<Token> params;
        public final List<Stmt> body;
        public final List<Decorator> decorators;

        public FunctionStmt(Token name, List<Token> params, List<Stmt> body, List<Decorator> decorators) {
            this.name = name;
            this.params = params;
            this.body = body;
            this.decorators = decorators;
        }

        public void accept(StmtVisitor visitor) { visitor.visitFunctionStmt(this); }
    }

    public static final class ReturnStmt implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface value; // may be null

        public ReturnStmt(Token keyword, Expr.ExprInterface value) {
            this.keyword = keyword;
            this.value = value;
        }

        public void accept(StmtVisitor visitor) { visitor.visitReturnStmt(this); }
    }

    public static final class BreakStmt implements Stmt {
        public final Token keyword;
        public BreakStmt(Token keyword) { this.keyword = keyword; }
        public void accept(StmtVisitor visitor) { visitor.visitBreakStmt(this); }
    }
}
