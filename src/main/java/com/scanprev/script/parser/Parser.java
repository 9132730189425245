package com.scanprev.script.parser;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.scanprev.script.parser.Expr.Assign;
import com.scanprev.script.parser.Expr.Binary;
import com.scanprev.script.parser.Expr.Builder;
import com.scanprev.script.parser.Expr.CallArg;
import com.scanprev.script.parser.Expr.Clause;
import com.scanprev.script.parser.Expr.ContainerKind;
import com.scanprev.script.parser.Expr.IndexExpr;
import com.scanprev.script.parser.Expr.Literal;
import com.scanprev.script.parser.Expr.Logical;
import com.scanprev.script.parser.Expr.SetIndexExpr;
import com.scanprev.script.parser.Expr.SetLiteral;
import com.scanprev.script.parser.Expr.Unary;
import com.scanprev.script.parser.Expr.Variable;
import com.scanprev.script.parser.Statement.Block;
import com.scanprev.script.parser.Statement.Decorator;
import com.scanprev.script.parser.Statement.ExprStmt;
import com.scanprev.script.parser.Statement.FunctionStmt;
import com.scanprev.script.parser.Statement.Stmt;
import com.scanprev.script.parser.Statement.While;

public class Parser {
    private final List<Token> tokens;
    private int current = 0;
    private int loopDepth = 0;

    public Parser(List<Token> tokens) { this.tokens = tokens; }

    public List<Stmt> parse() {
        List<Stmt> statements = new ArrayList<Stmt>();
        while (!isAtEnd()) {
            statements.add(declaration());
        }
        return statements;
    }

    /** Top level: functions are only declared here. */
    private Stmt declaration() {
        if (check(TokenType.AT) || check(TokenType.FUNCTION)) {
            List<Decorator> decorators = decorators();
            consume(TokenType.FUNCTION, "Expect 'function' after decorator.");
            return functionDeclaration(decorators);
        }
        return blockDeclaration();
    }

    private Stmt blockDeclaration() {
        if (check(TokenType.AT) || check(TokenType.FUNCTION)) {
            throw error(peek(), "Functions may only be declared at top level.");
        }
        if (match(TokenType.LET)) return varDeclaration();
        return statement();
    }

    // @scan(prev) @scan("prev")
    private List<Decorator> decorators() {
        List<Decorator> decorators = new ArrayList<>();
        while (match(TokenType.AT)) {
            Token name = consume(TokenType.IDENTIFIER, "Expect decorator name after '@'.");
            consume(TokenType.LEFT_PAREN, "Expect '(' after decorator name.");
            Token argument;
            if (match(TokenType.IDENTIFIER, TokenType.STRING)) {
                argument = previous();
            } else {
                throw error(peek(), "Expect identifier or string as decorator argument.");
            }
            consume(TokenType.RIGHT_PAREN, "Expect ')' after decorator argument.");
            decorators.add(new Decorator(name, argument));
        }
        return decorators;
    }

    private Stmt functionDeclaration(List<Decorator> decorators) {
        Token name = consume(TokenType.IDENTIFIER, "Expect function name.");
        consume(TokenType.LEFT_PAREN, "Expect '(' after function name.");

        List<Token> params = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                if (params.size() >= 64) {
                    throw error(peek(), "Too many parameters (max 64).");
                }
                params.add(consume(TokenType.IDENTIFIER, "Expect parameter name."));
            } while (match(TokenType.COMMA));
        }

        consume(TokenType.RIGHT_PAREN, "Expect ')' after parameters.");
        consume(TokenType.LEFT_BRACE, "Expect '{' before function body.");

        List<Stmt> body = block();
        return new FunctionStmt(name, params, body, decorators);
    }

    private Stmt varDeclaration() {
        Token name = consume(TokenType.IDENTIFIER, "Expect variable name.");
        consume(TokenType.EQUAL, "Expect '=' after variable name.");
        Expr.ExprInterface initializer = expression();
        consume(TokenType.SEMICOLON, "Expect ';' after variable declaration.");
        return new Statement.VarStmt(name, initializer);
    }

    private Stmt statement() {
        if (match(TokenType.IF)) return ifStatement();
        if (match(TokenType.WHILE)) return whileStatement();
        if (match(TokenType.FOR)) return forStatement();
        if (match(TokenType.RETURN)) return returnStatement();
        if (match(TokenType.BREAK)) return breakStatement();
        if (match(TokenType.LEFT_BRACE)) return new Block(block());
        return exprStatement();
    }

    private Statement.Stmt breakStatement() {
        Token keyword = previous();
        if (loopDepth <= 0) {
            throw error(keyword, "'break' used outside of a loop.");
        }
        consume(TokenType.SEMICOLON, "Expect ';' after 'break'.");
        return new Statement.BreakStmt(keyword);
    }

    private Statement.Stmt returnStatement() {
        Token keyword = previous();
        Expr.ExprInterface value = null;
        if (!check(TokenType.SEMICOLON)) {
            value = expression();
        }
        consume(TokenType.SEMICOLON, "Expect ';' after return value.");
        return new Statement.ReturnStmt(keyword, value);
    }

    private Statement.Stmt ifStatement() {
        consume(TokenType.LEFT_PAREN, "Expect '(' after 'if'.");
        Expr.ExprInterface condition = expression();
        consume(TokenType.RIGHT_PAREN, "Expect ')' after if condition.");
        Stmt thenBranch = statement();
        Stmt elseBranch = null;
        if (match(TokenType.ELSE)) elseBranch = statement();
        return new Statement.If(condition, thenBranch, elseBranch);
    }

    private Statement.Stmt whileStatement() {
        consume(TokenType.LEFT_PAREN, "Expect '(' after 'while'.");
        Expr.ExprInterface condition = expression();
        consume(TokenType.RIGHT_PAREN, "Expect ')' after condition.");

        loopDepth++;
        try {
            Stmt body = statement();
            return new While(condition, body);
        } finally {
            loopDepth--;
        }
    }

    // for (init; cond; inc) body
    // => { init; while (cond) { body; inc; } }
    private Statement.Stmt forStatement() {
        consume(TokenType.LEFT_PAREN, "Expect '(' after 'for'.");

        Stmt initializer;
        if (match(TokenType.SEMICOLON)) {
            initializer = null;
        } else if (match(TokenType.LET)) {
            initializer = varDeclaration(); // consumes first ';'
        } else {
            initializer = exprStatement();  // consumes first ';'
        }

        Expr.ExprInterface condition = null;
        if (!check(TokenType.SEMICOLON)) {
            condition = expression();
        }
        consume(TokenType.SEMICOLON, "Expect ';' after loop condition.");

        Expr.ExprInterface increment = null;
        if (!check(TokenType.RIGHT_PAREN)) {
            increment = expression();
        }
        consume(TokenType.RIGHT_PAREN, "Expect ')' after for clauses.");

        loopDepth++;
        Stmt body;
        try {
            body = statement();
        } finally {
            loopDepth--;
        }

        if (increment != null) {
            List<Stmt> list = new ArrayList<>();
            list.add(body);
            list.add(new ExprStmt(increment));
            body = new Block(list);
        }

        if (condition == null) condition = new Literal(Boolean.TRUE);
        body = new While(condition, body);

        if (initializer != null) {
            List<Stmt> list = new ArrayList<>();
            list.add(initializer);
            list.add(body);
            body = new Block(list);
        }

        return body;
    }

    private List<Stmt> block() {
        List<Stmt> statements = new ArrayList<Stmt>();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            statements.add(blockDeclaration());
        }
        consume(TokenType.RIGHT_BRACE, "Expect '}' after block.");
        return statements;
    }

    private Statement.Stmt exprStatement() {
        Expr.ExprInterface expr = expression();
        consume(TokenType.SEMICOLON, "Expect ';' after expression.");
        return new ExprStmt(expr);
    }

    private Expr.ExprInterface expression() { return assignment(); }

    private Expr.ExprInterface assignment() {
        Expr.ExprInterface expr = or();
        if (match(TokenType.EQUAL)) {
            Token equals = previous();
            Expr.ExprInterface value = assignment();
            if (expr instanceof Variable) {
                Token name = ((Variable) expr).name;
                return new Assign(name, value);
            }
            if (expr instanceof IndexExpr) {
                IndexExpr ix = (IndexExpr) expr;
                return new SetIndexExpr(ix.target, ix.index, value, ix.bracket);
            }
            throw error(equals, "Invalid assignment target.");
        }
        return expr;
    }

    private Expr.ExprInterface or() {
        Expr.ExprInterface expr = and();
        while (match(TokenType.OR_OR)) {
            Token op = previous();
            Expr.ExprInterface right = and();
            expr = new Logical(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface and() {
        Expr.ExprInterface expr = equality();
        while (match(TokenType.AND_AND)) {
            Token op = previous();
            Expr.ExprInterface right = equality();
            expr = new Logical(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface equality() {
        Expr.ExprInterface expr = comparison();
        while (match(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL)) {
            Token op = previous();
            Expr.ExprInterface right = comparison();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface comparison() {
        Expr.ExprInterface expr = term();
        while (match(TokenType.GREATER, TokenType.GREATER_EQUAL, TokenType.LESS, TokenType.LESS_EQUAL)) {
            Token op = previous();
            Expr.ExprInterface right = term();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface term() {
        Expr.ExprInterface expr = factor();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token op = previous();
            Expr.ExprInterface right = factor();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface factor() {
        Expr.ExprInterface expr = unary();
        while (match(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT)) {
            Token op = previous();
            Expr.ExprInterface right = unary();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface unary() {
        if (match(TokenType.BANG, TokenType.MINUS)) {
            Token op = previous();
            Expr.ExprInterface right = unary();
            return new Unary(op, right);
        }
        return power();
    }

    // Right-associative and tighter than unary minus: -2 ** 2 == -(2 ** 2)
    private Expr.ExprInterface power() {
        Expr.ExprInterface expr = call();
        if (match(TokenType.DOUBLE_STAR)) {
            Token op = previous();
            Expr.ExprInterface right = unary();
            return new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface call() {
        Expr.ExprInterface expr = primary();

        while (true) {
            if (match(TokenType.LEFT_PAREN)) {
                expr = finishCall(expr);
            } else if (match(TokenType.LEFT_BRACKET)) {
                Token bracket = previous();
                Expr.ExprInterface index = expression();
                consume(TokenType.RIGHT_BRACKET, "Expect ']' after index.");
                expr = new IndexExpr(expr, index, bracket);
            } else {
                break;
            }
        }

        return expr;
    }

    private Expr.ExprInterface finishCall(Expr.ExprInterface callee) {
        List<CallArg> arguments = new ArrayList<>();

        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                arguments.add(parseCallArg());
            } while (match(TokenType.COMMA));
        }

        Token paren = consume(TokenType.RIGHT_PAREN, "Expect ')' after arguments.");
        return new Expr.Call(callee, paren, arguments);
    }

    private CallArg parseCallArg() {
        boolean spread = false;
        Token spreadTok = null;
        if (match(TokenType.DOUBLE_STAR)) {
            spread = true;
            spreadTok = previous();
        }
        Expr.ExprInterface argExpr = expression();
        return new CallArg(spread, argExpr, spreadTok);
    }

    private Expr.ExprInterface primary() {
        if (match(TokenType.FALSE)) return new Literal(Boolean.FALSE);
        if (match(TokenType.TRUE)) return new Literal(Boolean.TRUE);
        if (match(TokenType.NULL)) return new Literal(null);
        if (match(TokenType.NUMBER)) return new Literal(previous().literal);
        if (match(TokenType.STRING)) return new Literal(previous().literal);
        if (match(TokenType.IDENTIFIER)) return new Variable(previous());

        // (expr) or the lazy builder (term for x in s)
        if (match(TokenType.LEFT_PAREN)) {
            Token paren = previous();
            Expr.ExprInterface expr = expression();
            if (match(TokenType.FOR)) {
                expr = new Builder(ContainerKind.LAZY, expr, clauses(), paren);
            }
            consume(TokenType.RIGHT_PAREN, "Expect ')' after expression.");
            return expr;
        }

        // [a, b] or [term for x in s]
        if (match(TokenType.LEFT_BRACKET)) {
            Token bracket = previous();
            List<Expr.ExprInterface> items = new ArrayList<Expr.ExprInterface>();
            if (!check(TokenType.RIGHT_BRACKET)) {
                Expr.ExprInterface first = expression();
                if (match(TokenType.FOR)) {
                    Builder builder = new Builder(ContainerKind.LIST, first, clauses(), bracket);
                    consume(TokenType.RIGHT_BRACKET, "Expect ']' after builder.");
                    return builder;
                }
                items.add(first);
                while (match(TokenType.COMMA)) {
                    items.add(expression());
                }
            }
            consume(TokenType.RIGHT_BRACKET, "Expect ']' after array literal.");
            return new Literal(items);
        }

        // {a, b}, {} or {term for x in s}
        if (match(TokenType.LEFT_BRACE)) {
            Token brace = previous();
            List<Expr.ExprInterface> items = new ArrayList<Expr.ExprInterface>();
            if (!check(TokenType.RIGHT_BRACE)) {
                Expr.ExprInterface first = expression();
                if (match(TokenType.FOR)) {
                    Builder builder = new Builder(ContainerKind.SET, first, clauses(), brace);
                    consume(TokenType.RIGHT_BRACE, "Expect '}' after builder.");
                    return builder;
                }
                items.add(first);
                while (match(TokenType.COMMA)) {
                    items.add(expression());
                }
            }
            consume(TokenType.RIGHT_BRACE, "Expect '}' after set literal.");
            return new SetLiteral(items, brace);
        }

        throw error(peek(), "Expect expression.");
    }

    // Called with the first 'for' already consumed.
    private List<Clause> clauses() {
        List<Clause> clauses = new ArrayList<>();
        Set<String> bound = new HashSet<>();
        do {
            Token name = consume(TokenType.IDENTIFIER, "Expect loop variable after 'for'.");
            if (!bound.add(name.lexeme)) {
                throw error(name, "Loop variable '" + name.lexeme + "' is already bound in this builder.");
            }
            consume(TokenType.IN, "Expect 'in' after loop variable.");
            Expr.ExprInterface source = or();
            List<Expr.ExprInterface> filters = new ArrayList<>();
            while (match(TokenType.IF)) {
                filters.add(or());
            }
            clauses.add(new Clause(name, source, filters));
        } while (match(TokenType.FOR));
        return clauses;
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }
    private Token previous() { return tokens.get(current - 1); }

    private RuntimeException error(Token token, String message) {
        return new RuntimeException("[line " + token.line + "] " + message);
    }
}
