package com.scanprev.script.json;

import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
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
import com.scanprev.script.parser.Statement.BreakStmt;
import com.scanprev.script.parser.Statement.Decorator;
import com.scanprev.script.parser.Statement.ExprStmt;
import com.scanprev.script.parser.Statement.FunctionStmt;
import com.scanprev.script.parser.Statement.If;
import com.scanprev.script.parser.Statement.ReturnStmt;
import com.scanprev.script.parser.Statement.Stmt;
import com.scanprev.script.parser.Statement.VarStmt;
import com.scanprev.script.parser.Statement.While;
import com.scanprev.script.parser.Token;

/**
 * Renders program trees as JSON. Every node is an object with a {@code "node"} field naming its
 * kind; line numbers are left out so that equal trees render equally wherever they were parsed.
 */
public final class TreeJson implements Expr.ExprVisitor<JsonNode> {
    private static final ObjectMapper OM = new ObjectMapper();
    private static final TreeJson INSTANCE = new TreeJson();

    private TreeJson() {}

    public static ArrayNode program(List<Stmt> program) {
        ArrayNode out = OM.createArrayNode();
        for (Stmt s : program) out.add(stmt(s));
        return out;
    }

    public static JsonNode expr(ExprInterface expr) {
        return expr == null ? NullNode.getInstance() : expr.accept(INSTANCE);
    }

    public static String pretty(JsonNode node) {
        try {
            return OM.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render tree", e);
        }
    }

    public static JsonNode stmt(Stmt s) {
        if (s == null) return NullNode.getInstance();
        if (s instanceof ExprStmt) {
            ObjectNode n = node("expr");
            n.set("expression", expr(((ExprStmt) s).expression));
            return n;
        }
        if (s instanceof VarStmt) {
            VarStmt vs = (VarStmt) s;
            ObjectNode n = node("let");
            n.put("name", vs.name.lexeme);
            n.set("init", expr(vs.initializer));
            return n;
        }
        if (s instanceof Block) {
            ObjectNode n = node("block");
            n.set("body", program(((Block) s).statements));
            return n;
        }
        if (s instanceof If) {
            If is = (If) s;
            ObjectNode n = node("if");
            n.set("cond", expr(is.condition));
            n.set("then", stmt(is.thenBranch));
            n.set("else", stmt(is.elseBranch));
            return n;
        }
        if (s instanceof While) {
            While ws = (While) s;
            ObjectNode n = node("while");
            n.set("cond", expr(ws.condition));
            n.set("body", stmt(ws.body));
            return n;
        }
        if (s instanceof FunctionStmt) {
            FunctionStmt fs = (FunctionStmt) s;
            ObjectNode n = node("function");
            n.put("name", fs.name.lexeme);
            ArrayNode params = n.putArray("params");
            for (Token p : fs.params) params.add(p.lexeme);
            ArrayNode decorators = n.putArray("decorators");
            for (Decorator d : fs.decorators) decorators.add("@" + d.name.lexeme + "(" + d.argumentText() + ")");
            n.set("body", program(fs.body));
            return n;
        }
        if (s instanceof ReturnStmt) {
            ObjectNode n = node("return");
            n.set("value", expr(((ReturnStmt) s).value));
            return n;
        }
        if (s instanceof BreakStmt) {
            return node("break");
        }
        throw new IllegalArgumentException("Unknown statement: " + s.getClass().getSimpleName());
    }

    private static ObjectNode node(String kind) {
        ObjectNode n = OM.createObjectNode();
        n.put("node", kind);
        return n;
    }

    @Override
    public JsonNode visitBinaryExpr(Binary e) {
        ObjectNode n = node("binary");
        n.put("op", e.operator.lexeme);
        n.set("left", expr(e.left));
        n.set("right", expr(e.right));
        return n;
    }

    @Override
    public JsonNode visitUnaryExpr(Unary e) {
        ObjectNode n = node("unary");
        n.put("op", e.operator.lexeme);
        n.set("operand", expr(e.right));
        return n;
    }

    @Override
    public JsonNode visitLiteralExpr(Literal e) {
        if (e.value instanceof List) {
            ObjectNode n = node("array");
            ArrayNode items = n.putArray("items");
            for (Object item : (List<?>) e.value) items.add(expr((ExprInterface) item));
            return n;
        }
        ObjectNode n = node("literal");
        if (e.value == null) n.putNull("value");
        else if (e.value instanceof Double) n.put("value", (Double) e.value);
        else if (e.value instanceof Boolean) n.put("value", (Boolean) e.value);
        else n.put("value", e.value.toString());
        return n;
    }

    @Override
    public JsonNode visitSetLiteralExpr(SetLiteral e) {
        ObjectNode n = node("set");
        ArrayNode items = n.putArray("items");
        for (ExprInterface item : e.items) items.add(expr(item));
        return n;
    }

    @Override
    public JsonNode visitVariableExpr(Variable e) {
        ObjectNode n = node("var");
        n.put("name", e.name.lexeme);
        return n;
    }

    @Override
    public JsonNode visitAssignExpr(Assign e) {
        ObjectNode n = node("assign");
        n.put("name", e.name.lexeme);
        n.set("value", expr(e.value));
        return n;
    }

    @Override
    public JsonNode visitLogicalExpr(Logical e) {
        ObjectNode n = node("logical");
        n.put("op", e.operator.lexeme);
        n.set("left", expr(e.left));
        n.set("right", expr(e.right));
        return n;
    }

    @Override
    public JsonNode visitCallExpr(Call e) {
        ObjectNode n = node("call");
        n.set("callee", expr(e.callee));
        ArrayNode args = n.putArray("args");
        for (CallArg a : e.arguments) {
            JsonNode arg = expr(a.expr);
            if (a.spread) {
                ObjectNode spread = node("spread");
                spread.set("value", arg);
                arg = spread;
            }
            args.add(arg);
        }
        return n;
    }

    @Override
    public JsonNode visitIndexExpr(IndexExpr e) {
        ObjectNode n = node("index");
        n.set("target", expr(e.target));
        n.set("index", expr(e.index));
        return n;
    }

    @Override
    public JsonNode visitSetIndexExpr(SetIndexExpr e) {
        ObjectNode n = node("setIndex");
        n.set("target", expr(e.target));
        n.set("index", expr(e.index));
        n.set("value", expr(e.value));
        return n;
    }

    @Override
    public JsonNode visitBuilderExpr(Builder e) {
        ObjectNode n = node("builder");
        n.put("kind", e.kind.name());
        n.set("term", expr(e.term));
        ArrayNode clauses = n.putArray("clauses");
        for (Clause c : e.clauses) {
            ObjectNode clause = clauses.addObject();
            clause.put("name", c.name.lexeme);
            clause.set("source", expr(c.source));
            ArrayNode filters = clause.putArray("filters");
            for (ExprInterface f : c.filters) filters.add(expr(f));
        }
        return n;
    }

    @Override
    public JsonNode visitScanExpr(ScanExpr e) {
        ObjectNode n = node("scan");
        n.put("placeholder", e.placeholder);
        n.set("builder", expr(e.builder));
        return n;
    }
}
