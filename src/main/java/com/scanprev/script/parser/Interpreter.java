package com.scanprev.script.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;

import com.scanprev.debug.Debug;
import com.scanprev.script.ScanScript.BuiltinFunction;
import com.scanprev.script.parser.Expr.Assign;
import com.scanprev.script.parser.Expr.Binary;
import com.scanprev.script.parser.Expr.Builder;
import com.scanprev.script.parser.Expr.Call;
import com.scanprev.script.parser.Expr.CallArg;
import com.scanprev.script.parser.Expr.ExprVisitor;
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
import com.scanprev.script.parser.Statement.ExprStmt;
import com.scanprev.script.parser.Statement.FunctionStmt;
import com.scanprev.script.parser.Statement.If;
import com.scanprev.script.parser.Statement.ReturnStmt;
import com.scanprev.script.parser.Statement.Stmt;
import com.scanprev.script.parser.Statement.StmtVisitor;
import com.scanprev.script.parser.Statement.VarStmt;
import com.scanprev.script.parser.Statement.While;
import com.scanprev.script.scan.ScanEnabler;
import com.scanprev.script.seq.Sequences;

public class Interpreter implements ExprVisitor<Value>, StmtVisitor {
    private static final String TAG = "Interpreter";

    Environment env;
    private final Map<String, BuiltinFunction> functions;
    private final Map<String, UserFunction> userFunctions = new LinkedHashMap<>();
    private final Deque<CallFrame> callStack = new ArrayDeque<CallFrame>();
    private final int maxDepth;

    static final class ReturnSignal extends RuntimeException {
        private static final long serialVersionUID = 1L;
        final Value value;

        ReturnSignal(Value value) {
            super(null, null, false, false);
            this.value = value;
        }
    }

    static final class BreakSignal extends RuntimeException {
        private static final long serialVersionUID = 1L;

        BreakSignal() {
            super(null, null, false, false);
        }
    }

    public Interpreter(Environment env, Map<String, BuiltinFunction> functions, int maxDepth) {
        this.env = env;
        this.functions = functions;
        this.maxDepth = maxDepth;
    }

    public String currentFunctionName() {
        return callStack.isEmpty() ? null : callStack.peek().functionName;
    }

    void reportSystemError(String kind, String name, Token token, String message) {
        String fn = currentFunctionName();
        Debug.get().w(TAG, kind + " : " + name
                + (token == null ? "" : " (line " + token.line + ")")
                + (fn == null ? "" : " in " + fn)
                + " : " + message);
    }

    public Value invokeForHost(String targetName, List<Value> args) {
        return invokeByName(targetName, args);
    }

    /** Calls a FUNC value (user function or builtin) with already evaluated arguments. */
    public Value invoke(Value fn, List<Value> args) {
        if (fn.getType() != Value.Type.FUNC) {
            throw new RuntimeException("Expected a function, got " + fn.getType());
        }
        return invokeByName(fn.asFunc(), args);
    }

    public void execute(List<Stmt> program) {
        for (Stmt stmt : program) stmt.accept(this);
    }

    /** Evaluates {@code expr} with {@code scope} as the current environment. */
    Value evalIn(Expr.ExprInterface expr, Environment scope) {
        Environment previous = env;
        env = scope;
        try {
            return eval(expr);
        } finally {
            env = previous;
        }
    }

    private Value eval(Expr.ExprInterface expr) {
        return expr.accept(this);
    }

    public void visitExprStmt(ExprStmt stmt) { eval(stmt.expression); }

    public void visitVarStmt(VarStmt stmt) {
        Value value = eval(stmt.initializer);
        env.define(stmt.name.lexeme, value);
    }

    public void visitBlockStmt(Block stmt) {
        env.pushBlock();
        try {
            for (Stmt s : stmt.statements) s.accept(this);
        } finally {
            env.popBlock();
        }
    }

    public void visitIfStmt(If stmt) {
        Value cond = eval(stmt.condition);
        if (isTruthy(cond)) stmt.thenBranch.accept(this);
        else if (stmt.elseBranch != null) stmt.elseBranch.accept(this);
    }

    public void visitWhileStmt(While stmt) {
        while (isTruthy(eval(stmt.condition))) {
            try {
                stmt.body.accept(this);
            } catch (BreakSignal bs) {
                break;
            }
        }
    }

    public void visitFunctionStmt(FunctionStmt stmt) {
        String name = stmt.name.lexeme;
        if (functions.containsKey(name)) {
            throw new RuntimeException("Function name conflicts with builtin: " + name);
        }
        if (userFunctions.containsKey(name)) {
            throw new RuntimeException("Function already defined: " + name);
        }
        // Decorators are applied every time the definition runs; nothing is cached.
        FunctionStmt enabled = ScanEnabler.applyDecorators(stmt);
        userFunctions.put(name, new UserFunction(name, enabled.params, enabled.body, env));
    }

    public void visitReturnStmt(ReturnStmt stmt) {
        throw new ReturnSignal(stmt.value == null ? Value.nil() : eval(stmt.value));
    }

    public void visitBreakStmt(BreakStmt stmt) {
        throw new BreakSignal();
    }

    public Value visitBinaryExpr(Binary expr) {
        Value left = eval(expr.left);
        Value right = eval(expr.right);
        TokenType op = expr.operator.type;

        switch (op) {
            case PLUS: {
                if (left.getType() == Value.Type.NUMBER && right.getType() == Value.Type.NUMBER) {
                    return Value.number(left.asNumber() + right.asNumber());
                }

                if (left.getType() == Value.Type.ARRAY && right.getType() == Value.Type.ARRAY) {
                    List<Value> joined = new ArrayList<>(left.asArray());
                    joined.addAll(right.asArray());
                    return Value.array(joined);
                }

                // FUNC is NOT concat-able (even with a STRING)
                if (left.getType() == Value.Type.FUNC || right.getType() == Value.Type.FUNC) {
                    throw new RuntimeException("Unsupported operand types for '+': " + left.getType() + ", " + right.getType());
                }

                if (left.getType() == Value.Type.STRING || right.getType() == Value.Type.STRING) {
                    return Value.string(stringify(left) + stringify(right));
                }

                throw new RuntimeException("Unsupported operand types for '+': " + left.getType() + ", " + right.getType());
            }
            case MINUS:
                requireNumber(left, right, expr.operator);
                return Value.number(left.asNumber() - right.asNumber());
            case STAR:
                requireNumber(left, right, expr.operator);
                return Value.number(left.asNumber() * right.asNumber());
            case SLASH:
                requireNumber(left, right, expr.operator);
                return Value.number(left.asNumber() / right.asNumber());
            case PERCENT:
                requireNumber(left, right, expr.operator);
                return Value.number(left.asNumber() % right.asNumber());
            case DOUBLE_STAR:
                requireNumber(left, right, expr.operator);
                return Value.number(Math.pow(left.asNumber(), right.asNumber()));

            case GREATER:
                requireNumber(left, right, expr.operator);
                return Value.bool(left.asNumber() > right.asNumber());
            case GREATER_EQUAL:
                requireNumber(left, right, expr.operator);
                return Value.bool(left.asNumber() >= right.asNumber());
            case LESS:
                requireNumber(left, right, expr.operator);
                return Value.bool(left.asNumber() < right.asNumber());
            case LESS_EQUAL:
                requireNumber(left, right, expr.operator);
                return Value.bool(left.asNumber() <= right.asNumber());

            case EQUAL_EQUAL:
                return Value.bool(left.equals(right));
            case BANG_EQUAL:
                return Value.bool(!left.equals(right));

            default:
                throw new RuntimeException("Unsupported binary operator: " + op);
        }
    }

    public Value visitUnaryExpr(Unary expr) {
        Value right = eval(expr.right);
        switch (expr.operator.type) {
            case BANG:
                return Value.bool(!isTruthy(right));
            case MINUS:
                if (right.getType() != Value.Type.NUMBER) throw new RuntimeException("Unary '-' expects number");
                return Value.number(-right.asNumber());
            default:
                throw new RuntimeException("Unsupported unary operator: " + expr.operator.type);
        }
    }

    public Value visitLiteralExpr(Literal expr) {
        if (expr.value == null) return Value.nil();
        if (expr.value instanceof Boolean) return Value.bool((Boolean) expr.value);
        if (expr.value instanceof Double) return Value.number((Double) expr.value);
        if (expr.value instanceof String) return Value.string((String) expr.value);
        if (expr.value instanceof List) {
            @SuppressWarnings("unchecked")
            List<Expr.ExprInterface> exprs = (List<Expr.ExprInterface>) expr.value;
            List<Value> values = new ArrayList<Value>(exprs.size());
            for (Expr.ExprInterface e : exprs) values.add(eval(e));
            return Value.array(values);
        }
        throw new RuntimeException("Unsupported literal value: " + expr.value);
    }

    public Value visitSetLiteralExpr(SetLiteral expr) {
        Set<Value> values = new LinkedHashSet<>();
        for (Expr.ExprInterface e : expr.items) values.add(eval(e));
        return Value.set(values);
    }

    public Value visitVariableExpr(Variable expr) {
        String name = expr.name.lexeme;

        // Variables shadow functions
        if (env.exists(name)) {
            return env.get(name);
        }

        if (userFunctions.containsKey(name) || functions.containsKey(name)) {
            return Value.func(name);
        }

        reportSystemError("var_not_found", name, expr.name, "Undefined variable: " + name);
        throw new RuntimeException("[line " + expr.name.line + "] Undefined variable: " + name);
    }

    public Value visitAssignExpr(Assign expr) {
        Value value = eval(expr.value);
        env.assign(expr.name.lexeme, value);
        return value;
    }

    public Value visitIndexExpr(IndexExpr expr) {
        Value target = eval(expr.target);
        Value idxV = eval(expr.index);
        if (idxV.getType() != Value.Type.NUMBER) throw new RuntimeException("Index must be a number");
        int i = (int) idxV.asNumber();

        if (target.getType() == Value.Type.ARRAY) {
            List<Value> list = target.asArray();
            if (i < 0 || i >= list.size()) throw new RuntimeException("Array index out of bounds: " + i);
            return list.get(i);
        }

        if (target.getType() == Value.Type.STRING) {
            String s = target.asString();
            if (i < 0 || i >= s.length()) throw new RuntimeException("String index out of bounds: " + i);
            return Value.string(String.valueOf(s.charAt(i)));
        }

        throw new RuntimeException("Indexing not supported on type: " + target.getType());
    }

    public Value visitSetIndexExpr(SetIndexExpr expr) {
        Value target = eval(expr.target);
        Value idxV = eval(expr.index);
        Value value = eval(expr.value);

        if (idxV.getType() != Value.Type.NUMBER) throw new RuntimeException("Index must be a number");
        int i = (int) idxV.asNumber();

        if (target.getType() == Value.Type.ARRAY) {
            List<Value> list = target.asArray();
            if (i < 0) throw new RuntimeException("Array index out of bounds: " + i);

            // allow append at end: a[len(a)] = v
            if (i == list.size()) {
                list.add(value);
                return value;
            }

            if (i > list.size()) throw new RuntimeException("Array index out of bounds: " + i);
            list.set(i, value);
            return value;
        }

        throw new RuntimeException("Index assignment not supported on type: " + target.getType());
    }

    public Value visitLogicalExpr(Logical expr) {
        Value left = eval(expr.left);
        if (expr.operator.type == TokenType.OR_OR) {
            if (isTruthy(left)) return left;
        } else {
            if (!isTruthy(left)) return left;
        }
        return eval(expr.right);
    }

    public Value visitCallExpr(Call expr) {
        if (!(expr.callee instanceof Variable)) throw new RuntimeException("Invalid function call target");
        String name = ((Variable) expr.callee).name.lexeme;

        // Evaluate + expand args (spread operator: '**iterableExpr').
        List<Value> args = new ArrayList<Value>();
        for (CallArg a : expr.arguments) {
            Value v = eval(a.expr);
            if (!a.spread) {
                args.add(v);
                continue;
            }
            if (!v.isIterable()) {
                String where = (a.spreadToken != null) ? (" at line " + a.spreadToken.line) : "";
                throw new RuntimeException("Spread operator expects an iterable" + where);
            }
            v.iterator().forEachRemaining(args::add);
        }

        // A variable holding a function, e.g. a FUNC parameter.
        if (env.exists(name)) {
            Value held = env.get(name);
            if (held.getType() == Value.Type.FUNC) {
                return invokeByName(held.asFunc(), args);
            }
        }

        if (userFunctions.containsKey(name) || functions.containsKey(name)) {
            return invokeByName(name, args);
        }

        reportSystemError("fn_not_found", name, expr.paren, "Unknown function: " + name);
        throw new RuntimeException("[line " + expr.paren.line + "] Unknown function: " + name);
    }

    private Value invokeByName(String name, List<Value> args) {
        if (callStack.size() >= maxDepth) throw new RuntimeException("Max call depth exceeded");

        // Prefer user-defined function over builtins.
        UserFunction uf = userFunctions.get(name);
        if (uf != null) {
            callStack.push(new CallFrame(name, args));
            try {
                return uf.call(this, args);
            } finally {
                callStack.pop();
            }
        }

        BuiltinFunction fn = functions.get(name);
        if (fn != null) {
            callStack.push(new CallFrame(name, args));
            try {
                return fn.call(this, args);
            } finally {
                callStack.pop();
            }
        }

        throw new RuntimeException("Undefined function: " + name);
    }

    // -------------------------
    // Builders
    // -------------------------

    public Value visitBuilderExpr(Builder expr) {
        ClauseIterator bindings = new ClauseIterator(this, expr.clauses, env, env);
        Iterator<Value> outputs = map(bindings, scope -> evalIn(expr.term, scope));
        return collect(expr.kind, outputs);
    }

    /**
     * A builder rewritten into a running scan. Every evaluation gets its own accumulator scope
     * holding the placeholder; the first clause's source is still evaluated outside of it. The
     * first accepted element of that source is the first output and stands in for its whole row:
     * later clauses and the term only run from the next element on.
     */
    public Value visitScanExpr(ScanExpr expr) {
        Builder builder = expr.builder;
        String placeholder = expr.placeholder;
        String head = builder.clauses.get(0).name.lexeme;

        Environment accumulator = env.childScope();
        accumulator.define(placeholder, Value.nil());

        ClauseIterator bindings = new ClauseIterator(this, builder.clauses, env, accumulator, true);
        Iterator<Value> outputs = Sequences.scanFromFirst(
                (Environment scope) -> scope.get(head),
                (Value prev, Environment scope) -> evalIn(builder.term, scope),
                bindings);

        // Later clause sources and the next term both read the placeholder, so it is updated
        // as soon as an output exists.
        return collect(builder.kind, tap(outputs, out -> accumulator.assign(placeholder, out)));
    }

    private static Value collect(Expr.ContainerKind kind, Iterator<Value> outputs) {
        switch (kind) {
            case LIST: {
                List<Value> out = new ArrayList<>();
                outputs.forEachRemaining(out::add);
                return Value.array(out);
            }
            case SET: {
                Set<Value> out = new LinkedHashSet<>();
                outputs.forEachRemaining(out::add);
                return Value.set(out);
            }
            default:
                return Value.seq(outputs);
        }
    }

    private static <E> Iterator<Value> map(Iterator<E> source, Function<E, Value> fn) {
        return new Iterator<Value>() {
            @Override
            public boolean hasNext() {
                return source.hasNext();
            }

            @Override
            public Value next() {
                return fn.apply(source.next());
            }
        };
    }

    private static Iterator<Value> tap(Iterator<Value> source, Consumer<Value> onEach) {
        return new Iterator<Value>() {
            @Override
            public boolean hasNext() {
                return source.hasNext();
            }

            @Override
            public Value next() {
                Value v = source.next();
                onEach.accept(v);
                return v;
            }
        };
    }

    // -------------------------
    // Helpers
    // -------------------------

    public static boolean isTruthy(Value v) {
        if (v == null) return false;
        switch (v.getType()) {
            case NULL: return false;
            case BOOL: return v.asBool();
            case NUMBER: return v.asNumber() != 0.0;
            case STRING: return !v.asString().isEmpty();
            case ARRAY: return !v.asArray().isEmpty();
            case SET: return !v.asSet().isEmpty();
            default: return true;
        }
    }

    /** Text form used by string concatenation and str(): integral numbers print without ".0". */
    public static String stringify(Value v) {
        switch (v.getType()) {
            case NULL: return "null";
            case STRING: return v.asString();
            case NUMBER: {
                double d = v.asNumber();
                if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
                    return Long.toString((long) d);
                }
                return Double.toString(d);
            }
            default: return v.toString();
        }
    }

    private static void requireNumber(Value left, Value right, Token op) {
        if (left.getType() != Value.Type.NUMBER || right.getType() != Value.Type.NUMBER) {
            throw new RuntimeException("[line " + op.line + "] Operator '" + op.lexeme + "' expects numbers, got "
                    + left.getType() + ", " + right.getType());
        }
    }
}
