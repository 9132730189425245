package com.scanprev.script;

import com.fasterxml.jackson.databind.JsonNode;
import com.scanprev.debug.Debug;
import com.scanprev.script.json.TreeJson;
import com.scanprev.script.parser.Environment;
import com.scanprev.script.parser.Interpreter;
import com.scanprev.script.parser.Lexer;
import com.scanprev.script.parser.Parser;
import com.scanprev.script.parser.Statement.FunctionStmt;
import com.scanprev.script.parser.Statement.Stmt;
import com.scanprev.script.parser.Token;
import com.scanprev.script.parser.Value;
import com.scanprev.script.plugins.SequencePlugin;
import com.scanprev.script.scan.ScanEnabler;

import java.util.*;
import java.util.function.UnaryOperator;

/**
 * Core ScanScript engine.
 *
 * - JavaScript-like syntax (let / if / else / while / for / && / || / == / != / + - * / % / **)
 * - Types: number (double), bool, string, function, array, set, lazy sequence, null
 * - Builders: [t for x in xs if c], {t for x in xs}, (t for x in xs)
 * - Function calls:
 *     - Built-ins (registered via registerFunction, plus SequencePlugin)
 *     - User-defined functions (function name(a,b){ ...; return ...; })
 * - Decorators:
 *     - @scan(prev) in front of a function turns every builder whose term reads
 *       {@code prev} into a running scan over its inputs
 *
 * Errors (lex/parse/transform/runtime) are reported to the debug hub and rethrown to the host.
 */
public class ScanScript {
    private static final String TAG = "ScanScript";

    /** Functional interface for built-in functions. */
    public interface BuiltinFunction {
        Value call(Interpreter interpreter, List<Value> args);
    }

    private final Map<String, BuiltinFunction> functions = new HashMap<String, BuiltinFunction>();
    private int maxCallDepth = 64;

    public ScanScript() {
        registerCoreBuiltins();
        SequencePlugin.register(this);
    }

    /** Rewrite step for one function, see {@link ScanEnabler#enableScan(String)}. */
    public static UnaryOperator<FunctionStmt> enableScan(String placeholder) {
        return ScanEnabler.enableScan(placeholder);
    }

    public void setMaxCallDepth(int depth) {
        if (depth < 1) throw new IllegalArgumentException("max call depth must be positive: " + depth);
        this.maxCallDepth = depth;
    }

    public void registerFunction(String name, BuiltinFunction fn) { functions.put(name, fn); }

    public boolean hasFunction(String name) { return functions.containsKey(name); }

    /** Lex and parse only. Decorators are left in place. */
    public List<Stmt> parse(String source) {
        try {
            return parseInternal(source);
        } catch (RuntimeException e) {
            throw fail("parse", e);
        }
    }

    /**
     * Parse and apply every function decorator, without executing anything. Transform errors
     * surface here exactly as they would when the program runs.
     */
    public List<Stmt> compile(String source) {
        try {
            List<Stmt> program = parseInternal(source);
            List<Stmt> out = new ArrayList<>(program.size());
            for (Stmt s : program) {
                out.add(s instanceof FunctionStmt ? ScanEnabler.applyDecorators((FunctionStmt) s) : s);
            }
            return out;
        } catch (RuntimeException e) {
            throw fail("compile", e);
        }
    }

    /** The compiled program as a JSON tree. */
    public JsonNode dumpTree(String source) {
        return TreeJson.program(compile(source));
    }

    public Map<String, Value> run(String source) {
        return runInternal(source, new Environment());
    }

    /** Global-program mode: run script with an initial environment. Returns final env snapshot. */
    public Map<String, Value> run(String source, Map<String, Value> initialEnv) {
        return runInternal(source, new Environment(initialEnv));
    }

    /**
     * Runs the script (top-level executes, functions register), then invokes a user-defined
     * entry function and returns its result.
     */
    public Value run(String source, String entryFunctionName, List<Value> entryArgs) {
        if (source == null) throw new IllegalArgumentException("source must not be null");
        if (entryFunctionName == null || entryFunctionName.trim().isEmpty()) {
            throw new IllegalArgumentException("entryFunctionName must not be empty");
        }

        Environment env = new Environment();
        try {
            List<Stmt> program = parseInternal(source);
            Interpreter interpreter = new Interpreter(env, functions, maxCallDepth);

            // 1) globals
            interpreter.execute(program);

            // 2) entry call
            List<Value> args = (entryArgs == null) ? Collections.<Value>emptyList() : entryArgs;
            return interpreter.invokeForHost(entryFunctionName, args);
        } catch (RuntimeException e) {
            throw fail(entryFunctionName, e);
        }
    }

    private Map<String, Value> runInternal(String source, Environment env) {
        if (source == null) throw new IllegalArgumentException("source must not be null");
        try {
            List<Stmt> program = parseInternal(source);
            Interpreter interpreter = new Interpreter(env, functions, maxCallDepth);
            interpreter.execute(program);
            return env.snapshot();
        } catch (RuntimeException e) {
            throw fail("run", e);
        }
    }

    private static List<Stmt> parseInternal(String source) {
        Lexer lexer = new Lexer(source);
        List<Token> tokens = lexer.tokenize();
        Parser parser = new Parser(tokens);
        return parser.parse();
    }

    private static RuntimeException fail(String where, RuntimeException e) {
        Debug.get().e(TAG, where + " failed: " + (e.getMessage() == null ? e.toString() : e.getMessage()), e);
        return e;
    }

    private void registerCoreBuiltins() {
        registerFunction("abs", (interp, args) -> {
            requireArgCount("abs", args, 1);
            return Value.number(Math.abs(args.get(0).asNumber()));
        });

        registerFunction("min", (interp, args) -> {
            if (args.isEmpty()) throw new RuntimeException("min() expects at least 1 argument");
            double m = args.get(0).asNumber();
            for (int i = 1; i < args.size(); i++) {
                double d = args.get(i).asNumber();
                if (d < m) m = d;
            }
            return Value.number(m);
        });

        registerFunction("max", (interp, args) -> {
            if (args.isEmpty()) throw new RuntimeException("max() expects at least 1 argument");
            double m = args.get(0).asNumber();
            for (int i = 1; i < args.size(); i++) {
                double d = args.get(i).asNumber();
                if (d > m) m = d;
            }
            return Value.number(m);
        });

        registerFunction("len", (interp, args) -> {
            requireArgCount("len", args, 1);
            Value v = args.get(0);
            switch (v.getType()) {
                case STRING: return Value.number(v.asString().length());
                case ARRAY: return Value.number(v.asArray().size());
                case SET: return Value.number(v.asSet().size());
                default: throw new RuntimeException("len() not supported for type: " + v.getType());
            }
        });

        registerFunction("typeof", (interp, args) -> {
            if (args.size() != 1) {
                throw new RuntimeException("typeof(x) expects 1 argument, got " + args.size());
            }
            Value v = args.get(0);
            String typeName;
            switch (v.getType()) {
                case NUMBER: typeName = "number"; break;
                case BOOL:   typeName = "bool"; break;
                case STRING: typeName = "string"; break;
                case FUNC:   typeName = "function"; break;
                case ARRAY:  typeName = "array"; break;
                case SET:    typeName = "set"; break;
                case SEQ:    typeName = "seq"; break;
                case NULL:   typeName = "null"; break;
                default:     typeName = "unknown"; break;
            }
            return Value.string(typeName);
        });

        registerFunction("str", (interp, args) -> {
            requireArgCount("str", args, 1);
            return Value.string(Interpreter.stringify(args.get(0)));
        });
    }

    private static void requireArgCount(String name, List<Value> args, int expected) {
        if (args.size() != expected) {
            throw new RuntimeException(name + "() expects " + expected + " arguments, got " + args.size());
        }
    }
}
