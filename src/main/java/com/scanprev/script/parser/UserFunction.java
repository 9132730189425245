package com.scanprev.script.parser;

import java.util.List;

import com.scanprev.script.parser.Interpreter.ReturnSignal;
import com.scanprev.script.parser.Statement.Stmt;

public class UserFunction {
    final String name;
    final List<Token> params;
    final List<Stmt> body;
    final Environment closure;

    UserFunction(String name, List<Token> params, List<Stmt> body, Environment closure) {
        this.name = name;
        this.params = params;
        this.body = body;
        this.closure = closure;
    }

    Value call(Interpreter interpreter, List<Value> args) {
        if (args.size() != params.size()) {
            throw new RuntimeException(name + "() expects " + params.size() + " arguments, got " + args.size());
        }

        Environment previous = interpreter.env;

        // New call frame is a child of the function's closure (lexical scoping),
        // not a child of the caller's environment.
        interpreter.env = closure.childScope();

        try {
            for (int i = 0; i < params.size(); i++) {
                interpreter.env.define(params.get(i).lexeme, args.get(i));
            }

            try {
                for (Stmt s : body) s.accept(interpreter);
            } catch (ReturnSignal rs) {
                return rs.value;
            }

            return Value.nil();
        } finally {
            interpreter.env = previous;
        }
    }
}
