package com.scanprev.script.plugins;

import java.util.List;

import com.scanprev.script.ScanScript;
import com.scanprev.script.parser.Value;

/**
 * MathPlugin
 *
 * Extended math functions, not part of the core engine.
 *
 * Usage:
 *   MathPlugin.register(engine);
 *
 * Then in scripts:
 *   let x = pow(2, 8);
 *   let y = sqrt(16);
 *   let z = clamp(a, 0, 1);
 */
public final class MathPlugin {

    private MathPlugin() {}

    public static void register(ScanScript engine) {

        engine.registerFunction("pow", (interp, args) -> {
            requireArgs("pow", args, 2);
            return Value.number(Math.pow(num(args, 0), num(args, 1)));
        });

        engine.registerFunction("sqrt", (interp, args) -> {
            requireArgs("sqrt", args, 1);
            return Value.number(Math.sqrt(num(args, 0)));
        });

        engine.registerFunction("exp", (interp, args) -> {
            requireArgs("exp", args, 1);
            return Value.number(Math.exp(num(args, 0)));
        });

        engine.registerFunction("log", (interp, args) -> {
            requireArgs("log", args, 1);
            return Value.number(Math.log(num(args, 0)));
        });

        engine.registerFunction("clamp", (interp, args) -> {
            requireArgs("clamp", args, 3);
            double v = num(args, 0);
            double lo = num(args, 1);
            double hi = num(args, 2);
            return Value.number(Math.max(lo, Math.min(hi, v)));
        });

        engine.registerFunction("round", (interp, args) -> {
            requireArgs("round", args, 1);
            return Value.number(Math.round(num(args, 0)));
        });

        engine.registerFunction("floor", (interp, args) -> {
            requireArgs("floor", args, 1);
            return Value.number(Math.floor(num(args, 0)));
        });

        engine.registerFunction("ceil", (interp, args) -> {
            requireArgs("ceil", args, 1);
            return Value.number(Math.ceil(num(args, 0)));
        });
    }

    // ===================== HELPERS =====================

    private static void requireArgs(String fn, List<Value> args, int n) {
        if (args.size() != n) {
            throw new RuntimeException(fn + "() expects " + n + " arguments, got " + args.size());
        }
    }

    private static double num(List<Value> args, int idx) {
        Value v = args.get(idx);
        if (v.getType() != Value.Type.NUMBER) {
            throw new RuntimeException("Argument " + idx + " must be a number");
        }
        return v.asNumber();
    }
}
