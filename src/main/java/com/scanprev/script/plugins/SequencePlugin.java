package com.scanprev.script.plugins;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

import com.scanprev.script.ScanScript;
import com.scanprev.script.parser.Interpreter;
import com.scanprev.script.parser.Value;
import com.scanprev.script.seq.Sequences;

/**
 * SequencePlugin
 *
 * Script bindings for the sequence primitives. Registered by every {@link ScanScript} engine.
 *
 * In scripts:
 *   let sums = list(scan(add, [1, 2, 3]));   // [1, 3, 6]
 *   let total = last(sums);                    // 6
 *   let firsts = take(count(1, 2), 3);         // lazy 1, 3, 5
 *
 * scan, prepend, range, count and take return lazy single-pass sequences.
 */
public final class SequencePlugin {

    private SequencePlugin() {}

    public static void register(ScanScript engine) {

        engine.registerFunction("scan", (interp, args) -> {
            requireArgs("scan", args, 2, 4);
            Value fn = func("scan", args, 0);
            Iterator<Value> source = iterable("scan", args, 1);
            if (args.size() == 2) {
                return Value.seq(Sequences.scan((Value acc, Value x) -> call(interp, fn, acc, x), source));
            }
            boolean echo = args.size() < 4 || Interpreter.isTruthy(args.get(3));
            return Value.seq(Sequences.scan((Value acc, Value x) -> call(interp, fn, acc, x), source, args.get(2), echo));
        });

        engine.registerFunction("last", (interp, args) -> {
            requireArgs("last", args, 1, 1);
            return Sequences.last(iterable("last", args, 0));
        });

        engine.registerFunction("prepend", (interp, args) -> {
            requireArgs("prepend", args, 2, 2);
            return Value.seq(Sequences.prepend(args.get(0), iterable("prepend", args, 1)));
        });

        engine.registerFunction("reduce", (interp, args) -> {
            requireArgs("reduce", args, 2, 3);
            Value fn = func("reduce", args, 0);
            Iterator<Value> source = iterable("reduce", args, 1);
            if (args.size() == 2) {
                return Sequences.last(Sequences.scan((Value acc, Value x) -> call(interp, fn, acc, x), source));
            }
            return Sequences.last(Sequences.scan((Value acc, Value x) -> call(interp, fn, acc, x), source, args.get(2)));
        });

        engine.registerFunction("range", (interp, args) -> {
            requireArgs("range", args, 1, 3);
            double from = 0;
            double to;
            double step = 1;
            if (args.size() == 1) {
                to = num("range", args, 0);
            } else {
                from = num("range", args, 0);
                to = num("range", args, 1);
                if (args.size() == 3) step = num("range", args, 2);
            }
            if (step == 0) throw new RuntimeException("range() step must not be zero");
            return Value.seq(new Counter(from, step, to));
        });

        engine.registerFunction("count", (interp, args) -> {
            requireArgs("count", args, 0, 2);
            double from = args.isEmpty() ? 0 : num("count", args, 0);
            double step = args.size() < 2 ? 1 : num("count", args, 1);
            return Value.seq(new Counter(from, step, null));
        });

        engine.registerFunction("take", (interp, args) -> {
            requireArgs("take", args, 2, 2);
            Iterator<Value> source = iterable("take", args, 0);
            int n = (int) num("take", args, 1);
            return Value.seq(new Iterator<Value>() {
                private int taken = 0;

                @Override
                public boolean hasNext() {
                    return taken < n && source.hasNext();
                }

                @Override
                public Value next() {
                    if (!hasNext()) throw new NoSuchElementException();
                    taken++;
                    return source.next();
                }
            });
        });

        engine.registerFunction("list", (interp, args) -> {
            requireArgs("list", args, 1, 1);
            List<Value> out = new ArrayList<>();
            iterable("list", args, 0).forEachRemaining(out::add);
            return Value.array(out);
        });

        engine.registerFunction("set", (interp, args) -> {
            requireArgs("set", args, 1, 1);
            Set<Value> out = new LinkedHashSet<>();
            iterable("set", args, 0).forEachRemaining(out::add);
            return Value.set(out);
        });

        engine.registerFunction("union", (interp, args) -> {
            requireArgs("union", args, 2, 2);
            Set<Value> out = new LinkedHashSet<>();
            iterable("union", args, 0).forEachRemaining(out::add);
            iterable("union", args, 1).forEachRemaining(out::add);
            return Value.set(out);
        });
    }

    /** Arithmetic progression, bounded by {@code to} (exclusive) unless it is null. */
    private static final class Counter implements Iterator<Value> {
        private final double step;
        private final Double to;
        private double next;

        Counter(double from, double step, Double to) {
            this.next = from;
            this.step = step;
            this.to = to;
        }

        @Override
        public boolean hasNext() {
            if (to == null) return true;
            return step > 0 ? next < to : next > to;
        }

        @Override
        public Value next() {
            if (!hasNext()) throw new NoSuchElementException();
            double out = next;
            next += step;
            return Value.number(out);
        }
    }

    // ===================== HELPERS =====================

    private static Value call(Interpreter interp, Value fn, Value acc, Value x) {
        return interp.invoke(fn, Arrays.asList(acc, x));
    }

    private static void requireArgs(String fn, List<Value> args, int min, int max) {
        if (args.size() < min || args.size() > max) {
            String expected = (min == max) ? String.valueOf(min) : (min + " to " + max);
            throw new RuntimeException(fn + "() expects " + expected + " arguments, got " + args.size());
        }
    }

    private static Value func(String fn, List<Value> args, int idx) {
        Value v = args.get(idx);
        if (v.getType() != Value.Type.FUNC) {
            throw new RuntimeException(fn + "() argument " + idx + " must be a function");
        }
        return v;
    }

    private static Iterator<Value> iterable(String fn, List<Value> args, int idx) {
        Value v = args.get(idx);
        if (!v.isIterable()) {
            throw new RuntimeException(fn + "() argument " + idx + " must be iterable, got " + v.getType());
        }
        return v.iterator();
    }

    private static double num(String fn, List<Value> args, int idx) {
        Value v = args.get(idx);
        if (v.getType() != Value.Type.NUMBER) {
            throw new RuntimeException(fn + "() argument " + idx + " must be a number");
        }
        return v.asNumber();
    }
}
