package com.scanprev.script.parser;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Set;

public class Value {
    public enum Type { NUMBER, BOOL, STRING, FUNC, ARRAY, SET, SEQ, NULL }

    public final Type type;
    public final Object value;

    public Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value func(String s) { return new Value(Type.FUNC, s); }
    public static Value number(double d) { return new Value(Type.NUMBER, d); }
    public static Value bool(boolean b) { return new Value(Type.BOOL, b); }
    public static Value string(String s) { return new Value(Type.STRING, s); }
    public static Value array(List<Value> a) { return new Value(Type.ARRAY, a); }
    public static Value set(Set<Value> s) { return new Value(Type.SET, s); }
    public static Value seq(Iterator<Value> it) { return new Value(Type.SEQ, it); }
    public static Value nil() { return new Value(Type.NULL, null); }

    /** Convenience for hosts: an ARRAY of numbers. */
    public static Value numbers(double... ds) {
        List<Value> out = new ArrayList<>(ds.length);
        for (double d : ds) out.add(number(d));
        return array(out);
    }

    public Type getType() { return type; }

    public String asFunc() {
        if (type != Type.FUNC) throw new RuntimeException("Expected function, got " + type);
        return (String) value;
    }

    public double asNumber() {
        if (type != Type.NUMBER) throw new RuntimeException("Expected number, got " + type);
        return (double) value;
    }

    public boolean asBool() {
        if (type != Type.BOOL) throw new RuntimeException("Expected bool, got " + type);
        return (boolean) value;
    }

    public String asString() {
        if (type != Type.STRING && type != Type.FUNC) {
            throw new RuntimeException("Expected string, got " + type);
        }
        return (String) value;
    }

    @SuppressWarnings("unchecked")
    public List<Value> asArray() {
        if (type != Type.ARRAY) throw new RuntimeException("Expected array, got " + type);
        return (List<Value>) value;
    }

    @SuppressWarnings("unchecked")
    public Set<Value> asSet() {
        if (type != Type.SET) throw new RuntimeException("Expected set, got " + type);
        return (Set<Value>) value;
    }

    @SuppressWarnings("unchecked")
    public Iterator<Value> asSeq() {
        if (type != Type.SEQ) throw new RuntimeException("Expected sequence, got " + type);
        return (Iterator<Value>) value;
    }

    public boolean isIterable() {
        return type == Type.ARRAY || type == Type.SET || type == Type.SEQ || type == Type.STRING;
    }

    /**
     * Iterate any iterable value. A SEQ hands out its own single-pass iterator, so a second
     * traversal only sees what the first one left.
     */
    public Iterator<Value> iterator() {
        switch (type) {
            case ARRAY: return asArray().iterator();
            case SET:   return asSet().iterator();
            case SEQ:   return asSeq();
            case STRING: {
                String s = asString();
                List<Value> chars = new ArrayList<>(s.length());
                for (int i = 0; i < s.length(); i++) chars.add(Value.string(String.valueOf(s.charAt(i))));
                return chars.iterator();
            }
            default:
                throw new RuntimeException("Value is not iterable: " + type);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        if (type != other.type) return false;
        if (type == Type.SEQ) return value == other.value;
        return Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        if (type == Type.SEQ) return System.identityHashCode(value);
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        switch (type) {
            case NUMBER:
                return Double.toString(asNumber());
            case BOOL:
                return Boolean.toString(asBool());
            case STRING:
                return '"' + asString() + '"';
            case FUNC:
                return "function " + asFunc();
            case ARRAY:
                return asArray().toString();
            case SET: {
                Collection<Value> s = asSet();
                StringBuilder sb = new StringBuilder("{");
                int i = 0;
                for (Value v : s) {
                    if (i++ > 0) sb.append(", ");
                    sb.append(v);
                }
                return sb.append('}').toString();
            }
            case SEQ:
                return "seq";
            default:
                return "null";
        }
    }
}
