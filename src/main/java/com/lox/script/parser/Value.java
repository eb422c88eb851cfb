package com.lox.script.parser;

import java.util.Objects;

/**
 * Runtime and literal value: number (double), bool, string or nil.
 *
 * Equality is type-homogeneous; a number never equals a string.
 */
public final class Value {
    public enum Type { NUMBER, BOOL, STRING, NIL }

    private static final Value NIL = new Value(Type.NIL, null);
    private static final Value TRUE = new Value(Type.BOOL, Boolean.TRUE);
    private static final Value FALSE = new Value(Type.BOOL, Boolean.FALSE);

    public final Type type;
    public final Object value;

    private Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value number(double d) { return new Value(Type.NUMBER, d); }
    public static Value bool(boolean b) { return b ? TRUE : FALSE; }
    public static Value string(String s) { return new Value(Type.STRING, Objects.requireNonNull(s, "s")); }
    public static Value nil() { return NIL; }

    public Type getType() { return type; }

    public boolean isNil() { return type == Type.NIL; }

    public double asNumber() {
        if (type != Type.NUMBER) throw new IllegalStateException("Expected number, got " + type);
        return (double) value;
    }

    public boolean asBool() {
        if (type != Type.BOOL) throw new IllegalStateException("Expected bool, got " + type);
        return (boolean) value;
    }

    public String asString() {
        if (type != Type.STRING) throw new IllegalStateException("Expected string, got " + type);
        return (String) value;
    }

    /** nil and false are falsy; everything else, including 0 and "", is truthy. */
    public boolean isTruthy() {
        switch (type) {
            case NIL: return false;
            case BOOL: return asBool();
            default: return true;
        }
    }

    /** Form written by print: strings unquoted, integral numbers without ".0". */
    public String display() {
        switch (type) {
            case NUMBER: return formatNumber(asNumber());
            case BOOL: return Boolean.toString(asBool());
            case STRING: return asString();
            default: return "nil";
        }
    }

    static String formatNumber(double d) {
        String text = Double.toString(d);
        if (text.endsWith(".0")) {
            text = text.substring(0, text.length() - 2);
        }
        return text;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        if (type != other.type) return false;
        switch (type) {
            // IEEE comparison, so NaN != NaN even for the same instance
            case NUMBER: return asNumber() == other.asNumber();
            case NIL: return true;
            default: return this == other || value.equals(other.value);
        }
    }

    @Override
    public int hashCode() {
        // -0.0 == 0.0 must hash alike
        if (type == Type.NUMBER && asNumber() == 0.0) return Objects.hash(type, 0.0);
        return Objects.hash(type, value);
    }

    /** Debug form used in error messages: strings are quoted. */
    @Override
    public String toString() {
        if (type == Type.STRING) return '"' + asString() + '"';
        return display();
    }
}
