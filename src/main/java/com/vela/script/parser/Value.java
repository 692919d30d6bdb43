package com.vela.script.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

public class Value {
    public enum Type { NULL, BOOL, NUMBER, OBJECT, FUNC, NATIVE }

    private static final Value NULL = new Value(Type.NULL, null);
    private static final Value TRUE = new Value(Type.BOOL, Boolean.TRUE);
    private static final Value FALSE = new Value(Type.BOOL, Boolean.FALSE);

    public final Type type;
    public final Object value;

    private Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value nil() { return NULL; }
    public static Value bool(boolean b) { return b ? TRUE : FALSE; }
    public static Value number(long n) { return new Value(Type.NUMBER, n); }
    public static Value func(UserFunction f) { return new Value(Type.FUNC, f); }
    public static Value nativeFn(NativeFunction f) { return new Value(Type.NATIVE, f); }

    /** Copies {@code properties}; the object value itself is immutable. */
    public static Value object(Map<String, Value> properties) {
        return new Value(Type.OBJECT, Collections.unmodifiableMap(new LinkedHashMap<>(properties)));
    }

    public Type getType() { return type; }

    public boolean isNull() { return type == Type.NULL; }

    public long asNumber() {
        if (type != Type.NUMBER) throw new IllegalStateException("Expected number, got " + type);
        return (long) value;
    }

    public boolean asBool() {
        if (type != Type.BOOL) throw new IllegalStateException("Expected bool, got " + type);
        return (boolean) value;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Value> asObject() {
        if (type != Type.OBJECT) throw new IllegalStateException("Expected object, got " + type);
        return (Map<String, Value>) value;
    }

    public UserFunction asFunc() {
        if (type != Type.FUNC) throw new IllegalStateException("Expected function, got " + type);
        return (UserFunction) value;
    }

    public NativeFunction asNative() {
        if (type != Type.NATIVE) throw new IllegalStateException("Expected native function, got " + type);
        return (NativeFunction) value;
    }

    /** Functions compare by identity, everything else by payload. */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        if (type != other.type) return false;
        switch (type) {
            case FUNC:
            case NATIVE:
                return value == other.value;
            default:
                return Objects.equals(value, other.value);
        }
    }

    @Override
    public int hashCode() {
        switch (type) {
            case FUNC:
            case NATIVE:
                return System.identityHashCode(value);
            default:
                return Objects.hash(type, value);
        }
    }

    @Override
    public String toString() {
        switch (type) {
            case NUMBER:
                return Long.toString(asNumber());
            case BOOL:
                return Boolean.toString(asBool());
            case OBJECT: {
                Map<String, Value> m = asObject();
                if (m.isEmpty()) return "{}";
                StringJoiner j = new StringJoiner(", ", "{ ", " }");
                for (Map.Entry<String, Value> e : m.entrySet()) j.add(e.getKey() + ": " + e.getValue());
                return j.toString();
            }
            case FUNC:
                return asFunc().toString();
            case NATIVE:
                return asNative().toString();
            default:
                return "null";
        }
    }
}
