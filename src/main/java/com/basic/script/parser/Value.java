package com.basic.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Runtime value. The payload is immutable for every type except LIST, whose element
 * storage is shared by all copies of the same list.
 *
 * posStart/posEnd/frame are diagnostic tags only; they are re-set in place whenever an
 * expression produces the value and are not part of its identity.
 */
public class Value {
    public enum Type { NUMBER, BOOL, STRING, LIST, FUNC, BUILTIN, NULL }

    public final Type type;
    public final Object value;

    Position posStart;
    Position posEnd;
    CallFrame frame;

    public Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value integer(long l) { return new Value(Type.NUMBER, l); }
    public static Value number(double d) { return new Value(Type.NUMBER, d); }
    public static Value bool(boolean b) { return new Value(Type.BOOL, b); }
    public static Value string(String s) { return new Value(Type.STRING, s); }
    public static Value list(List<Value> l) { return new Value(Type.LIST, l); }
    public static Value func(UserFunction f) { return new Value(Type.FUNC, f); }
    public static Value builtin(BuiltinFunction f) { return new Value(Type.BUILTIN, f); }
    public static Value nil() { return new Value(Type.NULL, null); }

    public Type getType() { return type; }

    // -------------------------
    // Diagnostic tags
    // -------------------------

    public Value setPos(Position posStart, Position posEnd) {
        this.posStart = posStart;
        this.posEnd = posEnd;
        return this;
    }

    public Value setFrame(CallFrame frame) {
        this.frame = frame;
        return this;
    }

    public Position posStart() { return posStart; }
    public Position posEnd() { return posEnd; }
    public CallFrame frame() { return frame; }

    /** Same payload, fresh tags. Lists keep sharing their element storage. */
    public Value copy() {
        Value out = new Value(type, value);
        out.posStart = posStart;
        out.posEnd = posEnd;
        out.frame = frame;
        return out;
    }

    // -------------------------
    // Accessors
    // -------------------------

    public boolean isNumber() { return type == Type.NUMBER; }

    /** True for NUMBER values produced from an integer literal or integer-only arithmetic. */
    public boolean isInteger() { return type == Type.NUMBER && value instanceof Long; }

    public boolean isCallable() { return type == Type.FUNC || type == Type.BUILTIN; }

    public double asNumber() {
        if (type != Type.NUMBER) throw new IllegalStateException("Expected number, got " + type);
        return ((Number) value).doubleValue();
    }

    public long asLong() {
        if (type != Type.NUMBER) throw new IllegalStateException("Expected number, got " + type);
        return ((Number) value).longValue();
    }

    public boolean asBool() {
        if (type != Type.BOOL) throw new IllegalStateException("Expected bool, got " + type);
        return (boolean) value;
    }

    public String asString() {
        if (type != Type.STRING) throw new IllegalStateException("Expected string, got " + type);
        return (String) value;
    }

    @SuppressWarnings("unchecked")
    public List<Value> asList() {
        if (type != Type.LIST) throw new IllegalStateException("Expected list, got " + type);
        return (List<Value>) value;
    }

    public UserFunction asFunc() {
        if (type != Type.FUNC) throw new IllegalStateException("Expected function, got " + type);
        return (UserFunction) value;
    }

    public BuiltinFunction asBuiltin() {
        if (type != Type.BUILTIN) throw new IllegalStateException("Expected builtin function, got " + type);
        return (BuiltinFunction) value;
    }

    /** Name of a FUNC or BUILTIN value. */
    public String functionName() {
        if (type == Type.FUNC) return asFunc().name;
        if (type == Type.BUILTIN) return asBuiltin().name;
        throw new IllegalStateException("Expected function, got " + type);
    }

    // -------------------------
    // Truthiness
    // -------------------------

    public boolean isTrue() {
        switch (type) {
            case NUMBER: return asNumber() != 0.0;
            case BOOL:   return asBool();
            case STRING: return !asString().isEmpty();
            case LIST:
            case FUNC:
            case BUILTIN:
                return true;
            default:
                return false;
        }
    }

    public String typeName() {
        switch (type) {
            case NUMBER:  return "number";
            case BOOL:    return "boolean";
            case STRING:  return "string";
            case LIST:    return "list";
            case FUNC:
            case BUILTIN:
                return "function";
            default:
                return "null";
        }
    }

    /** Display text used by string concatenation: strings unquoted, everything else as printed. */
    public String displayText() {
        return (type == Type.STRING) ? asString() : toString();
    }

    @Override
    public String toString() {
        return render(Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    // A list that contains itself, directly or not, prints as [...] where it recurs.
    private String render(Set<List<Value>> open) {
        switch (type) {
            case NUMBER:
                return isInteger() ? Long.toString(asLong()) : Double.toString(asNumber());
            case BOOL:
                return Boolean.toString(asBool());
            case STRING:
                return '"' + asString() + '"';
            case LIST: {
                List<Value> elements = asList();
                if (!open.add(elements)) return "[...]";
                List<String> parts = new ArrayList<>();
                for (Value v : elements) parts.add(v == null ? "null" : v.render(open));
                open.remove(elements);
                return "[" + String.join(", ", parts) + "]";
            }
            case FUNC:
                return "<function " + asFunc().name + ">";
            case BUILTIN:
                return "<built-in function " + asBuiltin().name + ">";
            default:
                return "null";
        }
    }
}
