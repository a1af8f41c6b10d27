package com.basic.script.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Symbol table chained to a parent for lexical lookup.
 *
 * Writes always land in this table; the parent is only ever read.
 */
public class Environment {
    public final Environment parent;
    private final Map<String, Value> vars = new LinkedHashMap<>();

    public Environment() {
        this.parent = null;
    }

    private Environment(Environment parent) {
        this.parent = parent;
    }

    /** Fresh frame for one function invocation; lookups fall through to this one. */
    public Environment childScope() {
        return new Environment(this);
    }

    // -------------------------
    // Vars API
    // -------------------------

    /** Nearest binding up the chain, or {@code null} if no table holds {@code name}. */
    public Value get(String name) {
        for (Environment e = this; e != null; e = e.parent) {
            Value v = e.vars.get(name);
            if (v != null) return v;
        }
        return null;
    }

    public void set(String name, Value value) {
        vars.put(name, value);
    }

    /** Bindings of this table only, in insertion order. */
    public Map<String, Value> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(vars));
    }
}
