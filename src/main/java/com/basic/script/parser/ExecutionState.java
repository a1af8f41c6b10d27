package com.basic.script.parser;

import java.util.Map;

/**
 * Long-lived session state: the global environment and the root call frame.
 *
 * One instance backs a whole REPL session so definitions from one input stay visible
 * in the next. Independent sessions share nothing.
 */
public class ExecutionState {
    public static final String ROOT_FRAME = "<program>";

    public final Environment global;
    public final CallFrame rootFrame;
    private int runs;

    public ExecutionState() {
        this.global = new Environment();
        this.rootFrame = new CallFrame(ROOT_FRAME, null, null);
        global.set("null", Value.nil());
        global.set("true", Value.bool(true));
        global.set("false", Value.bool(false));
    }

    public void define(String name, Value value) {
        global.set(name, value);
    }

    public Value lookup(String name) {
        return global.get(name);
    }

    /** Fresh interpreter bound to the global scope; one per top-level run. */
    public Interpreter newInterpreter() {
        runs++;
        return new Interpreter(global, rootFrame);
    }

    public int runCount() {
        return runs;
    }

    public Map<String, Value> snapshot() {
        return global.snapshot();
    }
}
