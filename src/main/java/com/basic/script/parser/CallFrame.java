package com.basic.script.parser;

/**
 * One entry of the call stack used for tracebacks. Pushed per function invocation,
 * never per block; variable lookup goes through {@link Environment} instead.
 */
public class CallFrame {
    final String name;
    final CallFrame parent;
    final Position entryPos;

    public CallFrame(String name, CallFrame parent, Position entryPos) {
        this.name = name;
        this.parent = parent;
        this.entryPos = entryPos;
    }

    public String name() { return name; }
    public CallFrame parent() { return parent; }
    public Position entryPos() { return entryPos; }

    public int depth() {
        int d = 0;
        for (CallFrame f = parent; f != null; f = f.parent) d++;
        return d;
    }
}
