package com.basic.script.parser;

import java.util.List;

/** Argument checks and binding shared by user and builtin functions. */
final class Invocation {

    private Invocation() {}

    static void checkArity(String name, int expected, List<Value> args, Value callee, CallFrame frame) {
        int got = args.size();
        if (got > expected) {
            throw new RTError(RTError.Kind.ARITY_MISMATCH, callee.posStart(), callee.posEnd(),
                    (got - expected) + " too many args passed into '" + name + "' (expected " + expected + ", got " + got + ")",
                    frame);
        }
        if (got < expected) {
            throw new RTError(RTError.Kind.ARITY_MISMATCH, callee.posStart(), callee.posEnd(),
                    (expected - got) + " too few args passed into '" + name + "' (expected " + expected + ", got " + got + ")",
                    frame);
        }
    }

    static void bindArgs(Environment env, List<String> params, List<Value> args, CallFrame frame) {
        for (int i = 0; i < params.size(); i++) {
            env.set(params.get(i), args.get(i).copy().setFrame(frame));
        }
    }
}
