package com.basic.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Function implemented in Java. Called with the same arity protocol as {@link UserFunction}. */
public class BuiltinFunction {

    /**
     * Native body. Throw {@link IllegalArgumentException} for bad arguments; the
     * interpreter reports it as an illegal operation at the call site.
     */
    public interface Native {
        Value call(List<Value> args);
    }

    final String name;
    final List<String> params;
    final Native impl;

    public BuiltinFunction(String name, List<String> params, Native impl) {
        this.name = name;
        this.params = Collections.unmodifiableList(new ArrayList<>(params));
        this.impl = impl;
    }

    public String name() { return name; }
    public List<String> params() { return params; }

    Value call(Interpreter interpreter, List<Value> args, Value callee) {
        Invocation.checkArity(name, params.size(), args, callee, interpreter.frame);

        CallFrame frame = new CallFrame(name, callee.frame(), callee.posStart());
        Environment env = interpreter.env.childScope();
        Invocation.bindArgs(env, params, args, frame);

        List<Value> bound = new ArrayList<>(params.size());
        for (String p : params) bound.add(env.get(p));

        Value out;
        try {
            out = impl.call(bound);
        } catch (IllegalArgumentException | IndexOutOfBoundsException e) {
            throw new RTError(RTError.Kind.ILLEGAL_OPERATION, callee.posStart(), callee.posEnd(),
                    e.getMessage(), frame);
        }
        return (out == null) ? Value.nil() : out;
    }
}
