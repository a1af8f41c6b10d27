package com.basic.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.basic.script.parser.Expr.ExprInterface;

/**
 * Function defined in source. Holds the body node by reference and the environment it
 * was defined in; each call gets its own child of that environment.
 */
public class UserFunction {
    public static final String ANONYMOUS = "<anonymous>";

    final String name;
    final List<String> params;
    final ExprInterface body;
    final Environment closure;

    UserFunction(String name, List<String> params, ExprInterface body, Environment closure) {
        this.name = (name == null) ? ANONYMOUS : name;
        this.params = Collections.unmodifiableList(new ArrayList<>(params));
        this.body = body;
        this.closure = closure;
    }

    public String name() { return name; }
    public List<String> params() { return params; }

    Value call(Interpreter interpreter, List<Value> args, Value callee) {
        Invocation.checkArity(name, params.size(), args, callee, interpreter.frame);

        Environment previousEnv = interpreter.env;
        CallFrame previousFrame = interpreter.frame;

        // The frame chains to the caller's frame for tracebacks; the scope chains to the closure.
        CallFrame frame = new CallFrame(name, callee.frame(), callee.posStart());
        Environment env = closure.childScope();
        Invocation.bindArgs(env, params, args, frame);

        interpreter.env = env;
        interpreter.frame = frame;
        try {
            return interpreter.evaluate(body);
        } finally {
            interpreter.env = previousEnv;
            interpreter.frame = previousFrame;
        }
    }
}
