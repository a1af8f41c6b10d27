package com.basic.script;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.basic.debug.Debug;
import com.basic.script.parser.BasicError;
import com.basic.script.parser.BuiltinFunction;
import com.basic.script.parser.ExecutionState;
import com.basic.script.parser.Expr;
import com.basic.script.parser.Interpreter;
import com.basic.script.parser.Lexer;
import com.basic.script.parser.Parser;
import com.basic.script.parser.Token;
import com.basic.script.parser.Value;

/**
 * Core BasicScript engine.
 *
 * - Expression language: var / if-elif-else / for-to-step / while / fun / calls / lists
 * - Types: int, float, bool, string, list, function, null
 * - Pipeline: text -> Lexer -> tokens -> Parser -> AST -> Interpreter -> Value
 * - Errors: the first lexing, parsing or runtime error aborts the run and is thrown
 *   to the host as a {@link BasicError}
 * - State: global variables live in an {@link ExecutionState} the host creates with
 *   {@link #newSession()} and passes to every {@link #run} call
 */
public class BasicScript {
    private static final String TAG = "basic.script";

    private final Map<String, BuiltinFunction> functions = new LinkedHashMap<>();

    public BasicScript() {
        registerCoreBuiltins();
    }

    public void registerFunction(String name, List<String> params, BuiltinFunction.Native impl) {
        functions.put(name, new BuiltinFunction(name, params, impl));
    }

    public Map<String, BuiltinFunction> functions() {
        return Collections.unmodifiableMap(functions);
    }

    /** New session with the constants and every builtin registered so far. */
    public ExecutionState newSession() {
        ExecutionState session = new ExecutionState();
        for (BuiltinFunction fn : functions.values()) {
            session.define(fn.name(), Value.builtin(fn));
        }
        return session;
    }

    public List<Token> tokenize(String sourceName, String sourceText) {
        return new Lexer(sourceName, sourceText).tokenize();
    }

    public Expr.ExprInterface parse(String sourceName, String sourceText) {
        return new Parser(tokenize(sourceName, sourceText)).parse();
    }

    /**
     * Runs one top-level expression against the session's global scope.
     *
     * @throws BasicError on the first illegal character, syntax error or runtime error
     */
    public Value run(ExecutionState session, String sourceName, String sourceText) {
        if (session == null) throw new IllegalArgumentException("session must not be null");

        List<Token> tokens = tokenize(sourceName, sourceText);
        Debug.get().d(TAG, sourceName + ": " + tokens.size() + " tokens");

        Expr.ExprInterface ast = new Parser(tokens).parse();

        Interpreter interpreter = session.newInterpreter();
        Value result = interpreter.evaluate(ast);
        Debug.get().d(TAG, sourceName + ": run #" + session.runCount() + " -> " + result.typeName());
        return result;
    }

    private void registerCoreBuiltins() {
        registerFunction("isNumber", params("value"), args -> Value.bool(args.get(0).isNumber()));

        registerFunction("isString", params("value"),
                args -> Value.bool(args.get(0).getType() == Value.Type.STRING));

        registerFunction("isList", params("value"),
                args -> Value.bool(args.get(0).getType() == Value.Type.LIST));

        registerFunction("isFunction", params("value"), args -> Value.bool(args.get(0).isCallable()));

        // Mutates the list in place; every variable holding it sees the new element.
        registerFunction("append", params("list", "value"), args -> {
            Value list = requireList("append", args.get(0));
            list.asList().add(args.get(1));
            return list;
        });

        registerFunction("pop", params("list", "index"), args -> {
            List<Value> elements = requireList("pop", args.get(0)).asList();
            Value idx = args.get(1);
            if (!idx.isInteger()) {
                throw new IllegalArgumentException("pop() index must be an integer");
            }
            long i = idx.asLong();
            if (i < 0 || i >= elements.size()) {
                throw new IllegalArgumentException(
                        "Element at this index could not be removed from list because index is out of bounds");
            }
            return elements.remove((int) i);
        });

        registerFunction("extend", params("listA", "listB"), args -> {
            Value a = requireList("extend", args.get(0));
            Value b = requireList("extend", args.get(1));
            a.asList().addAll(new ArrayList<>(b.asList()));
            return a;
        });

        registerFunction("len", params("value"), args -> {
            Value v = args.get(0);
            switch (v.getType()) {
                case STRING: return Value.integer(v.asString().length());
                case LIST:   return Value.integer(v.asList().size());
                default: throw new IllegalArgumentException("len() not supported for type: " + v.typeName());
            }
        });

        registerFunction("typeOf", params("value"), args -> Value.string(args.get(0).typeName()));
    }

    private static Value requireList(String fn, Value v) {
        if (v.getType() != Value.Type.LIST) {
            throw new IllegalArgumentException(fn + "() expects a list, got " + v.typeName());
        }
        return v;
    }

    private static List<String> params(String... names) {
        return Arrays.asList(names);
    }
}
