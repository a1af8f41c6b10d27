package com.basic.script.parser;

import java.util.ArrayList;
import java.util.List;

import com.basic.debug.Debug;
import com.basic.debug.DebugLevel;
import com.basic.script.parser.Expr.BinOp;
import com.basic.script.parser.Expr.Call;
import com.basic.script.parser.Expr.Case;
import com.basic.script.parser.Expr.ExprInterface;
import com.basic.script.parser.Expr.ExprVisitor;
import com.basic.script.parser.Expr.For;
import com.basic.script.parser.Expr.FuncDef;
import com.basic.script.parser.Expr.If;
import com.basic.script.parser.Expr.ListLiteral;
import com.basic.script.parser.Expr.NumberLiteral;
import com.basic.script.parser.Expr.StringLiteral;
import com.basic.script.parser.Expr.UnaryOp;
import com.basic.script.parser.Expr.VarAccess;
import com.basic.script.parser.Expr.VarAssign;
import com.basic.script.parser.Expr.While;

/**
 * Tree-walking evaluator.
 *
 * {@code env} and {@code frame} are the active scope and call frame; function calls swap
 * them for the duration of the body. Every value a visit method returns is tagged with
 * the node's span and the active frame.
 */
public class Interpreter implements ExprVisitor<Value> {
    private static final String TAG = "basic.interp";

    Environment env;
    CallFrame frame;

    public Interpreter(Environment env, CallFrame frame) {
        this.env = env;
        this.frame = frame;
    }

    public Value evaluate(ExprInterface expr) {
        return expr.accept(this);
    }

    private Value tag(Value value, ExprInterface node) {
        return value.setPos(node.posStart(), node.posEnd()).setFrame(frame);
    }

    // -------------------------
    // Literals
    // -------------------------

    @Override
    public Value visitNumberExpr(NumberLiteral expr) {
        String text = expr.token.value;
        Value out;
        if (expr.isInteger()) {
            try {
                out = Value.integer(Long.parseLong(text));
            } catch (NumberFormatException e) {
                throw new RTError(RTError.Kind.ILLEGAL_OPERATION, expr.posStart(), expr.posEnd(),
                        "Integer literal out of range: " + text, frame);
            }
        } else {
            out = Value.number(Double.parseDouble(text));
        }
        return tag(out, expr);
    }

    @Override
    public Value visitStringExpr(StringLiteral expr) {
        return tag(Value.string(expr.token.value), expr);
    }

    @Override
    public Value visitListExpr(ListLiteral expr) {
        List<Value> elements = new ArrayList<>(expr.elements.size());
        for (ExprInterface e : expr.elements) elements.add(evaluate(e));
        return tag(Value.list(elements), expr);
    }

    // -------------------------
    // Variables
    // -------------------------

    @Override
    public Value visitVarAccessExpr(VarAccess expr) {
        String name = expr.name.value;
        Value value = env.get(name);
        if (value == null) {
            throw new RTError(RTError.Kind.UNDEFINED_VARIABLE, expr.posStart(), expr.posEnd(),
                    "\"" + name + "\" is not defined", frame);
        }
        // Copy so re-tagging this use never touches the stored value.
        return tag(value.copy(), expr);
    }

    @Override
    public Value visitVarAssignExpr(VarAssign expr) {
        Value value = evaluate(expr.value);
        env.set(expr.name.value, value);
        return value;
    }

    // -------------------------
    // Operators
    // -------------------------

    @Override
    public Value visitUnaryExpr(UnaryOp expr) {
        Value operand = evaluate(expr.operand);
        Value out;
        if (expr.operator.type == TokenType.MINUS) {
            out = Operators.negate(operand, expr.operator, frame);
        } else if (expr.operator.matches(TokenType.KEYWORD, "!")) {
            out = Operators.not(operand);
        } else {
            out = operand.copy(); // unary '+'
        }
        return tag(out, expr);
    }

    @Override
    public Value visitBinaryExpr(BinOp expr) {
        Value left = evaluate(expr.left);
        Value right = evaluate(expr.right);
        return tag(Operators.binary(expr.operator, left, right, frame), expr);
    }

    // -------------------------
    // Control flow
    // -------------------------

    @Override
    public Value visitIfExpr(If expr) {
        for (Case c : expr.cases) {
            Value condition = evaluate(c.condition);
            if (condition.isTrue()) {
                return tag(evaluate(c.body).copy(), expr);
            }
        }
        if (expr.elseCase != null) {
            return tag(evaluate(expr.elseCase).copy(), expr);
        }
        return tag(Value.nil(), expr);
    }

    /**
     * The loop variable lives in the current scope and keeps its last value after the
     * loop ends (the first value that failed the bound check). An int counter whose next
     * step would overflow ends the loop at the last value it reached.
     */
    @Override
    public Value visitForExpr(For expr) {
        Value start = requireNumber(evaluate(expr.start), "start");
        Value end = requireNumber(evaluate(expr.end), "end");
        Value step = (expr.step != null)
                ? requireNumber(evaluate(expr.step), "step")
                : Value.integer(1);

        String name = expr.varName.value;
        double bound = end.asNumber();
        List<Value> elements = new ArrayList<>();

        if (start.isInteger() && step.isInteger()) {
            long i = start.asLong();
            long inc = step.asLong();
            while (true) {
                env.set(name, counter(Value.integer(i), expr));
                if (inc >= 0 ? !(i < bound) : !(i > bound)) break;
                elements.add(evaluate(expr.body));
                try {
                    i = Math.addExact(i, inc);
                } catch (ArithmeticException overflow) {
                    break; // next counter value is outside the long range
                }
            }
        } else {
            double i = start.asNumber();
            double inc = step.asNumber();
            while (true) {
                env.set(name, counter(Value.number(i), expr));
                if (inc >= 0 ? !(i < bound) : !(i > bound)) break;
                elements.add(evaluate(expr.body));
                i += inc;
            }
        }

        return tag(Value.list(elements), expr);
    }

    private Value counter(Value v, For expr) {
        return v.setPos(expr.varName.posStart, expr.varName.posEnd).setFrame(frame);
    }

    private Value requireNumber(Value v, String role) {
        if (!v.isNumber()) {
            throw new RTError(RTError.Kind.ILLEGAL_OPERATION, v.posStart(), v.posEnd(),
                    "For loop " + role + " must be a number, got " + v.typeName(), frame);
        }
        return v;
    }

    @Override
    public Value visitWhileExpr(While expr) {
        List<Value> elements = new ArrayList<>();
        while (evaluate(expr.condition).isTrue()) {
            elements.add(evaluate(expr.body));
        }
        return tag(Value.list(elements), expr);
    }

    // -------------------------
    // Functions
    // -------------------------

    @Override
    public Value visitFuncDefExpr(FuncDef expr) {
        String name = (expr.name != null) ? expr.name.value : null;
        List<String> params = new ArrayList<>(expr.params.size());
        for (Token t : expr.params) params.add(t.value);

        Value fn = tag(Value.func(new UserFunction(name, params, expr.body, env)), expr);
        if (name != null) {
            env.set(name, fn);
        }
        return fn;
    }

    @Override
    public Value visitCallExpr(Call expr) {
        Value callee = evaluate(expr.callee);
        if (!callee.isCallable()) {
            throw new RTError(RTError.Kind.ILLEGAL_OPERATION, callee.posStart(), callee.posEnd(),
                    "Illegal operation: " + callee.typeName() + " is not callable", frame);
        }
        callee = tag(callee.copy(), expr);

        List<Value> args = new ArrayList<>(expr.arguments.size());
        for (ExprInterface a : expr.arguments) args.add(evaluate(a));

        Debug dbg = Debug.get();
        if (dbg.isEnabled(DebugLevel.TRACE)) {
            dbg.t(TAG, "call " + callee.functionName() + "/" + args.size() + " depth=" + (frame.depth() + 1));
        }

        Value result = (callee.type == Value.Type.FUNC)
                ? callee.asFunc().call(this, args, callee)
                : callee.asBuiltin().call(this, args, callee);
        return tag(result.copy(), expr);
    }
}
