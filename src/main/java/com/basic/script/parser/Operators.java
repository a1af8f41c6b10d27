package com.basic.script.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Binary and unary operator semantics. Each operator switches on the left operand's
 * type; any pairing not handled there is an illegal operation.
 */
final class Operators {

    private Operators() {}

    static Value binary(Token op, Value left, Value right, CallFrame frame) {
        switch (op.type) {
            case PLUS:  return add(left, right, frame);
            case MINUS: return sub(left, right, frame);
            case MUL:   return mul(left, right, frame);
            case DIV:   return div(left, right, frame);
            case POW:   return pow(left, right, frame);
            case EE:
            case NE:
            case LT:
            case GT:
            case LTE:
            case GTE:
                return compare(op.type, left, right, frame);
            case KEYWORD:
                if (op.matches(TokenType.KEYWORD, "&&")) return and(left, right);
                if (op.matches(TokenType.KEYWORD, "||")) return or(left, right);
                break;
            default:
                break;
        }
        throw illegal(symbol(op.type, op.value), left, right, frame);
    }

    // -------------------------
    // Arithmetic
    // -------------------------

    static Value add(Value left, Value right, CallFrame frame) {
        switch (left.type) {
            case NUMBER:
                if (right.isNumber()) {
                    if (left.isInteger() && right.isInteger()) return Value.integer(left.asLong() + right.asLong());
                    return Value.number(left.asNumber() + right.asNumber());
                }
                break;
            case STRING:
                if (right.type == Value.Type.STRING || right.isNumber()) {
                    return Value.string(left.asString() + right.displayText());
                }
                break;
            case LIST: {
                List<Value> out = new ArrayList<>(left.asList());
                out.add(right);
                return Value.list(out);
            }
            default:
                break;
        }
        throw illegal("+", left, right, frame);
    }

    static Value sub(Value left, Value right, CallFrame frame) {
        switch (left.type) {
            case NUMBER:
                if (right.isNumber()) {
                    if (left.isInteger() && right.isInteger()) return Value.integer(left.asLong() - right.asLong());
                    return Value.number(left.asNumber() - right.asNumber());
                }
                break;
            case LIST:
                if (right.isInteger()) {
                    List<Value> out = new ArrayList<>(left.asList());
                    int index = checkIndex(out, right, frame,
                            "Element at this index could not be removed from list because index is out of bounds");
                    out.remove(index);
                    return Value.list(out);
                }
                break;
            default:
                break;
        }
        throw illegal("-", left, right, frame);
    }

    static Value mul(Value left, Value right, CallFrame frame) {
        switch (left.type) {
            case NUMBER:
                if (right.isNumber()) {
                    if (left.isInteger() && right.isInteger()) return Value.integer(left.asLong() * right.asLong());
                    return Value.number(left.asNumber() * right.asNumber());
                }
                break;
            case STRING:
                if (right.isInteger() && right.asLong() >= 0 && right.asLong() <= Integer.MAX_VALUE) {
                    return Value.string(left.asString().repeat((int) right.asLong()));
                }
                break;
            default:
                break;
        }
        throw illegal("*", left, right, frame);
    }

    static Value div(Value left, Value right, CallFrame frame) {
        switch (left.type) {
            case NUMBER:
                if (right.isNumber()) {
                    if (right.asNumber() == 0.0) {
                        throw new RTError(RTError.Kind.DIVISION_BY_ZERO, right.posStart, right.posEnd,
                                "Division by zero", frame);
                    }
                    if (left.isInteger() && right.isInteger() && left.asLong() % right.asLong() == 0) {
                        return Value.integer(left.asLong() / right.asLong());
                    }
                    return Value.number(left.asNumber() / right.asNumber());
                }
                break;
            case LIST:
                if (right.isInteger()) {
                    List<Value> elements = left.asList();
                    int index = checkIndex(elements, right, frame,
                            "Element at this index could not be retrieved from list because index is out of bounds");
                    return elements.get(index).copy();
                }
                break;
            default:
                break;
        }
        throw illegal("/", left, right, frame);
    }

    static Value pow(Value left, Value right, CallFrame frame) {
        if (left.isNumber() && right.isNumber()) {
            if (left.isInteger() && right.isInteger() && right.asLong() >= 0) {
                return Value.integer(longPow(left.asLong(), right.asLong()));
            }
            return Value.number(Math.pow(left.asNumber(), right.asNumber()));
        }
        throw illegal("**", left, right, frame);
    }

    // -------------------------
    // Comparison
    // -------------------------

    static Value compare(TokenType op, Value left, Value right, CallFrame frame) {
        boolean equality = (op == TokenType.EE || op == TokenType.NE);

        if (equality && (left.type == Value.Type.NULL || right.type == Value.Type.NULL)) {
            boolean same = left.type == right.type;
            return Value.bool(op == TokenType.EE ? same : !same);
        }

        switch (left.type) {
            case NUMBER:
                if (right.isNumber()) {
                    if (left.isInteger() && right.isInteger()) {
                        return Value.bool(test(op, Long.compare(left.asLong(), right.asLong())));
                    }
                    return Value.bool(testDoubles(op, left.asNumber(), right.asNumber()));
                }
                break;
            case STRING:
                if (right.type == Value.Type.STRING || right.isNumber()) {
                    return Value.bool(test(op, left.asString().compareTo(right.displayText())));
                }
                break;
            case BOOL:
                if (equality && right.type == Value.Type.BOOL) {
                    boolean same = left.asBool() == right.asBool();
                    return Value.bool(op == TokenType.EE ? same : !same);
                }
                break;
            case LIST:
                if (op == TokenType.GTE) return Value.bool(true);
                break;
            case FUNC:
            case BUILTIN:
                if (op == TokenType.GTE) {
                    throw new RTError(RTError.Kind.ILLEGAL_OPERATION, right.posStart, right.posEnd,
                            "Uncaught SyntaxError: Unexpected token '>='", frame);
                }
                break;
            default:
                break;
        }
        throw illegal(symbol(op, null), left, right, frame);
    }

    // -------------------------
    // Logical
    // -------------------------

    // Both operands are already evaluated; these only choose which one is the result.
    static Value and(Value left, Value right) {
        return left.isTrue() ? right.copy() : left.copy();
    }

    static Value or(Value left, Value right) {
        return left.isTrue() ? left.copy() : right.copy();
    }

    static Value not(Value operand) {
        return Value.bool(!operand.isTrue());
    }

    static Value negate(Value operand, Token op, CallFrame frame) {
        Value minusOne = Value.integer(-1).setPos(op.posStart, op.posEnd).setFrame(frame);
        return mul(operand, minusOne, frame);
    }

    // -------------------------
    // Helpers
    // -------------------------

    private static int checkIndex(List<Value> elements, Value index, CallFrame frame, String message) {
        long i = index.asLong();
        if (i < 0 || i >= elements.size()) {
            throw new RTError(RTError.Kind.ILLEGAL_OPERATION, index.posStart, index.posEnd, message, frame);
        }
        return (int) i;
    }

    private static boolean test(TokenType op, int c) {
        switch (op) {
            case EE:  return c == 0;
            case NE:  return c != 0;
            case LT:  return c < 0;
            case GT:  return c > 0;
            case LTE: return c <= 0;
            case GTE: return c >= 0;
            default:  throw new IllegalArgumentException("Not a comparison: " + op);
        }
    }

    // IEEE comparison: 0.0 == -0.0, NaN is unequal to everything.
    private static boolean testDoubles(TokenType op, double a, double b) {
        switch (op) {
            case EE:  return a == b;
            case NE:  return a != b;
            case LT:  return a < b;
            case GT:  return a > b;
            case LTE: return a <= b;
            case GTE: return a >= b;
            default:  throw new IllegalArgumentException("Not a comparison: " + op);
        }
    }

    private static long longPow(long base, long exp) {
        long result = 1;
        while (exp > 0) {
            if ((exp & 1) == 1) result *= base;
            base *= base;
            exp >>= 1;
        }
        return result;
    }

    private static RTError illegal(String op, Value left, Value right, CallFrame frame) {
        Position start = (left.posStart != null) ? left.posStart : right.posStart;
        Position end = (right.posEnd != null) ? right.posEnd : left.posEnd;
        return new RTError(RTError.Kind.ILLEGAL_OPERATION, start, end,
                "Illegal operation: " + left.typeName() + " " + op + " " + right.typeName(), frame);
    }

    private static String symbol(TokenType type, String value) {
        switch (type) {
            case PLUS:  return "+";
            case MINUS: return "-";
            case MUL:   return "*";
            case DIV:   return "/";
            case POW:   return "**";
            case EE:    return "==";
            case NE:    return "!=";
            case LT:    return "<";
            case GT:    return ">";
            case LTE:   return "<=";
            case GTE:   return ">=";
            default:    return (value != null) ? value : type.toString();
        }
    }
}
