package com.basic.script.parser;

import java.util.Collections;
import java.util.List;

public class Expr {

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);
        Position posStart();
        Position posEnd();
    }

    /** Closed set of node kinds: a new node type needs a new visit method here. */
    public interface ExprVisitor<R> {
        R visitNumberExpr(NumberLiteral expr);
        R visitStringExpr(StringLiteral expr);
        R visitListExpr(ListLiteral expr);
        R visitVarAccessExpr(VarAccess expr);
        R visitVarAssignExpr(VarAssign expr);
        R visitUnaryExpr(UnaryOp expr);
        R visitBinaryExpr(BinOp expr);
        R visitIfExpr(If expr);
        R visitForExpr(For expr);
        R visitWhileExpr(While expr);
        R visitFuncDefExpr(FuncDef expr);
        R visitCallExpr(Call expr);
    }

    abstract static class Node implements ExprInterface {
        private final Position posStart;
        private final Position posEnd;

        Node(Position posStart, Position posEnd) {
            this.posStart = posStart;
            this.posEnd = posEnd;
        }

        @Override public Position posStart() { return posStart; }
        @Override public Position posEnd() { return posEnd; }
    }

    // -------------------------
    // Literals
    // -------------------------

    public static final class NumberLiteral extends Node {
        public final Token token;

        public NumberLiteral(Token token) {
            super(token.posStart, token.posEnd);
            this.token = token;
        }

        public boolean isInteger() { return token.type == TokenType.INT; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitNumberExpr(this);
        }
    }

    public static final class StringLiteral extends Node {
        public final Token token;

        public StringLiteral(Token token) {
            super(token.posStart, token.posEnd);
            this.token = token;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitStringExpr(this);
        }
    }

    public static final class ListLiteral extends Node {
        public final List<ExprInterface> elements;

        public ListLiteral(List<ExprInterface> elements, Position posStart, Position posEnd) {
            super(posStart, posEnd);
            this.elements = Collections.unmodifiableList(elements);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitListExpr(this);
        }
    }

    // -------------------------
    // Variables
    // -------------------------

    public static final class VarAccess extends Node {
        public final Token name;

        public VarAccess(Token name) {
            super(name.posStart, name.posEnd);
            this.name = name;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitVarAccessExpr(this);
        }
    }

    public static final class VarAssign extends Node {
        public final Token name;
        public final ExprInterface value;

        public VarAssign(Token name, ExprInterface value) {
            super(name.posStart, value.posEnd());
            this.name = name;
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitVarAssignExpr(this);
        }
    }

    // -------------------------
    // Operators
    // -------------------------

    public static final class UnaryOp extends Node {
        public final Token operator;
        public final ExprInterface operand;

        public UnaryOp(Token operator, ExprInterface operand) {
            super(operator.posStart, operand.posEnd());
            this.operator = operator;
            this.operand = operand;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnaryExpr(this);
        }
    }

    public static final class BinOp extends Node {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public BinOp(ExprInterface left, Token operator, ExprInterface right) {
            super(left.posStart(), right.posEnd());
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinaryExpr(this);
        }
    }

    // -------------------------
    // Control flow
    // -------------------------

    /** One {@code if}/{@code elif} arm. */
    public static final class Case {
        public final ExprInterface condition;
        public final ExprInterface body;

        public Case(ExprInterface condition, ExprInterface body) {
            this.condition = condition;
            this.body = body;
        }
    }

    public static final class If extends Node {
        public final List<Case> cases;
        public final ExprInterface elseCase; // may be null

        public If(List<Case> cases, ExprInterface elseCase, Position posStart, Position posEnd) {
            super(posStart, posEnd);
            this.cases = Collections.unmodifiableList(cases);
            this.elseCase = elseCase;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIfExpr(this);
        }
    }

    public static final class For extends Node {
        public final Token varName;
        public final ExprInterface start;
        public final ExprInterface end;
        public final ExprInterface step; // may be null
        public final ExprInterface body;

        public For(Token varName, ExprInterface start, ExprInterface end, ExprInterface step,
                   ExprInterface body, Position posStart) {
            super(posStart, body.posEnd());
            this.varName = varName;
            this.start = start;
            this.end = end;
            this.step = step;
            this.body = body;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitForExpr(this);
        }
    }

    public static final class While extends Node {
        public final ExprInterface condition;
        public final ExprInterface body;

        public While(ExprInterface condition, ExprInterface body, Position posStart) {
            super(posStart, body.posEnd());
            this.condition = condition;
            this.body = body;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitWhileExpr(this);
        }
    }

    // -------------------------
    // Functions
    // -------------------------

    public static final class FuncDef extends Node {
        public final Token name; // null for anonymous functions
        public final List<Token> params;
        public final ExprInterface body;

        public FuncDef(Token name, List<Token> params, ExprInterface body, Position posStart) {
            super(posStart, body.posEnd());
            this.name = name;
            this.params = Collections.unmodifiableList(params);
            this.body = body;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitFuncDefExpr(this);
        }
    }

    public static final class Call extends Node {
        public final ExprInterface callee;
        public final List<ExprInterface> arguments;

        public Call(ExprInterface callee, List<ExprInterface> arguments, Position posEnd) {
            super(callee.posStart(), posEnd);
            this.callee = callee;
            this.arguments = Collections.unmodifiableList(arguments);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCallExpr(this);
        }
    }
}
