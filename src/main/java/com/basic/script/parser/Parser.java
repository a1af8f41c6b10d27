package com.basic.script.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import java.util.function.Supplier;

import com.basic.script.parser.Expr.BinOp;
import com.basic.script.parser.Expr.Call;
import com.basic.script.parser.Expr.Case;
import com.basic.script.parser.Expr.ExprInterface;
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
 * Recursive-descent parser with one token of lookahead.
 *
 * Every precedence tier goes through {@link #binOp}. When a rule fails before consuming
 * any token, the caller's broader "Expected ..." message replaces the error; once tokens
 * have been consumed the deeper error is kept.
 */
public class Parser {
    static final String EXPECTED_EXPR =
            "Expected 'var', 'if', 'for', 'while', 'fun', int, float, identifier, '+', '-', '(', '[' or '!'";
    static final String EXPECTED_COMP =
            "Expected int, float, identifier, '+', '-', '(', '[', 'if', 'for', 'while', 'fun' or '!'";
    static final String EXPECTED_ATOM =
            "Expected int, float, identifier, '+', '-', '(', '[', 'if', 'for', 'while', 'fun'";
    static final String EXPECTED_OPERATOR =
            "Expected '+', '-', '*', '/', '**', '==', '!=', '<', '>', '<=', '>=', '&&' or '||'";

    private static final Predicate<Token> LOGICAL_OPS = keywords("&&", "||");
    private static final Predicate<Token> COMPARISON_OPS =
            types(TokenType.EE, TokenType.NE, TokenType.LT, TokenType.GT, TokenType.LTE, TokenType.GTE);
    private static final Predicate<Token> ADDITIVE_OPS = types(TokenType.PLUS, TokenType.MINUS);
    private static final Predicate<Token> MULTIPLICATIVE_OPS = types(TokenType.MUL, TokenType.DIV);
    private static final Predicate<Token> POWER_OPS = types(TokenType.POW);

    private final List<Token> tokens;
    private int current = 0;

    public Parser(List<Token> tokens) { this.tokens = tokens; }

    /** Parses one expression and requires the whole token stream to be consumed. */
    public ExprInterface parse() {
        ExprInterface expr = expression();
        if (!check(TokenType.EOF)) {
            throw error(peek(), EXPECTED_OPERATOR);
        }
        return expr;
    }

    // expr := 'var' IDENT '=' expr | comp_expr (('&&'|'||') comp_expr)*
    private ExprInterface expression() {
        if (checkKeyword("var")) {
            advance();
            Token name = consume(TokenType.IDENTIFIER, "Expected identifier");
            consume(TokenType.EQ, "Expected '='");
            ExprInterface value = expression();
            return new VarAssign(name, value);
        }
        return expected(EXPECTED_EXPR, () -> binOp(this::comparison, LOGICAL_OPS, this::comparison));
    }

    // comp_expr := '!' comp_expr | arith_expr ((EE|NE|LT|GT|LTE|GTE) arith_expr)*
    private ExprInterface comparison() {
        if (checkKeyword("!")) {
            Token op = advance();
            ExprInterface operand = comparison();
            return new UnaryOp(op, operand);
        }
        return expected(EXPECTED_COMP, () -> binOp(this::arithmetic, COMPARISON_OPS, this::arithmetic));
    }

    private ExprInterface arithmetic() {
        return binOp(this::term, ADDITIVE_OPS, this::term);
    }

    private ExprInterface term() {
        return binOp(this::factor, MULTIPLICATIVE_OPS, this::factor);
    }

    private ExprInterface factor() {
        if (check(TokenType.PLUS) || check(TokenType.MINUS)) {
            Token op = advance();
            ExprInterface operand = factor();
            return new UnaryOp(op, operand);
        }
        return power();
    }

    // Right operand is a factor, so '2 ** -1' parses.
    private ExprInterface power() {
        return binOp(this::call, POWER_OPS, this::factor);
    }

    private ExprInterface call() {
        ExprInterface callee = atom();
        if (!match(TokenType.LPAREN)) return callee;

        List<ExprInterface> arguments = new ArrayList<>();
        if (!check(TokenType.RPAREN)) {
            arguments.add(expected(
                    "Expected ')', 'var', 'if', 'for', 'while', 'fun', int, float, identifier, '+', '-', '(', '[' or '!'",
                    this::expression));
            while (match(TokenType.COMMA)) {
                arguments.add(expression());
            }
        }
        Token paren = consume(TokenType.RPAREN, "Expected ',' or ')'");
        return new Call(callee, arguments, paren.posEnd);
    }

    private ExprInterface atom() {
        Token token = peek();

        switch (token.type) {
            case INT:
            case FLOAT:
                advance();
                return new NumberLiteral(token);
            case STRING:
                advance();
                return new StringLiteral(token);
            case IDENTIFIER:
                advance();
                return new VarAccess(token);
            case LPAREN: {
                advance();
                ExprInterface expr = expression();
                consume(TokenType.RPAREN, "Expected ')'");
                return expr;
            }
            case LSQUARE:
                return listExpr();
            case KEYWORD:
                if (token.matches(TokenType.KEYWORD, "if")) return ifExpr();
                if (token.matches(TokenType.KEYWORD, "for")) return forExpr();
                if (token.matches(TokenType.KEYWORD, "while")) return whileExpr();
                if (token.matches(TokenType.KEYWORD, "fun")) return funcDef();
                break;
            default:
                break;
        }
        throw error(token, EXPECTED_ATOM);
    }

    private ExprInterface listExpr() {
        Token open = consume(TokenType.LSQUARE, "Expected '['");
        List<ExprInterface> elements = new ArrayList<>();

        if (!check(TokenType.RSQUARE)) {
            elements.add(expected(
                    "Expected ']', 'var', 'if', 'for', 'while', 'fun', int, float, identifier, '+', '-', '(', '[' or '!'",
                    this::expression));
            while (match(TokenType.COMMA)) {
                elements.add(expression());
            }
        }
        Token close = consume(TokenType.RSQUARE, "Expected ',' or ']'");
        return new ListLiteral(elements, open.posStart, close.posEnd);
    }

    private ExprInterface ifExpr() {
        Token keyword = consumeKeyword("if");
        List<Case> cases = new ArrayList<>();

        ExprInterface condition = expression();
        consumeKeyword("then");
        cases.add(new Case(condition, expression()));

        while (matchKeyword("elif")) {
            ExprInterface elifCondition = expression();
            consumeKeyword("then");
            cases.add(new Case(elifCondition, expression()));
        }

        ExprInterface elseCase = null;
        if (matchKeyword("else")) {
            elseCase = expression();
        }

        Position end = (elseCase != null) ? elseCase.posEnd() : cases.get(cases.size() - 1).body.posEnd();
        return new If(cases, elseCase, keyword.posStart, end);
    }

    private ExprInterface forExpr() {
        Token keyword = consumeKeyword("for");
        Token varName = consume(TokenType.IDENTIFIER, "Expected identifier");
        consume(TokenType.EQ, "Expected '='");
        ExprInterface start = expression();
        consumeKeyword("to");
        ExprInterface end = expression();

        ExprInterface step = null;
        if (matchKeyword("step")) {
            step = expression();
        }

        consumeKeyword("then");
        ExprInterface body = expression();
        return new For(varName, start, end, step, body, keyword.posStart);
    }

    private ExprInterface whileExpr() {
        Token keyword = consumeKeyword("while");
        ExprInterface condition = expression();
        consumeKeyword("then");
        ExprInterface body = expression();
        return new While(condition, body, keyword.posStart);
    }

    private ExprInterface funcDef() {
        Token keyword = consumeKeyword("fun");

        Token name = null;
        if (check(TokenType.IDENTIFIER)) {
            name = advance();
            consume(TokenType.LPAREN, "Expected '('");
        } else {
            consume(TokenType.LPAREN, "Expected identifier or '('");
        }

        List<Token> params = new ArrayList<>();
        if (check(TokenType.IDENTIFIER)) {
            params.add(advance());
            while (match(TokenType.COMMA)) {
                params.add(consume(TokenType.IDENTIFIER, "Expected identifier"));
            }
            consume(TokenType.RPAREN, "Expected ',' or ')'");
        } else {
            consume(TokenType.RPAREN, "Expected identifier or ')'");
        }

        consume(TokenType.ARROW, "Expected '->'");
        ExprInterface body = expression();
        return new FuncDef(name, params, body, keyword.posStart);
    }

    /**
     * Left-associative binary operator tier: {@code left (op right)*}.
     */
    private ExprInterface binOp(Supplier<ExprInterface> left, Predicate<Token> isOperator,
                                Supplier<ExprInterface> right) {
        ExprInterface expr = left.get();
        while (isOperator.test(peek())) {
            Token op = advance();
            ExprInterface rhs = right.get();
            expr = new BinOp(expr, op, rhs);
        }
        return expr;
    }

    /** Runs {@code rule}; if it fails without consuming a token, reports {@code message} instead. */
    private ExprInterface expected(String message, Supplier<ExprInterface> rule) {
        int checkpoint = current;
        try {
            return rule.get();
        } catch (InvalidSyntaxError e) {
            if (current == checkpoint) throw error(peek(), message);
            throw e;
        }
    }

    // -------------------------
    // Token helpers
    // -------------------------

    private static Predicate<Token> types(TokenType... types) {
        return token -> {
            for (TokenType t : types) {
                if (token.type == t) return true;
            }
            return false;
        };
    }

    private static Predicate<Token> keywords(String... words) {
        return token -> {
            for (String w : words) {
                if (token.matches(TokenType.KEYWORD, w)) return true;
            }
            return false;
        };
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean matchKeyword(String word) {
        if (checkKeyword(word)) {
            advance();
            return true;
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private Token consumeKeyword(String word) {
        if (checkKeyword(word)) return advance();
        throw error(peek(), "Expected '" + word + "'");
    }

    private boolean check(TokenType type) {
        return peek().type == type;
    }

    private boolean checkKeyword(String word) {
        return peek().matches(TokenType.KEYWORD, word);
    }

    private Token advance() {
        Token token = peek();
        if (token.type != TokenType.EOF) current++;
        return token;
    }

    private Token peek() { return tokens.get(current); }

    private InvalidSyntaxError error(Token token, String message) {
        return new InvalidSyntaxError(token.posStart, token.posEnd, message);
    }
}
