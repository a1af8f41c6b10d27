package com.basic.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class Lexer {
    private final String text;
    private final Position pos;
    private final List<Token> tokens = new ArrayList<>();
    private char curChar;
    private boolean atEnd;

    private static final Set<String> KEYWORDS;
    static {
        Set<String> set = new HashSet<>();
        set.add("var");
        set.add("&&");
        set.add("||");
        set.add("!");
        set.add("if");
        set.add("then");
        set.add("elif");
        set.add("else");
        set.add("for");
        set.add("to");
        set.add("step");
        set.add("while");
        set.add("fun");
        KEYWORDS = Collections.unmodifiableSet(set);
    }

    public Lexer(String sourceName, String text) {
        this.text = (text == null) ? "" : text;
        this.pos = new Position(-1, 0, -1, sourceName, this.text);
        this.curChar = '\0';
        advance();
    }

    public static boolean isKeyword(String word) {
        return KEYWORDS.contains(word);
    }

    public List<Token> tokenize() {
        while (!atEnd) {
            scanToken();
        }
        tokens.add(new Token(TokenType.EOF, null, pos, null));
        return tokens;
    }

    private void scanToken() {
        char c = curChar;
        if (isDigit(c) || c == '.') {
            number();
            return;
        }
        if (isAlpha(c)) {
            identifier();
            return;
        }

        switch (c) {
            case ' ': case '\t': case '\n': case '\r':
                advance();
                break;
            case '+': single(TokenType.PLUS); break;
            case '/': single(TokenType.DIV); break;
            case '(': single(TokenType.LPAREN); break;
            case ')': single(TokenType.RPAREN); break;
            case '[': single(TokenType.LSQUARE); break;
            case ']': single(TokenType.RSQUARE); break;
            case ',': single(TokenType.COMMA); break;
            case '-': twoChar('>', TokenType.MINUS, TokenType.ARROW); break;
            case '*': twoChar('*', TokenType.MUL, TokenType.POW); break;
            case '=': twoChar('=', TokenType.EQ, TokenType.EE); break;
            case '<': twoChar('=', TokenType.LT, TokenType.LTE); break;
            case '>': twoChar('=', TokenType.GT, TokenType.GTE); break;
            case '!': notOrNotEquals(); break;
            case '&': doubled('&'); break;
            case '|': doubled('|'); break;
            case '"': string(); break;
            default: {
                Position start = pos.copy();
                advance();
                throw new IllegalCharError(start, pos, "'" + c + "'");
            }
        }
    }

    private void single(TokenType type) {
        Position start = pos.copy();
        advance();
        tokens.add(new Token(type, null, start, pos));
    }

    // '-' or '->', '*' or '**', '=' or '==', '<' or '<=', '>' or '>='
    private void twoChar(char second, TokenType oneType, TokenType twoType) {
        Position start = pos.copy();
        advance();
        TokenType type = oneType;
        if (match(second)) type = twoType;
        tokens.add(new Token(type, null, start, pos));
    }

    private void notOrNotEquals() {
        Position start = pos.copy();
        advance();
        if (match('=')) tokens.add(new Token(TokenType.NE, null, start, pos));
        else tokens.add(new Token(TokenType.KEYWORD, "!", start, pos));
    }

    // '&&' and '||' have no single-character form.
    private void doubled(char c) {
        Position start = pos.copy();
        advance();
        if (!match(c)) {
            throw new IllegalCharError(start, pos, "'" + c + "' (expected '" + c + c + "')");
        }
        tokens.add(new Token(TokenType.KEYWORD, "" + c + c, start, pos));
    }

    // A second '.' ends the literal without an error.
    private void number() {
        Position start = pos.copy();
        StringBuilder sb = new StringBuilder();
        boolean dot = false;
        while (!atEnd && (isDigit(curChar) || curChar == '.')) {
            if (curChar == '.') {
                if (dot) break;
                dot = true;
            }
            sb.append(curChar);
            advance();
        }
        String text = sb.toString();
        if (".".equals(text)) {
            throw new IllegalCharError(start, pos, "'.'");
        }
        tokens.add(new Token(dot ? TokenType.FLOAT : TokenType.INT, text, start, pos));
    }

    private void identifier() {
        Position start = pos.copy();
        StringBuilder sb = new StringBuilder();
        while (!atEnd && isAlphaNumeric(curChar)) {
            sb.append(curChar);
            advance();
        }
        String word = sb.toString();
        TokenType type = isKeyword(word) ? TokenType.KEYWORD : TokenType.IDENTIFIER;
        tokens.add(new Token(type, word, start, pos));
    }

    // An unterminated string runs to the end of input.
    private void string() {
        Position start = pos.copy();
        StringBuilder sb = new StringBuilder();
        boolean escape = false;
        advance();

        while (!atEnd && (curChar != '"' || escape)) {
            if (escape) {
                switch (curChar) {
                    case 'n': sb.append('\n'); break;
                    case 't': sb.append('\t'); break;
                    default: sb.append(curChar); break;
                }
                escape = false;
            } else if (curChar == '\\') {
                escape = true;
            } else {
                sb.append(curChar);
            }
            advance();
        }

        if (!atEnd) advance(); // closing quote
        tokens.add(new Token(TokenType.STRING, sb.toString(), start, pos));
    }

    private void advance() {
        pos.advance(curChar);
        if (pos.index < text.length()) {
            curChar = text.charAt(pos.index);
            atEnd = false;
        } else {
            curChar = '\0';
            atEnd = true;
        }
    }

    private boolean match(char expected) {
        if (atEnd || curChar != expected) return false;
        advance();
        return true;
    }

    private static boolean isDigit(char c) { return c >= '0' && c <= '9'; }
    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }
    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
