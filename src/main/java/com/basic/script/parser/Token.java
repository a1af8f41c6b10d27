package com.basic.script.parser;

public class Token {
    final TokenType type;
    public final String value;
    public final Position posStart;
    public final Position posEnd;

    Token(TokenType type, String value, Position posStart, Position posEnd) {
        this.type = type;
        this.value = value;
        this.posStart = posStart.copy();
        this.posEnd = (posEnd != null) ? posEnd.copy() : posStart.copy().advance('\0');
    }

    public TokenType type() { return type; }

    public boolean matches(TokenType type, String value) {
        return this.type == type && value.equals(this.value);
    }

    @Override
    public String toString() {
        return (value != null) ? type + ":" + value : type.toString();
    }
}
