package com.basic.script.parser;

public enum TokenType {
    INT,
    FLOAT,
    STRING,
    IDENTIFIER,
    KEYWORD,
    PLUS,
    MINUS,
    MUL,
    DIV,
    POW,
    EQ,
    LPAREN,
    RPAREN,
    LSQUARE,
    RSQUARE,
    EE,
    NE,
    LT,
    GT,
    LTE,
    GTE,
    COMMA,
    ARROW,
    EOF
}
