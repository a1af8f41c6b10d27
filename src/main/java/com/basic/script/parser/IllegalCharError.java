package com.basic.script.parser;

public class IllegalCharError extends BasicError {
    private static final long serialVersionUID = 1L;

    public IllegalCharError(Position posStart, Position posEnd, String details) {
        super("Illegal Character", posStart, posEnd, details);
    }
}
