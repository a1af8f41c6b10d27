package com.basic.script.parser;

public class InvalidSyntaxError extends BasicError {
    private static final long serialVersionUID = 1L;

    public InvalidSyntaxError(Position posStart, Position posEnd, String details) {
        super("Invalid Syntax", posStart, posEnd, details);
    }
}
