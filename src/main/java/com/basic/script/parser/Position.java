package com.basic.script.parser;

/**
 * Cursor into a source text. Tokens and nodes hold copies taken with {@link #copy()},
 * so advancing the lexer cursor never moves a position already handed out.
 */
public final class Position {
    int index;
    int row;
    int col;
    final String sourceName;
    final String sourceText;

    public Position(int index, int row, int col, String sourceName, String sourceText) {
        this.index = index;
        this.row = row;
        this.col = col;
        this.sourceName = sourceName;
        this.sourceText = sourceText;
    }

    /** Step past {@code current}; a newline moves to column 0 of the next row. */
    public Position advance(char current) {
        index++;
        col++;
        if (current == '\n') {
            col = 0;
            row++;
        }
        return this;
    }

    public Position copy() {
        return new Position(index, row, col, sourceName, sourceText);
    }

    public int index() { return index; }
    public int row() { return row; }
    public int col() { return col; }
    public String sourceName() { return sourceName; }
    public String sourceText() { return sourceText; }

    @Override
    public String toString() {
        return sourceName + ":" + row + ":" + col;
    }
}
