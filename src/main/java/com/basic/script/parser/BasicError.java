package com.basic.script.parser;

/**
 * Base of every error the pipeline raises. Each one is terminal for the current
 * top-level run and carries the source span it points at.
 */
public abstract class BasicError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final String errorName;
    private final Position posStart;
    private final Position posEnd;
    private final String details;

    protected BasicError(String errorName, Position posStart, Position posEnd, String details) {
        super(details);
        this.errorName = errorName;
        this.posStart = posStart;
        this.posEnd = posEnd;
        this.details = details;
    }

    public String errorName() { return errorName; }
    public Position posStart() { return posStart; }
    public Position posEnd() { return posEnd; }
    public String details() { return details; }

    /** Printable form shown by the REPL. */
    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append(errorName).append(": '").append(details).append("'\n");
        sb.append("\tFile: '").append(posStart.sourceName)
                .append("' row(").append(posStart.row)
                .append("), col(").append(posStart.col).append(")\n\n");
        sb.append(SourceArrows.underline(posStart.sourceText, posStart, posEnd));
        sb.append('\n');
        return sb.toString();
    }

    @Override
    public String toString() {
        return format();
    }
}
