package com.basic.script.parser;

/**
 * Runtime failure. Carries the call frame that was active when it was raised so the
 * formatted message can print a traceback.
 */
public class RTError extends BasicError {
    private static final long serialVersionUID = 1L;

    public enum Kind {
        UNDEFINED_VARIABLE,
        DIVISION_BY_ZERO,
        ILLEGAL_OPERATION,
        ARITY_MISMATCH
    }

    private final Kind kind;
    private final transient CallFrame frame;

    public RTError(Kind kind, Position posStart, Position posEnd, String details, CallFrame frame) {
        super("Runtime Error", posStart, posEnd, details);
        this.kind = kind;
        this.frame = frame;
    }

    public Kind kind() { return kind; }
    public CallFrame frame() { return frame; }

    @Override
    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append(traceback());
        sb.append(errorName()).append(": '").append(details()).append("'\n");
        sb.append(SourceArrows.underline(posStart().sourceText, posStart(), posEnd()));
        sb.append('\n');
        return sb.toString();
    }

    /** Innermost frame first; each outer frame is reported at the position it was entered from. */
    public String traceback() {
        StringBuilder sb = new StringBuilder("Traceback (most recent call last):\n");
        Position pos = posStart();
        CallFrame ctx = frame;
        while (ctx != null) {
            sb.append("\tFile: '").append(pos == null ? "?" : pos.sourceName)
                    .append("' row(").append(pos == null ? 0 : pos.row)
                    .append("), col(").append(pos == null ? 0 : pos.col)
                    .append("), in ").append(ctx.name).append('\n');
            pos = ctx.entryPos;
            ctx = ctx.parent;
        }
        return sb.toString();
    }
}
