package com.basic.script.parser;

/** Renders the offending source line(s) with a caret underline beneath the span. */
final class SourceArrows {

    private SourceArrows() {}

    static String underline(String text, Position posStart, Position posEnd) {
        if (text == null || posStart == null) return "";
        if (posEnd == null) posEnd = posStart;

        String[] lines = text.split("\n", -1);
        int lastRow = Math.max(posStart.row, posEnd.row);
        StringBuilder sb = new StringBuilder();

        for (int row = posStart.row; row <= lastRow && row < lines.length; row++) {
            String line = lines[row];
            int colStart = (row == posStart.row) ? posStart.col : 0;
            int colEnd = (row == posEnd.row) ? posEnd.col : line.length();
            int carets = Math.max(1, colEnd - colStart);

            if (sb.length() > 0) sb.append('\n');
            sb.append(line).append('\n');
            sb.append(" ".repeat(Math.max(0, colStart))).append("^".repeat(carets));
        }
        return sb.toString();
    }
}
