package com.seqdraft.core.parser;

/**
 * Structural error that aborts a parse: an unterminated block or box, an unmatched {@code end},
 * a box opened where boxes are not allowed, or content without the {@code sequenceDiagram} header.
 */
public class DiagramSyntaxException extends RuntimeException {

    private final int lineNumber;
    private final String line;

    /**
     * Creates a new syntax error.
     *
     * @param lineNumber 1-based number of the offending line
     * @param line offending line text
     * @param message description of the problem
     */
    public DiagramSyntaxException(int lineNumber, String line, String message) {
        super("Line " + lineNumber + ": " + message);
        this.lineNumber = lineNumber;
        this.line = line;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public String getLine() {
        return line;
    }
}
