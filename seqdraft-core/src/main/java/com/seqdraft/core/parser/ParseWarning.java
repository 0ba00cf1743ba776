package com.seqdraft.core.parser;

import java.util.Objects;

/**
 * A skipped line.
 *
 * @param lineNumber 1-based line number
 * @param line trimmed line text
 * @param type warning category
 * @param message human-readable description
 */
public record ParseWarning(
    int lineNumber,
    String line,
    WarningType type,
    String message
) {
    /**
     * Compact constructor with validation.
     */
    public ParseWarning {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(message, "message must not be null");
        if (line == null) {
            line = "";
        }
    }

    @Override
    public String toString() {
        return "line " + lineNumber + ": " + message + " [" + type + "]";
    }
}
