package com.seqdraft.core.parser;

/**
 * A trimmed input line with its 1-based number.
 *
 * @param number line number
 * @param text trimmed text
 */
record SourceLine(int number, String text) {

    boolean isBlank() {
        return text.isEmpty();
    }

    boolean isComment() {
        return text.startsWith(LinePatterns.COMMENT_PREFIX);
    }
}
