package com.seqdraft.core.parser;

/**
 * Categories of lines the parser skipped while continuing the parse.
 */
public enum WarningType {
    /** No statement form matched the line. */
    UNRECOGNIZED_LINE,
    /** The line looks like a message but the arrow split or the ids are invalid. */
    MALFORMED_MESSAGE,
    /** A note names the wrong number of participants for its position. */
    NOTE_CARDINALITY,
    /** A participant id was declared twice; the first declaration is kept. */
    DUPLICATE_PARTICIPANT,
    /** A {@code link}/{@code links} line names a participant that was never declared. */
    UNKNOWN_PARTICIPANT,
    /** The JSON object of a {@code links} line could not be read. */
    INVALID_LINKS,
    /** An {@code else}/{@code and}/{@code option} outside the block type it belongs to. */
    MISPLACED_SEPARATOR,
    /** A {@code %%{...}%%} directive whose settings could not be read; the line itself is kept. */
    INVALID_DIRECTIVE
}
