package com.seqdraft.core.model;

/**
 * Discriminator tag for every statement that can appear in a statement list.
 */
public enum StatementKind {
    MESSAGE,
    NOTE,
    ACTIVATION,
    CREATE,
    DESTROY,
    LOOP,
    ALT,
    OPT,
    PAR,
    CRITICAL,
    BREAK,
    RECT
}
