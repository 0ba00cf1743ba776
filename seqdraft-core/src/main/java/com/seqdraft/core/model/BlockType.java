package com.seqdraft.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Control structure types.
 *
 * <p>{@code loop}, {@code opt}, {@code break} and {@code rect} have a single body.
 * {@code alt}, {@code par} and {@code critical} may have further branches introduced by
 * their separator keyword ({@code else}, {@code and}, {@code option}).
 */
public enum BlockType {
    LOOP("loop", null, StatementKind.LOOP),
    ALT("alt", "else", StatementKind.ALT),
    OPT("opt", null, StatementKind.OPT),
    PAR("par", "and", StatementKind.PAR),
    CRITICAL("critical", "option", StatementKind.CRITICAL),
    BREAK("break", null, StatementKind.BREAK),
    RECT("rect", null, StatementKind.RECT);

    private final String keyword;
    private final String separator;
    private final StatementKind statementKind;

    BlockType(String keyword, String separator, StatementKind statementKind) {
        this.keyword = keyword;
        this.separator = separator;
        this.statementKind = statementKind;
    }

    /**
     * Returns the opening keyword.
     *
     * @return keyword such as {@code loop}
     */
    public String keyword() {
        return keyword;
    }

    /**
     * Returns the keyword that starts a further branch.
     *
     * @return separator keyword, or null for single-body blocks
     */
    public String separator() {
        return separator;
    }

    /**
     * Whether this block type may carry more than one branch.
     *
     * @return true for alt, par and critical
     */
    public boolean isMultiBranch() {
        return separator != null;
    }

    public StatementKind statementKind() {
        return statementKind;
    }

    /**
     * Looks up a block type by its opening keyword.
     *
     * @param keyword opening keyword
     * @return matching type, or empty if unknown
     */
    public static Optional<BlockType> fromKeyword(String keyword) {
        return Arrays.stream(values())
            .filter(type -> type.keyword.equals(keyword))
            .findFirst();
    }
}
