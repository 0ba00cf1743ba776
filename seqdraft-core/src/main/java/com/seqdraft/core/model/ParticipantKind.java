package com.seqdraft.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Kinds of participant columns in a sequence diagram.
 */
public enum ParticipantKind {
    /** Rectangular participant box */
    PARTICIPANT("participant"),

    /** Stick-figure actor */
    ACTOR("actor");

    private final String keyword;

    ParticipantKind(String keyword) {
        this.keyword = keyword;
    }

    /**
     * Returns the keyword used in the text notation.
     *
     * @return declaration keyword
     */
    public String keyword() {
        return keyword;
    }

    /**
     * Looks up a kind by its declaration keyword.
     *
     * @param keyword {@code participant} or {@code actor}
     * @return matching kind, or empty if the keyword is unknown
     */
    public static Optional<ParticipantKind> fromKeyword(String keyword) {
        return Arrays.stream(values())
            .filter(kind -> kind.keyword.equals(keyword))
            .findFirst();
    }
}
