package com.seqdraft.core.model;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * The ten message arrow styles of the text notation.
 *
 * <p>Tokens are not prefix-disjoint ({@code ->>} contains {@code ->}, {@code -->>} contains both
 * {@code -->} and {@code ->>}), so matchers must try them through {@link #longestFirst()}.
 */
public enum ArrowKind {
    /** Solid line without arrowhead */
    PLAIN_SOLID("->"),

    /** Dashed line without arrowhead */
    PLAIN_DASHED("-->"),

    /** Solid line with arrowhead */
    SOLID_ARROW("->>"),

    /** Dashed line with arrowhead */
    DASHED_ARROW("-->>"),

    /** Solid line with arrowheads on both ends */
    SOLID_BOTH_ENDS("<<->>"),

    /** Dashed line with arrowheads on both ends */
    DASHED_BOTH_ENDS("<<-->>"),

    /** Solid line with open (async) arrowhead */
    SOLID_ASYNC("-)"),

    /** Dashed line with open (async) arrowhead */
    DASHED_ASYNC("--))"),

    /** Solid line ending in a cross */
    SOLID_CROSS("-x"),

    /** Dashed line ending in a cross */
    DASHED_CROSS("--x");

    private static final List<ArrowKind> LONGEST_FIRST = Arrays.stream(values())
        .sorted(Comparator.comparingInt((ArrowKind kind) -> kind.token.length()).reversed())
        .toList();

    private final String token;

    ArrowKind(String token) {
        this.token = token;
    }

    /**
     * Returns the arrow token as written in the text notation.
     *
     * @return arrow token
     */
    public String token() {
        return token;
    }

    /**
     * Returns all arrow kinds ordered by descending token length.
     *
     * <p>Kinds of equal length keep declaration order, which orders {@code ->}, {@code -)}
     * and {@code -x} so a deactivated receiver such as {@code A->-xray} is
     * split on the plain arrow.
     *
     * @return arrow kinds, longest token first
     */
    public static List<ArrowKind> longestFirst() {
        return LONGEST_FIRST;
    }

    /**
     * Looks up an arrow kind by its exact token.
     *
     * @param token arrow token
     * @return matching kind, or empty if the token is not one of the ten arrows
     */
    public static Optional<ArrowKind> fromToken(String token) {
        return Arrays.stream(values())
            .filter(kind -> kind.token.equals(token))
            .findFirst();
    }
}
