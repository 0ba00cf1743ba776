package com.seqdraft.core.parser;

import com.seqdraft.core.model.ArrowKind;

import java.util.Optional;

/**
 * Finds the arrow token of a message line.
 *
 * <p>Arrow tokens are not prefix-disjoint: {@code ->>} contains {@code ->} and {@code -->>}
 * contains both {@code -->} and {@code ->>}. Tokens are therefore tried longest first and the
 * first one found wins. The winning token must split the text into exactly two parts.
 */
public final class ArrowMatcher {

    private ArrowMatcher() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Text split around its arrow.
     *
     * @param arrowKind matched arrow
     * @param left text before the arrow (sender plus optional shorthand), untrimmed
     * @param right text after the arrow (optional shorthand plus receiver), untrimmed
     */
    public record ArrowSplit(ArrowKind arrowKind, String left, String right) {
    }

    /**
     * Returns the longest arrow token contained in the text.
     *
     * @param text message head (the part before the first colon)
     * @return matched arrow kind, empty when the text holds no arrow
     */
    public static Optional<ArrowKind> find(String text) {
        for (ArrowKind kind : ArrowKind.longestFirst()) {
            if (text.contains(kind.token())) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    /**
     * Splits the text around the given arrow.
     *
     * @param text message head
     * @param kind arrow kind found by {@link #find(String)}
     * @return the split, empty when the token does not occur exactly once
     */
    public static Optional<ArrowSplit> split(String text, ArrowKind kind) {
        String token = kind.token();
        int index = text.indexOf(token);
        if (index < 0 || text.indexOf(token, index + token.length()) >= 0) {
            return Optional.empty();
        }
        return Optional.of(new ArrowSplit(kind, text.substring(0, index), text.substring(index + token.length())));
    }
}
