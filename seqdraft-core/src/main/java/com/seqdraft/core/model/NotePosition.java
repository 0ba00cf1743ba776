package com.seqdraft.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Placement of a note relative to its participants.
 */
public enum NotePosition {
    /** Left of exactly one participant */
    LEFT_OF("left of", 1, 1),

    /** Right of exactly one participant */
    RIGHT_OF("right of", 1, 1),

    /** Spanning one or two participants */
    OVER("over", 1, 2);

    private final String keyword;
    private final int minTargets;
    private final int maxTargets;

    NotePosition(String keyword, int minTargets, int maxTargets) {
        this.keyword = keyword;
        this.minTargets = minTargets;
        this.maxTargets = maxTargets;
    }

    public String keyword() {
        return keyword;
    }

    /**
     * Checks whether a note at this position may reference the given number of participants.
     *
     * @param targetCount number of referenced participants
     * @return true if the cardinality is valid for this position
     */
    public boolean accepts(int targetCount) {
        return targetCount >= minTargets && targetCount <= maxTargets;
    }

    /**
     * Describes the accepted cardinality for error messages.
     *
     * @return e.g. "exactly 1" or "1 or 2"
     */
    public String describeCardinality() {
        return minTargets == maxTargets ? "exactly " + minTargets : minTargets + " or " + maxTargets;
    }

    /**
     * Looks up a position by its keyword.
     *
     * @param keyword {@code left of}, {@code right of} or {@code over}
     * @return matching position, or empty if unknown
     */
    public static Optional<NotePosition> fromKeyword(String keyword) {
        return Arrays.stream(values())
            .filter(position -> position.keyword.equals(keyword))
            .findFirst();
    }
}
