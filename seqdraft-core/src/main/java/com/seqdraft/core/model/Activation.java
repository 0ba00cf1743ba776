package com.seqdraft.core.model;

import java.util.Objects;

/**
 * A derived activation bar: a participant is busy from one statement to another.
 *
 * <p>Indices refer to the pre-order flattened statement sequence (see {@link Statements#flatten}).
 *
 * @param participantId activated participant
 * @param startIndex index of the activating statement
 * @param endIndex index of the deactivating statement, or of the last statement when force-closed
 * @param nestLevel depth of the participant's activation stack after this activation was closed
 */
public record Activation(
    String participantId,
    int startIndex,
    int endIndex,
    int nestLevel
) {
    /**
     * Compact constructor with validation.
     */
    public Activation {
        Objects.requireNonNull(participantId, "participantId must not be null");
        if (endIndex < startIndex) {
            throw new IllegalArgumentException("endIndex " + endIndex + " precedes startIndex " + startIndex);
        }
    }
}
