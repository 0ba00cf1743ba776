package com.seqdraft.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A note placed beside or over participants.
 *
 * <p>{@code left of} and {@code right of} reference exactly one participant; {@code over}
 * references one or two. Other cardinalities are rejected, never coerced.
 *
 * @param position note placement
 * @param participants referenced participant ids
 * @param text note text
 */
public record Note(
    NotePosition position,
    List<String> participants,
    String text
) implements Statement {
    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException if the number of participants does not fit the position
     */
    public Note {
        Objects.requireNonNull(position, "position must not be null");
        Objects.requireNonNull(participants, "participants must not be null");
        participants = List.copyOf(participants);
        if (!position.accepts(participants.size())) {
            throw new IllegalArgumentException("Note " + position.keyword() + " takes "
                + position.describeCardinality() + " participant(s), got " + participants.size());
        }
        if (text == null) {
            text = "";
        }
    }

    @Override
    public StatementKind kind() {
        return StatementKind.NOTE;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitNote(this);
    }
}
