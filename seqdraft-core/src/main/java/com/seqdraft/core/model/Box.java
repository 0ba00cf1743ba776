package com.seqdraft.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A visual grouping of participants. Boxes do not scope statements.
 *
 * @param id unique box id within a diagram
 * @param color optional color ({@code transparent}, {@code rgb(...)}, a color name), null when absent
 * @param description optional description, null when absent
 * @param participantIds ids of the grouped participants, in declaration order
 */
public record Box(
    String id,
    String color,
    String description,
    List<String> participantIds
) {
    /**
     * Compact constructor with validation.
     */
    public Box {
        Objects.requireNonNull(id, "id must not be null");
        participantIds = participantIds == null ? List.of() : List.copyOf(participantIds);
    }

    public Box withParticipantIds(List<String> ids) {
        return new Box(id, color, description, ids);
    }
}
