package com.seqdraft.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A participant column of a sequence diagram.
 *
 * <p>Explicit participants come from {@code participant}/{@code actor} declarations (or
 * {@code create}); implicit participants are inferred from message senders and receivers and
 * are only synthesized on read by the participant resolver.
 *
 * @param id unique key within a diagram
 * @param displayLabel optional alias from {@code as LABEL}, null when absent
 * @param kind participant or actor
 * @param explicit true when declared, false when inferred from a message
 * @param insertionOrder position assigned when the participant was added
 * @param boxId id of the containing box, null when not boxed
 * @param links participant menu links, in declaration order
 * @param created true when introduced by a {@code create} statement
 * @param destroyed true when a {@code destroy} statement targets it
 */
public record Participant(
    String id,
    String displayLabel,
    ParticipantKind kind,
    boolean explicit,
    int insertionOrder,
    String boxId,
    List<Link> links,
    boolean created,
    boolean destroyed
) {
    /**
     * Compact constructor with validation.
     */
    public Participant {
        Objects.requireNonNull(id, "id must not be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        if (kind == null) {
            kind = ParticipantKind.PARTICIPANT;
        }
        links = links == null ? List.of() : List.copyOf(links);
    }

    /**
     * Creates an explicitly declared participant.
     *
     * @param id participant id
     * @param displayLabel optional alias
     * @param kind participant or actor
     * @return explicit participant with insertion order 0 (reassigned when added to a diagram)
     */
    public static Participant declared(String id, String displayLabel, ParticipantKind kind) {
        return new Participant(id, displayLabel, kind, true, 0, null, List.of(), false, false);
    }

    /**
     * Creates an implicit participant inferred from a message.
     *
     * @param id participant id
     * @param insertionOrder column position
     * @return implicit participant
     */
    public static Participant implicit(String id, int insertionOrder) {
        return new Participant(id, null, ParticipantKind.PARTICIPANT, false, insertionOrder, null, List.of(), false, false);
    }

    /**
     * Returns the text shown on the participant box: the alias when present, otherwise the id.
     *
     * @return display text
     */
    public String label() {
        return displayLabel != null ? displayLabel : id;
    }

    public Participant withId(String newId) {
        return new Participant(newId, displayLabel, kind, explicit, insertionOrder, boxId, links, created, destroyed);
    }

    public Participant withInsertionOrder(int order) {
        return new Participant(id, displayLabel, kind, explicit, order, boxId, links, created, destroyed);
    }

    public Participant withBoxId(String newBoxId) {
        return new Participant(id, displayLabel, kind, explicit, insertionOrder, newBoxId, links, created, destroyed);
    }

    public Participant withCreated(boolean value) {
        return new Participant(id, displayLabel, kind, explicit, insertionOrder, boxId, links, value, destroyed);
    }

    public Participant withDestroyed(boolean value) {
        return new Participant(id, displayLabel, kind, explicit, insertionOrder, boxId, links, created, value);
    }

    /**
     * Returns a copy with one more link appended.
     *
     * @param link link to append
     * @return updated participant
     */
    public Participant withLink(Link link) {
        List<Link> updated = new ArrayList<>(links);
        updated.add(Objects.requireNonNull(link, "link must not be null"));
        return new Participant(id, displayLabel, kind, explicit, insertionOrder, boxId, updated, created, destroyed);
    }
}
