package com.seqdraft.core.model;

import java.util.Objects;

/**
 * An explicit {@code activate ID} or {@code deactivate ID} statement.
 *
 * @param participantId target participant
 * @param activate true for {@code activate}, false for {@code deactivate}
 */
public record ActivationStatement(
    String participantId,
    boolean activate
) implements Statement {
    /**
     * Compact constructor with validation.
     */
    public ActivationStatement {
        Objects.requireNonNull(participantId, "participantId must not be null");
    }

    public static ActivationStatement activate(String participantId) {
        return new ActivationStatement(participantId, true);
    }

    public static ActivationStatement deactivate(String participantId) {
        return new ActivationStatement(participantId, false);
    }

    /**
     * Returns the keyword for this statement.
     *
     * @return {@code activate} or {@code deactivate}
     */
    public String keyword() {
        return activate ? "activate" : "deactivate";
    }

    @Override
    public StatementKind kind() {
        return StatementKind.ACTIVATION;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitActivation(this);
    }
}
