package com.seqdraft.core.model;

import java.util.Objects;

/**
 * Marks the point where a participant declared with {@code create} comes into existence.
 * The participant itself (kind, label) is registered on the diagram.
 *
 * @param participantId created participant
 */
public record CreateStatement(String participantId) implements Statement {

    public CreateStatement {
        Objects.requireNonNull(participantId, "participantId must not be null");
    }

    @Override
    public StatementKind kind() {
        return StatementKind.CREATE;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitCreate(this);
    }
}
