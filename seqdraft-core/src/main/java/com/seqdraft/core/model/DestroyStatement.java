package com.seqdraft.core.model;

import java.util.Objects;

/**
 * Marks the point where a participant is destroyed ({@code destroy ID}).
 *
 * @param participantId destroyed participant
 */
public record DestroyStatement(String participantId) implements Statement {

    public DestroyStatement {
        Objects.requireNonNull(participantId, "participantId must not be null");
    }

    @Override
    public StatementKind kind() {
        return StatementKind.DESTROY;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitDestroy(this);
    }
}
