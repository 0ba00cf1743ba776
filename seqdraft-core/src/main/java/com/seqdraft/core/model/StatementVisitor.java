package com.seqdraft.core.model;

/**
 * Exhaustive dispatch over the {@link Statement} hierarchy.
 *
 * @param <R> result type
 */
public interface StatementVisitor<R> {

    R visitMessage(Message message);

    R visitNote(Note note);

    R visitActivation(ActivationStatement activation);

    R visitCreate(CreateStatement create);

    R visitDestroy(DestroyStatement destroy);

    R visitControlBlock(ControlBlock block);
}
