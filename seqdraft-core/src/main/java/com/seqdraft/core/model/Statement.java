package com.seqdraft.core.model;

/**
 * An entry of a diagram's statement list or of a control block branch.
 *
 * <p>The hierarchy is closed. Consumers dispatch through {@link StatementVisitor}, so adding a
 * statement type breaks compilation at every site that has to handle it.
 */
public sealed interface Statement
    permits Message, Note, ActivationStatement, CreateStatement, DestroyStatement, ControlBlock {

    /**
     * Returns the discriminator tag of this statement.
     *
     * @return statement kind
     */
    StatementKind kind();

    /**
     * Dispatches to the visitor method for this statement type.
     *
     * @param visitor the visitor
     * @param <R> visitor result type
     * @return visitor result
     */
    <R> R accept(StatementVisitor<R> visitor);
}
