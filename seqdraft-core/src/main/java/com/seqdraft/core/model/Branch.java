package com.seqdraft.core.model;

import java.util.List;

/**
 * One labeled statement list of a control block.
 *
 * @param label branch label (loop condition, {@code else} condition, ...), null when absent
 * @param statements statements of this branch, in order
 */
public record Branch(
    String label,
    List<Statement> statements
) {
    /**
     * Compact constructor with validation.
     */
    public Branch {
        statements = statements == null ? List.of() : List.copyOf(statements);
    }

    public Branch withStatements(List<Statement> updated) {
        return new Branch(label, updated);
    }
}
