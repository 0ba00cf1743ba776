package com.seqdraft.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Traversal helpers over statement trees.
 */
public final class Statements {

    private Statements() {
        // Utility class
    }

    /**
     * Flattens a statement tree in pre-order.
     *
     * <p>A control block appears before the statements of its branches, branches in order.
     * The position of a statement in the returned list is its flat statement index.
     *
     * @param statements top-level statements
     * @return all statements, pre-order
     */
    public static List<Statement> flatten(List<Statement> statements) {
        List<Statement> flat = new ArrayList<>();
        collect(statements, flat);
        return flat;
    }

    private static void collect(List<Statement> statements, List<Statement> target) {
        for (Statement statement : statements) {
            target.add(statement);
            if (statement instanceof ControlBlock block) {
                for (Branch branch : block.branches()) {
                    collect(branch.statements(), target);
                }
            }
        }
    }

    /**
     * Collects all messages of a statement tree in pre-order.
     *
     * @param statements top-level statements
     * @return messages, pre-order
     */
    public static List<Message> messages(List<Statement> statements) {
        List<Message> messages = new ArrayList<>();
        for (Statement statement : flatten(statements)) {
            if (statement instanceof Message message) {
                messages.add(message);
            }
        }
        return messages;
    }

    /**
     * Computes the deepest control-block nesting of a statement tree.
     *
     * @param statements top-level statements
     * @return 0 without control blocks, 1 for a block holding no further blocks, ...
     */
    public static int maxDepth(List<Statement> statements) {
        int depth = 0;
        for (Statement statement : statements) {
            if (statement instanceof ControlBlock block) {
                for (Branch branch : block.branches()) {
                    depth = Math.max(depth, 1 + maxDepth(branch.statements()));
                }
            }
        }
        return depth;
    }
}
