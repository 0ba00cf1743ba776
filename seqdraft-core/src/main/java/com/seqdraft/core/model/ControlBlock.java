package com.seqdraft.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A control structure wrapping one or more branches of statements.
 *
 * <p>Single-body types ({@code loop}, {@code opt}, {@code break}, {@code rect}) hold exactly one
 * branch. {@code alt}, {@code par} and {@code critical} hold one or more; for {@code critical}
 * every branch after the first is an {@code option}. Branches may contain further control
 * blocks to any depth.
 *
 * @param type block type
 * @param color fill color, only for {@code rect}; null otherwise
 * @param branches branches in order, never empty
 */
public record ControlBlock(
    BlockType type,
    String color,
    List<Branch> branches
) implements Statement {
    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException if the branch count does not fit the block type,
     *         or a color is given for a block other than {@code rect}
     */
    public ControlBlock {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(branches, "branches must not be null");
        branches = List.copyOf(branches);
        if (branches.isEmpty()) {
            throw new IllegalArgumentException(type.keyword() + " block needs at least one branch");
        }
        if (!type.isMultiBranch() && branches.size() != 1) {
            throw new IllegalArgumentException(type.keyword() + " block takes exactly one body, got " + branches.size());
        }
        if (color != null && type != BlockType.RECT) {
            throw new IllegalArgumentException("Only rect blocks carry a color");
        }
    }

    /**
     * Creates a single-body block.
     *
     * @param type single-body block type
     * @param label block label, may be null
     * @param body body statements
     * @return new block
     */
    public static ControlBlock of(BlockType type, String label, List<Statement> body) {
        return new ControlBlock(type, null, List.of(new Branch(label, body)));
    }

    /**
     * Creates a {@code rect} block.
     *
     * @param color fill color
     * @param body body statements
     * @return new rect block
     */
    public static ControlBlock rect(String color, List<Statement> body) {
        return new ControlBlock(BlockType.RECT, color, List.of(new Branch(null, body)));
    }

    /**
     * Creates a block with explicit branches.
     *
     * @param type block type
     * @param branches branches in order
     * @return new block
     */
    public static ControlBlock branched(BlockType type, List<Branch> branches) {
        return new ControlBlock(type, null, branches);
    }

    /**
     * Returns the label of the opening line.
     *
     * @return first branch label, may be null
     */
    public String label() {
        return branches.get(0).label();
    }

    /**
     * Returns the statements of the first branch.
     *
     * @return body statements
     */
    public List<Statement> body() {
        return branches.get(0).statements();
    }

    /**
     * Returns the {@code option} branches of a {@code critical} block.
     *
     * @return option branches, empty for other block types
     */
    public List<Branch> options() {
        return type == BlockType.CRITICAL ? branches.subList(1, branches.size()) : List.of();
    }

    /**
     * Returns a copy with one branch replaced.
     *
     * @param index branch index
     * @param branch replacement branch
     * @return updated block
     * @throws IndexOutOfBoundsException if the index is out of range
     */
    public ControlBlock withBranch(int index, Branch branch) {
        Objects.checkIndex(index, branches.size());
        List<Branch> updated = new ArrayList<>(branches);
        updated.set(index, Objects.requireNonNull(branch, "branch must not be null"));
        return new ControlBlock(type, color, updated);
    }

    @Override
    public StatementKind kind() {
        return type.statementKind();
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitControlBlock(this);
    }
}
