package com.seqdraft.core.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Address of a statement inside the statement tree.
 *
 * <p>The first index selects a top-level statement. Every following pair selects a branch of
 * the control block reached so far and a statement inside that branch:
 * {@code [top]}, {@code [top, branch, child]}, {@code [top, branch, child, branch, child]}, ...
 *
 * <p>Paths are positional. Any edit that inserts or removes an earlier sibling invalidates them.
 *
 * @param indices path indices, odd length
 */
public record StatementPath(List<Integer> indices) {

    /**
     * Compact constructor with validation.
     */
    public StatementPath {
        Objects.requireNonNull(indices, "indices must not be null");
        indices = List.copyOf(indices);
        if (indices.size() % 2 != 1) {
            throw new IllegalArgumentException("Statement path needs an odd number of indices, got " + indices);
        }
        for (Integer index : indices) {
            if (index < 0) {
                throw new IllegalArgumentException("Statement path indices must not be negative: " + indices);
            }
        }
    }

    /**
     * Creates a path from raw indices.
     *
     * @param indices path indices
     * @return new path
     */
    public static StatementPath of(int... indices) {
        return new StatementPath(Arrays.stream(indices).boxed().toList());
    }

    /**
     * Returns the path of a statement inside one of this statement's branches.
     *
     * @param branch branch index
     * @param index statement index inside the branch
     * @return child path
     */
    public StatementPath child(int branch, int index) {
        List<Integer> extended = new ArrayList<>(indices);
        extended.add(branch);
        extended.add(index);
        return new StatementPath(extended);
    }

    /**
     * Returns the indices that select the container list, i.e. the path without its last index.
     *
     * @return container indices, even length (empty for top-level statements)
     */
    public List<Integer> containerIndices() {
        return indices.subList(0, indices.size() - 1);
    }

    /**
     * Returns the index of the statement inside its container.
     *
     * @return last index
     */
    public int leafIndex() {
        return indices.get(indices.size() - 1);
    }

    /**
     * Returns the nesting depth, 0 for top-level statements.
     *
     * @return depth
     */
    public int depth() {
        return indices.size() / 2;
    }

    @Override
    public String toString() {
        return indices.toString();
    }
}
