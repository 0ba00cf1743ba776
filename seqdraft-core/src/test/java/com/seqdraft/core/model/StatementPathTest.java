package com.seqdraft.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link StatementPath} and {@link Statements}.
 */
class StatementPathTest {

    @Test
    void path_requiresOddLength() {
        assertThatThrownBy(() -> StatementPath.of(0, 1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> StatementPath.of())
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void path_rejectsNegativeIndices() {
        assertThatThrownBy(() -> StatementPath.of(-1))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void child_extendsPath() {
        StatementPath path = StatementPath.of(2).child(1, 0);

        assertThat(path.indices()).containsExactly(2, 1, 0);
        assertThat(path.leafIndex()).isZero();
        assertThat(path.containerIndices()).containsExactly(2, 1);
        assertThat(path.depth()).isEqualTo(1);
    }

    @Test
    void flatten_isPreOrder() {
        Message a = Message.of("A", ArrowKind.SOLID_ARROW, "B", "a");
        Message b = Message.of("B", ArrowKind.SOLID_ARROW, "C", "b");
        Message c = Message.of("C", ArrowKind.SOLID_ARROW, "A", "c");
        ControlBlock alt = ControlBlock.branched(BlockType.ALT, List.of(
            new Branch("x", List.of(b)), new Branch("y", List.of(c))));

        List<Statement> flat = Statements.flatten(List.of(a, alt));

        assertThat(flat).containsExactly(a, alt, b, c);
        assertThat(Statements.messages(List.of(a, alt))).containsExactly(a, b, c);
    }

    @Test
    void maxDepth_countsNestedBlocks() {
        ControlBlock inner = ControlBlock.of(BlockType.OPT, null, List.of());
        ControlBlock outer = ControlBlock.of(BlockType.LOOP, null, List.of(
            ControlBlock.of(BlockType.BREAK, null, List.of(inner))));

        assertThat(Statements.maxDepth(List.of())).isZero();
        assertThat(Statements.maxDepth(List.of(inner))).isEqualTo(1);
        assertThat(Statements.maxDepth(List.of(inner, outer))).isEqualTo(3);
    }
}
