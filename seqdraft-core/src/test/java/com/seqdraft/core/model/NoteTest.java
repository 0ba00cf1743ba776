package com.seqdraft.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link Note} target cardinality.
 */
class NoteTest {

    @Test
    void overWithOneOrTwoTargets_isAccepted() {
        assertThat(new Note(NotePosition.OVER, List.of("A"), "x").participants()).containsExactly("A");
        assertThat(new Note(NotePosition.OVER, List.of("A", "B"), "x").participants()).containsExactly("A", "B");
    }

    @Test
    void overWithThreeTargets_isRejected() {
        assertThatThrownBy(() -> new Note(NotePosition.OVER, List.of("A", "B", "C"), "x"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("1 or 2");
    }

    @Test
    void sideNotes_requireExactlyOneTarget() {
        assertThat(new Note(NotePosition.RIGHT_OF, List.of("A"), "x").position()).isEqualTo(NotePosition.RIGHT_OF);

        assertThatThrownBy(() -> new Note(NotePosition.LEFT_OF, List.of("A", "B"), "x"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("exactly 1");
        assertThatThrownBy(() -> new Note(NotePosition.RIGHT_OF, List.of(), "x"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void nullText_becomesEmpty() {
        assertThat(new Note(NotePosition.OVER, List.of("A"), null).text()).isEmpty();
    }

    @Test
    void kind_isNote() {
        assertThat(new Note(NotePosition.OVER, List.of("A"), "x").kind()).isEqualTo(StatementKind.NOTE);
    }
}
