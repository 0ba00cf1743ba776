package com.seqdraft.core.resolver;

import com.seqdraft.core.model.ArrowKind;
import com.seqdraft.core.model.BlockType;
import com.seqdraft.core.model.ControlBlock;
import com.seqdraft.core.model.DestroyStatement;
import com.seqdraft.core.model.Diagram;
import com.seqdraft.core.model.Message;
import com.seqdraft.core.model.Participant;
import com.seqdraft.core.model.ParticipantKind;
import com.seqdraft.core.parser.SequenceDiagramParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link ParticipantResolver}.
 */
class ParticipantResolverTest {

    private ParticipantResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new ParticipantResolver();
    }

    @Test
    void orderedParticipants_implicitOnly_followFirstOccurrence() {
        Diagram diagram = new SequenceDiagramParser().parse("sequenceDiagram\nA->>B: hi\nC->>A: yo").diagram();

        List<Participant> participants = resolver.orderedParticipants(diagram);

        assertThat(participants).extracting(Participant::id).containsExactly("A", "B", "C");
        assertThat(participants).noneMatch(Participant::explicit);
        assertThat(participants).extracting(Participant::insertionOrder).containsExactly(0, 1, 2);
    }

    @Test
    void orderedParticipants_declaredComeFirst() {
        Diagram diagram = new Diagram();
        diagram.addParticipant(Participant.declared("Z", "Zed", ParticipantKind.ACTOR));
        diagram.addStatement(Message.of("A", ArrowKind.SOLID_ARROW, "Z", "hi"));

        List<Participant> participants = resolver.orderedParticipants(diagram);

        assertThat(participants).extracting(Participant::id).containsExactly("Z", "A");
        assertThat(participants.get(1).insertionOrder()).isEqualTo(1);
    }

    @Test
    void orderedParticipants_walksNestedBlocksInPreOrder() {
        Diagram diagram = new Diagram();
        diagram.addStatement(ControlBlock.of(BlockType.OPT, null, List.of(
            Message.of("Q", ArrowKind.SOLID_ARROW, "R", null))));
        diagram.addStatement(Message.of("P", ArrowKind.SOLID_ARROW, "Q", null));

        assertThat(resolver.orderedParticipants(diagram))
            .extracting(Participant::id)
            .containsExactly("Q", "R", "P");
    }

    @Test
    void orderedParticipants_marksDestroyedParticipants() {
        Diagram diagram = new Diagram();
        diagram.addParticipant(Participant.declared("A", null, ParticipantKind.PARTICIPANT));
        diagram.addStatement(Message.of("A", ArrowKind.SOLID_ARROW, "B", null));
        diagram.addStatement(new DestroyStatement("A"));
        diagram.addStatement(new DestroyStatement("B"));

        assertThat(resolver.orderedParticipants(diagram)).allMatch(Participant::destroyed);
        assertThat(diagram.participants().get(0).destroyed()).isFalse();
    }

    @Test
    void orderedParticipants_ignoresNoteTargets() {
        Diagram diagram = new SequenceDiagramParser().parse("sequenceDiagram\nNote over X: alone").diagram();

        assertThat(resolver.orderedParticipants(diagram)).isEmpty();
    }
}
