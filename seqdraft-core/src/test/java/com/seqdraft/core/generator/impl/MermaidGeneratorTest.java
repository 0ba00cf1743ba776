package com.seqdraft.core.generator.impl;

import com.seqdraft.core.generator.GeneratedDiagram;
import com.seqdraft.core.generator.GeneratorConfig;
import com.seqdraft.core.model.ActivationStatement;
import com.seqdraft.core.model.ArrowKind;
import com.seqdraft.core.model.BlockType;
import com.seqdraft.core.model.Box;
import com.seqdraft.core.model.Branch;
import com.seqdraft.core.model.ControlBlock;
import com.seqdraft.core.model.CreateStatement;
import com.seqdraft.core.model.DestroyStatement;
import com.seqdraft.core.model.Diagram;
import com.seqdraft.core.model.Link;
import com.seqdraft.core.model.Message;
import com.seqdraft.core.model.Note;
import com.seqdraft.core.model.NotePosition;
import com.seqdraft.core.model.Participant;
import com.seqdraft.core.model.ParticipantKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link MermaidGenerator}.
 */
class MermaidGeneratorTest {

    private MermaidGenerator generator;
    private GeneratorConfig config;

    @BeforeEach
    void setUp() {
        generator = new MermaidGenerator();
        config = GeneratorConfig.defaults();
    }

    @Test
    void getId_returnsMermaid() {
        assertThat(generator.getId()).isEqualTo("mermaid");
        assertThat(generator.getDisplayName()).isEqualTo("Mermaid Sequence Diagram Generator");
        assertThat(generator.getFileExtension()).isEqualTo("mmd");
    }

    @Test
    void generate_withNullDiagram_throwsException() {
        assertThatThrownBy(() -> generator.generate(null, config))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("diagram");
    }

    @Test
    void generate_withNullConfig_throwsException() {
        assertThatThrownBy(() -> generator.generate(new Diagram(), null))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("config");
    }

    @Test
    void generate_emptyDiagram_writesHeaderOnly() {
        GeneratedDiagram output = generator.generate(new Diagram(), config);

        assertThat(output.content()).isEqualTo("sequenceDiagram\n");
        assertThat(output.fileName()).isEqualTo("sequence-diagram.mmd");
    }

    @Test
    void generate_writesStatementsWithIndentation() {
        Diagram diagram = new Diagram();
        diagram.addParticipant(Participant.declared("A", "Alice", ParticipantKind.PARTICIPANT));
        diagram.addStatement(Message.of("A", ArrowKind.SOLID_ARROW, "B", "hi").withActivateReceiver(true));
        diagram.addStatement(ControlBlock.of(BlockType.LOOP, "retry", List.of(
            Message.of("B", ArrowKind.DASHED_ARROW, "A", "ok").withDeactivateSender(true))));
        diagram.addStatement(new Note(NotePosition.RIGHT_OF, List.of("B"), ""));
        diagram.addStatement(ActivationStatement.activate("A"));

        String content = generator.generate(diagram, config).content();

        assertThat(content).isEqualTo("""
            sequenceDiagram
                participant A as Alice
                A->>+B: hi
                loop retry
                    B- -->>A: ok
                end
                Note right of B:
                activate A
            """);
    }

    @Test
    void generate_withCustomIndentWidth() {
        Diagram diagram = new Diagram();
        diagram.addStatement(ControlBlock.of(BlockType.OPT, null, List.of(
            Message.of("A", ArrowKind.PLAIN_SOLID, "B", null))));

        String content = generator.generate(diagram, new GeneratorConfig(2, true, null)).content();

        assertThat(content).isEqualTo("sequenceDiagram\n  opt\n    A->B\n  end\n");
    }

    @Test
    void generate_writesBranchSeparatorsAndRectColor() {
        Diagram diagram = new Diagram();
        diagram.addStatement(ControlBlock.branched(BlockType.ALT, List.of(
            new Branch("valid", List.of(Message.of("A", ArrowKind.SOLID_ARROW, "B", "ok"))),
            new Branch(null, List.of(Message.of("A", ArrowKind.SOLID_CROSS, "B", "fail"))))));
        diagram.addStatement(ControlBlock.branched(BlockType.CRITICAL, List.of(
            new Branch("connect", List.of()),
            new Branch("timeout", List.of()))));
        diagram.addStatement(ControlBlock.rect("rgba(0, 0, 255, .1)", List.of(
            new Note(NotePosition.OVER, List.of("A", "B"), "shaded"))));

        String content = generator.generate(diagram, config).content();

        assertThat(content).isEqualTo("""
            sequenceDiagram
                alt valid
                    A->>B: ok
                else
                    A-xB: fail
                end
                critical connect
                option timeout
                end
                rect rgba(0, 0, 255, .1)
                    Note over A,B: shaded
                end
            """);
    }

    @Test
    void generate_writesDirectiveCommentsAndAutonumber() {
        Diagram diagram = new Diagram();
        diagram.setMirrorActors(true);
        diagram.setAutonumber(true);
        diagram.addComment("%% reviewed");

        String content = generator.generate(diagram, config).content();

        assertThat(content.lines().toList()).containsExactly(
            "%%{init: {\"sequence\": {\"mirrorActors\": true}}}%%",
            "sequenceDiagram",
            "    %% reviewed",
            "    autonumber");
    }

    @Test
    void generate_withCommentsDisabled_omitsComments() {
        Diagram diagram = new Diagram();
        diagram.addComment("%% internal");

        String content = generator.generate(diagram, new GeneratorConfig(4, false, null)).content();

        assertThat(content).doesNotContain("internal");
    }

    @Test
    void generate_writesBoxesAtFirstMember() {
        Diagram diagram = new Diagram();
        diagram.addParticipant(Participant.declared("Y", null, ParticipantKind.PARTICIPANT));
        diagram.addParticipant(Participant.declared("X", null, ParticipantKind.ACTOR).withBoxId("box-2"));
        diagram.addBox(new Box("box-1", "transparent", null, List.of()));
        diagram.addBox(new Box("box-2", "Aqua", "Team", List.of("X")));
        diagram.addBox(new Box("box-3", null, "Later", List.of()));

        String content = generator.generate(diagram, config).content();

        assertThat(content).isEqualTo("""
            sequenceDiagram
                participant Y
                box transparent
                end
                box Aqua Team
                    actor X
                end
                box Later
                end
            """);
    }

    @Test
    void generate_followsBoxIdChangedThroughUpdate() {
        Diagram diagram = new Diagram();
        diagram.addParticipant(Participant.declared("A", null, ParticipantKind.PARTICIPANT));
        diagram.addParticipant(Participant.declared("B", null, ParticipantKind.PARTICIPANT));
        diagram.addBox(new Box("box-1", null, "Team", List.of()));

        diagram.updateParticipant(diagram.findParticipant("B").orElseThrow().withBoxId("box-1"));

        assertThat(generator.generate(diagram, config).content()).isEqualTo("""
            sequenceDiagram
                participant A
                box Team
                    participant B
                end
            """);
    }

    @Test
    void generate_writesCreatedParticipantAtCreateStatement() {
        Diagram diagram = new Diagram();
        diagram.addParticipant(Participant.declared("A", null, ParticipantKind.PARTICIPANT));
        diagram.addParticipant(Participant.declared("D", "Worker", ParticipantKind.ACTOR).withCreated(true));
        diagram.addStatement(new CreateStatement("D"));
        diagram.addStatement(Message.of("A", ArrowKind.SOLID_ARROW, "D", "go"));
        diagram.addStatement(new DestroyStatement("D"));

        String content = generator.generate(diagram, config).content();

        assertThat(content).isEqualTo("""
            sequenceDiagram
                participant A
                create actor D as Worker
                A->>D: go
                destroy D
            """);
    }

    @Test
    void generate_writesLinksLast() {
        Diagram diagram = new Diagram();
        diagram.addParticipant(Participant.declared("A", null, ParticipantKind.PARTICIPANT)
            .withLink(new Link("Dashboard", "https://dash.example.com"))
            .withLink(new Link("Wiki", "https://wiki.example.com")));
        diagram.addStatement(Message.of("A", ArrowKind.SOLID_ARROW, "B", "x"));

        List<String> lines = generator.generate(diagram, config).content().lines().toList();

        assertThat(lines).endsWith(
            "    link A: Dashboard @ https://dash.example.com",
            "    link A: Wiki @ https://wiki.example.com");
    }

    @Test
    void linkLine_withAtSignInLabel_usesJsonForm() {
        assertThat(MermaidGenerator.linkLine("A", new Link("Mail @ work", "https://mail.example.com")))
            .isEqualTo("links A: {\"Mail @ work\":\"https://mail.example.com\"}");
        assertThat(MermaidGenerator.linkLine("A", new Link("Mail", "mailto:ops@example.com")))
            .isEqualTo("link A: Mail @ mailto:ops@example.com");
    }

    @Test
    void messageLine_distinguishesMissingAndEmptyText() {
        assertThat(MermaidGenerator.messageLine(Message.of("A", ArrowKind.SOLID_ARROW, "B", null)))
            .isEqualTo("A->>B");
        assertThat(MermaidGenerator.messageLine(Message.of("A", ArrowKind.SOLID_ARROW, "B", "")))
            .isEqualTo("A->>B:");
    }

    @Test
    void messageLine_prefersActivateWhenBothFlagsAreSet() {
        Message message = Message.of("A", ArrowKind.PLAIN_DASHED, "B", "x")
            .withActivateSender(true).withDeactivateSender(true)
            .withActivateReceiver(true).withDeactivateReceiver(true);

        assertThat(MermaidGenerator.messageLine(message)).isEqualTo("A+-->+B: x");
    }
}
