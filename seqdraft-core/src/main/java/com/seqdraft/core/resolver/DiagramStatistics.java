package com.seqdraft.core.resolver;

import com.seqdraft.core.model.ControlBlock;
import com.seqdraft.core.model.Diagram;
import com.seqdraft.core.model.Message;
import com.seqdraft.core.model.Note;
import com.seqdraft.core.model.Participant;
import com.seqdraft.core.model.Statement;
import com.seqdraft.core.model.Statements;

import java.util.List;
import java.util.Objects;

/**
 * Summary counts of a diagram.
 *
 * @param explicitParticipants declared or created participants
 * @param implicitParticipants participants only named by messages
 * @param statements all statements at any depth, blocks included
 * @param messages messages at any depth
 * @param notes notes at any depth
 * @param controlBlocks control blocks at any depth
 * @param maxDepth deepest control block nesting, 0 without blocks
 * @param activations derived activation bars
 * @param boxes participant boxes
 */
public record DiagramStatistics(
    int explicitParticipants,
    int implicitParticipants,
    int statements,
    int messages,
    int notes,
    int controlBlocks,
    int maxDepth,
    int activations,
    int boxes
) {
    /**
     * Computes the statistics of a diagram.
     *
     * @param diagram diagram to summarize
     * @return statistics
     */
    public static DiagramStatistics of(Diagram diagram) {
        Objects.requireNonNull(diagram, "diagram must not be null");
        List<Participant> participants = new ParticipantResolver().orderedParticipants(diagram);
        List<Statement> flat = Statements.flatten(diagram.statements());

        int explicit = (int) participants.stream().filter(Participant::explicit).count();
        return new DiagramStatistics(
            explicit,
            participants.size() - explicit,
            flat.size(),
            count(flat, Message.class),
            count(flat, Note.class),
            count(flat, ControlBlock.class),
            Statements.maxDepth(diagram.statements()),
            new ActivationResolver().resolve(diagram).size(),
            diagram.boxes().size()
        );
    }

    public int totalParticipants() {
        return explicitParticipants + implicitParticipants;
    }

    private static int count(List<Statement> statements, Class<? extends Statement> type) {
        return (int) statements.stream().filter(type::isInstance).count();
    }
}
