package com.seqdraft.core.resolver;

import com.seqdraft.core.model.DestroyStatement;
import com.seqdraft.core.model.Diagram;
import com.seqdraft.core.model.Message;
import com.seqdraft.core.model.Participant;
import com.seqdraft.core.model.Statement;
import com.seqdraft.core.model.Statements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Derives the full left-to-right participant order of a diagram.
 *
 * <p>Stored participants come first, in insertion order. Every message sender or receiver that is
 * not stored follows as an implicit participant, ordered by its first occurrence in a pre-order
 * walk of the statement tree (sender before receiver within one message).
 *
 * <p>The {@code destroyed} flag is set for any participant targeted by a {@code destroy} statement.
 */
public class ParticipantResolver {

    private static final Logger log = LoggerFactory.getLogger(ParticipantResolver.class);

    /**
     * Returns stored plus implicit participants in column order.
     *
     * @param diagram diagram to read
     * @return ordered participants; implicit ones carry their column position as insertion order
     */
    public List<Participant> orderedParticipants(Diagram diagram) {
        Objects.requireNonNull(diagram, "diagram must not be null");

        List<Statement> flat = Statements.flatten(diagram.statements());
        Set<String> destroyed = new HashSet<>();
        Set<String> implicitIds = new LinkedHashSet<>();
        Set<String> known = new HashSet<>();
        diagram.participants().forEach(p -> known.add(p.id()));

        for (Statement statement : flat) {
            if (statement instanceof Message message) {
                for (String id : List.of(message.sender(), message.receiver())) {
                    if (!known.contains(id)) {
                        implicitIds.add(id);
                    }
                }
            } else if (statement instanceof DestroyStatement destroy) {
                destroyed.add(destroy.participantId());
            }
        }

        List<Participant> ordered = new ArrayList<>();
        for (Participant participant : diagram.participants()) {
            ordered.add(destroyed.contains(participant.id()) ? participant.withDestroyed(true) : participant);
        }
        int order = ordered.size();
        for (String id : implicitIds) {
            Participant implicit = Participant.implicit(id, order++);
            ordered.add(destroyed.contains(id) ? implicit.withDestroyed(true) : implicit);
        }

        log.debug("Resolved {} participants ({} implicit)", ordered.size(), implicitIds.size());
        return ordered;
    }
}
