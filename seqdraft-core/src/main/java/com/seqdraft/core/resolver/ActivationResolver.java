package com.seqdraft.core.resolver;

import com.seqdraft.core.model.Activation;
import com.seqdraft.core.model.ActivationStatement;
import com.seqdraft.core.model.Diagram;
import com.seqdraft.core.model.Message;
import com.seqdraft.core.model.Statement;
import com.seqdraft.core.model.Statements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Derives activation bars from {@code activate}/{@code deactivate} statements and the
 * {@code +}/{@code -} message shorthand.
 *
 * <p>Statements are walked in pre-order flattened order (see {@link Statements#flatten}); the
 * flat position is the statement index. One stack of open start indices is kept per participant:
 * <ul>
 *   <li>{@code activate X}, or a message whose activate flag names X, pushes the index.</li>
 *   <li>{@code deactivate X} pops and closes an activation with {@code nestLevel} equal to the
 *       stack depth after the pop. A pop on an empty stack is dropped.</li>
 *   <li>Both deactivate flags of a message pop the <em>sender</em>: in {@code B-->>-A} the
 *       {@code -} before the receiver ends the activation of {@code B}, the participant replying.</li>
 *   <li>Activations still open at the end are closed at the last index with {@code nestLevel} 0.</li>
 * </ul>
 * Within one message both pushes happen before any pop.
 */
public class ActivationResolver {

    private static final Logger log = LoggerFactory.getLogger(ActivationResolver.class);

    /**
     * Resolves the activations of a diagram.
     *
     * @param diagram diagram to read
     * @return activations in closing order, force-closed ones last
     */
    public List<Activation> resolve(Diagram diagram) {
        Objects.requireNonNull(diagram, "diagram must not be null");

        List<Statement> flat = Statements.flatten(diagram.statements());
        Map<String, Deque<Integer>> open = new LinkedHashMap<>();
        List<Activation> activations = new ArrayList<>();

        for (int index = 0; index < flat.size(); index++) {
            Statement statement = flat.get(index);
            if (statement instanceof Message message) {
                if (message.activateReceiver()) {
                    push(open, message.receiver(), index);
                }
                if (message.activateSender()) {
                    push(open, message.sender(), index);
                }
                if (message.deactivateReceiver()) {
                    pop(open, message.sender(), index, activations);
                }
                if (message.deactivateSender()) {
                    pop(open, message.sender(), index, activations);
                }
            } else if (statement instanceof ActivationStatement activation) {
                if (activation.activate()) {
                    push(open, activation.participantId(), index);
                } else {
                    pop(open, activation.participantId(), index, activations);
                }
            }
        }

        int last = flat.size() - 1;
        open.forEach((participantId, stack) -> {
            // bottom of the stack first
            Iterator<Integer> starts = stack.descendingIterator();
            while (starts.hasNext()) {
                activations.add(new Activation(participantId, starts.next(), last, 0));
            }
        });

        log.debug("Resolved {} activations over {} statements", activations.size(), flat.size());
        return activations;
    }

    private static void push(Map<String, Deque<Integer>> open, String participantId, int index) {
        open.computeIfAbsent(participantId, id -> new ArrayDeque<>()).push(index);
    }

    private static void pop(Map<String, Deque<Integer>> open, String participantId, int index,
                            List<Activation> activations) {
        Deque<Integer> stack = open.get(participantId);
        if (stack == null || stack.isEmpty()) {
            log.debug("Dropping deactivation of {} at statement {}: not active", participantId, index);
            return;
        }
        int start = stack.pop();
        activations.add(new Activation(participantId, start, index, stack.size()));
    }
}
