package com.seqdraft.core.model;

import java.util.Objects;

/**
 * A message arrow between two participants.
 *
 * <p>Sender and receiver need not be declared; undeclared ids become implicit participants.
 * The four activation modifiers are independent and correspond to the {@code +}/{@code -}
 * shorthand on either side of the arrow.
 *
 * @param sender sending participant id
 * @param receiver receiving participant id
 * @param arrowKind arrow style
 * @param text message text, null when the line has no {@code :}
 * @param activateSender {@code +} after the sender
 * @param deactivateSender {@code -} after the sender
 * @param activateReceiver {@code +} before the receiver
 * @param deactivateReceiver {@code -} before the receiver
 */
public record Message(
    String sender,
    String receiver,
    ArrowKind arrowKind,
    String text,
    boolean activateSender,
    boolean deactivateSender,
    boolean activateReceiver,
    boolean deactivateReceiver
) implements Statement {
    /**
     * Compact constructor with validation.
     */
    public Message {
        Objects.requireNonNull(sender, "sender must not be null");
        Objects.requireNonNull(receiver, "receiver must not be null");
        Objects.requireNonNull(arrowKind, "arrowKind must not be null");
    }

    /**
     * Creates a message without activation modifiers.
     *
     * @param sender sending participant id
     * @param arrowKind arrow style
     * @param receiver receiving participant id
     * @param text message text, may be null
     * @return new message
     */
    public static Message of(String sender, ArrowKind arrowKind, String receiver, String text) {
        return new Message(sender, receiver, arrowKind, text, false, false, false, false);
    }

    public Message withActivateReceiver(boolean value) {
        return new Message(sender, receiver, arrowKind, text, activateSender, deactivateSender, value, deactivateReceiver);
    }

    public Message withDeactivateReceiver(boolean value) {
        return new Message(sender, receiver, arrowKind, text, activateSender, deactivateSender, activateReceiver, value);
    }

    public Message withActivateSender(boolean value) {
        return new Message(sender, receiver, arrowKind, text, value, deactivateSender, activateReceiver, deactivateReceiver);
    }

    public Message withDeactivateSender(boolean value) {
        return new Message(sender, receiver, arrowKind, text, activateSender, value, activateReceiver, deactivateReceiver);
    }

    @Override
    public StatementKind kind() {
        return StatementKind.MESSAGE;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitMessage(this);
    }
}
