package com.seqdraft.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * The in-memory sequence diagram: explicit participants, the top-level statement tree, boxes,
 * comments, directives and diagram-level flags.
 *
 * <p>Only explicitly declared (or created) participants are stored. Participants that appear only
 * as message senders or receivers are derived on read by the participant resolver.
 *
 * <p>Box membership is recorded on both sides, {@link Participant#boxId()} and
 * {@link Box#participantIds()}. The participant and box mutators keep the two in step; the box list
 * holds the member order.
 *
 * <p>Mutators check their indices and throw {@link IndexOutOfBoundsException} when out of range.
 * Statement indices and paths are positional: any edit that inserts or removes an earlier statement
 * shifts them, so callers re-resolve positions after such an edit.
 *
 * <p>Instances are not thread-safe.
 */
public class Diagram {

    /** Setting name that ties a directive line to the mirror-actors flag. */
    public static final String MIRROR_ACTORS_KEY = "mirrorActors";

    private final List<Participant> participants = new ArrayList<>();
    private final List<Statement> statements = new ArrayList<>();
    private final List<Box> boxes = new ArrayList<>();
    private final List<String> comments = new ArrayList<>();
    private final List<String> directives = new ArrayList<>();
    private boolean autonumber;
    private boolean mirrorActors;

    // ---------------------------------------------------------------- participants

    /**
     * Returns the stored participants in insertion order.
     *
     * @return unmodifiable view of the participants
     */
    public List<Participant> participants() {
        return Collections.unmodifiableList(participants);
    }

    public Optional<Participant> findParticipant(String id) {
        return participants.stream().filter(p -> p.id().equals(id)).findFirst();
    }

    /**
     * Adds a participant and assigns it the next insertion order.
     *
     * @param participant participant to add
     * @return the stored participant, with its insertion order set
     * @throws IllegalArgumentException if a participant with the same id exists
     */
    public Participant addParticipant(Participant participant) {
        Objects.requireNonNull(participant, "participant must not be null");
        if (findParticipant(participant.id()).isPresent()) {
            throw new IllegalArgumentException("Duplicate participant id: " + participant.id());
        }
        Participant stored = participant.withInsertionOrder(participants.size());
        participants.add(stored);
        syncBoxes(stored);
        return stored;
    }

    /**
     * Returns the participant with the given id, declaring a plain participant when absent.
     *
     * @param id participant id
     * @return existing or newly declared participant
     */
    public Participant ensureParticipant(String id) {
        return findParticipant(id)
            .orElseGet(() -> addParticipant(Participant.declared(id, null, ParticipantKind.PARTICIPANT)));
    }

    /**
     * Replaces the participant with the same id, keeping its insertion order. A changed
     * {@code boxId} moves the participant to the end of that box.
     *
     * @param participant replacement
     * @throws IllegalArgumentException if no participant has that id
     */
    public void updateParticipant(Participant participant) {
        Objects.requireNonNull(participant, "participant must not be null");
        int index = indexOfParticipant(participant.id());
        if (index < 0) {
            throw new IllegalArgumentException("Unknown participant: " + participant.id());
        }
        Participant stored = participant.withInsertionOrder(index);
        participants.set(index, stored);
        syncBoxes(stored);
    }

    /**
     * Renames a participant and rewrites every reference to it in statements and boxes.
     *
     * <p>The old id need not be stored: renaming an implicit participant only rewrites references.
     *
     * @param oldId current id
     * @param newId new id
     * @throws IllegalArgumentException if {@code newId} is already stored
     */
    public void renameParticipant(String oldId, String newId) {
        Objects.requireNonNull(oldId, "oldId must not be null");
        Objects.requireNonNull(newId, "newId must not be null");
        if (oldId.equals(newId)) {
            return;
        }
        if (findParticipant(newId).isPresent()) {
            throw new IllegalArgumentException("Duplicate participant id: " + newId);
        }
        int index = indexOfParticipant(oldId);
        if (index >= 0) {
            participants.set(index, participants.get(index).withId(newId));
        }
        statements.replaceAll(s -> s.accept(new RenamingVisitor(oldId, newId)));
        boxes.replaceAll(box -> box.withParticipantIds(
            box.participantIds().stream().map(id -> id.equals(oldId) ? newId : id).toList()));
    }

    /**
     * Removes a stored participant and its box membership. Statements referring to it are kept,
     * so it may reappear as an implicit participant.
     *
     * @param id participant id
     * @return true if a participant was removed
     */
    public boolean removeParticipant(String id) {
        int index = indexOfParticipant(id);
        if (index < 0) {
            return false;
        }
        participants.remove(index);
        boxes.replaceAll(box -> box.withParticipantIds(
            box.participantIds().stream().filter(member -> !member.equals(id)).toList()));
        renumberParticipants();
        return true;
    }

    /**
     * Moves a stored participant to another column position.
     *
     * @param from current position
     * @param to target position, interpreted after the participant was taken out
     */
    public void moveParticipant(int from, int to) {
        Objects.checkIndex(from, participants.size());
        Objects.checkIndex(to, participants.size());
        Participant moved = participants.remove(from);
        participants.add(to, moved);
        renumberParticipants();
    }

    private int indexOfParticipant(String id) {
        for (int i = 0; i < participants.size(); i++) {
            if (participants.get(i).id().equals(id)) {
                return i;
            }
        }
        return -1;
    }

    private void syncBoxes(Participant participant) {
        String id = participant.id();
        boxes.replaceAll(box -> {
            boolean member = box.participantIds().contains(id);
            if (box.id().equals(participant.boxId()) && !member) {
                List<String> ids = new ArrayList<>(box.participantIds());
                ids.add(id);
                return box.withParticipantIds(ids);
            }
            if (!box.id().equals(participant.boxId()) && member) {
                return box.withParticipantIds(box.participantIds().stream().filter(m -> !m.equals(id)).toList());
            }
            return box;
        });
    }

    private void renumberParticipants() {
        for (int i = 0; i < participants.size(); i++) {
            participants.set(i, participants.get(i).withInsertionOrder(i));
        }
    }

    // ---------------------------------------------------------------- statements (top level)

    /**
     * Returns the top-level statements.
     *
     * @return unmodifiable view of the top-level statements
     */
    public List<Statement> statements() {
        return Collections.unmodifiableList(statements);
    }

    public void addStatement(Statement statement) {
        statements.add(Objects.requireNonNull(statement, "statement must not be null"));
    }

    /**
     * Inserts a top-level statement. Participant references are not checked.
     *
     * @param index insert position, {@code 0..size}
     * @param statement statement to insert
     */
    public void addStatement(int index, Statement statement) {
        Objects.requireNonNull(statement, "statement must not be null");
        Objects.checkIndex(index, statements.size() + 1);
        statements.add(index, statement);
    }

    public Statement removeStatement(int index) {
        Objects.checkIndex(index, statements.size());
        return statements.remove(index);
    }

    public Statement updateStatement(int index, Statement statement) {
        Objects.requireNonNull(statement, "statement must not be null");
        Objects.checkIndex(index, statements.size());
        return statements.set(index, statement);
    }

    /**
     * Moves a top-level statement.
     *
     * @param from current index
     * @param to target index, interpreted after the statement was taken out
     */
    public void moveStatement(int from, int to) {
        Objects.checkIndex(from, statements.size());
        Objects.checkIndex(to, statements.size());
        Statement moved = statements.remove(from);
        statements.add(to, moved);
    }

    // ---------------------------------------------------------------- statements (any depth)

    /**
     * Returns the statement at a path.
     *
     * @param path statement path
     * @return addressed statement
     * @throws IndexOutOfBoundsException if an index of the path is out of range
     * @throws IllegalArgumentException if the path descends into a statement that is not a block
     */
    public Statement statementAt(StatementPath path) {
        Objects.requireNonNull(path, "path must not be null");
        List<Statement> container = statements;
        List<Integer> indices = path.indices();
        for (int i = 0; i < indices.size() - 1; i += 2) {
            ControlBlock block = blockAt(container, indices.get(i), path);
            int branch = indices.get(i + 1);
            Objects.checkIndex(branch, block.branches().size());
            container = block.branches().get(branch).statements();
        }
        int leaf = path.leafIndex();
        Objects.checkIndex(leaf, container.size());
        return container.get(leaf);
    }

    /**
     * Inserts a statement at a path. The leaf index may equal the container size to append.
     *
     * @param path insert position
     * @param statement statement to insert
     */
    public void insertStatement(StatementPath path, Statement statement) {
        Objects.requireNonNull(statement, "statement must not be null");
        editContainer(path, container -> {
            Objects.checkIndex(path.leafIndex(), container.size() + 1);
            container.add(path.leafIndex(), statement);
            return null;
        });
    }

    public Statement updateStatement(StatementPath path, Statement statement) {
        Objects.requireNonNull(statement, "statement must not be null");
        return editContainer(path, container -> {
            Objects.checkIndex(path.leafIndex(), container.size());
            return container.set(path.leafIndex(), statement);
        });
    }

    public Statement removeStatement(StatementPath path) {
        return editContainer(path, container -> {
            Objects.checkIndex(path.leafIndex(), container.size());
            return container.remove(path.leafIndex());
        });
    }

    /**
     * Moves a statement between any two positions of the tree.
     *
     * <p>The statement is removed first; {@code to} is interpreted against the tree after the
     * removal. If the insert fails the statement is put back and the exception rethrown.
     *
     * @param from current path
     * @param to target path
     */
    public void moveStatement(StatementPath from, StatementPath to) {
        Objects.requireNonNull(to, "to must not be null");
        Statement moved = removeStatement(from);
        try {
            insertStatement(to, moved);
        } catch (RuntimeException e) {
            insertStatement(from, moved);
            throw e;
        }
    }

    private <R> R editContainer(StatementPath path, Function<List<Statement>, R> edit) {
        Objects.requireNonNull(path, "path must not be null");
        return editContainer(statements, path.containerIndices(), path, edit);
    }

    private <R> R editContainer(List<Statement> container, List<Integer> indices, StatementPath path,
                                Function<List<Statement>, R> edit) {
        if (indices.isEmpty()) {
            return edit.apply(container);
        }
        int index = indices.get(0);
        ControlBlock block = blockAt(container, index, path);
        int branchIndex = indices.get(1);
        Objects.checkIndex(branchIndex, block.branches().size());
        Branch branch = block.branches().get(branchIndex);

        List<Statement> children = new ArrayList<>(branch.statements());
        R result = editContainer(children, indices.subList(2, indices.size()), path, edit);
        container.set(index, block.withBranch(branchIndex, branch.withStatements(children)));
        return result;
    }

    private static ControlBlock blockAt(List<Statement> container, int index, StatementPath path) {
        Objects.checkIndex(index, container.size());
        if (container.get(index) instanceof ControlBlock block) {
            return block;
        }
        throw new IllegalArgumentException("Path " + path + " descends into a " + container.get(index).kind()
            + " statement, not a control block");
    }

    // ---------------------------------------------------------------- boxes, comments, flags

    public List<Box> boxes() {
        return Collections.unmodifiableList(boxes);
    }

    /**
     * Adds a box. Stored participants it lists get its id as {@code boxId} and leave any other box;
     * stored participants already carrying its id are appended to its members.
     *
     * @param box box to add
     * @throws IllegalArgumentException if a box with the same id exists
     */
    public void addBox(Box box) {
        Objects.requireNonNull(box, "box must not be null");
        if (findBox(box.id()).isPresent()) {
            throw new IllegalArgumentException("Duplicate box id: " + box.id());
        }
        List<String> members = new ArrayList<>(box.participantIds());
        participants.stream()
            .filter(p -> box.id().equals(p.boxId()) && !members.contains(p.id()))
            .forEach(p -> members.add(p.id()));
        boxes.add(box.withParticipantIds(members));
        for (int i = 0; i < participants.size(); i++) {
            Participant participant = participants.get(i);
            if (members.contains(participant.id()) && !box.id().equals(participant.boxId())) {
                Participant moved = participant.withBoxId(box.id());
                participants.set(i, moved);
                syncBoxes(moved);
            }
        }
    }

    public Optional<Box> findBox(String id) {
        return boxes.stream().filter(b -> b.id().equals(id)).findFirst();
    }

    public List<String> comments() {
        return Collections.unmodifiableList(comments);
    }

    public void addComment(String comment) {
        comments.add(Objects.requireNonNull(comment, "comment must not be null"));
    }

    /**
     * Returns the {@code %%{...}%%} directive lines, verbatim and in source order.
     *
     * @return unmodifiable view of the directives
     */
    public List<String> directives() {
        return Collections.unmodifiableList(directives);
    }

    public void addDirective(String directive) {
        directives.add(Objects.requireNonNull(directive, "directive must not be null"));
    }

    public boolean isAutonumber() {
        return autonumber;
    }

    public void setAutonumber(boolean autonumber) {
        this.autonumber = autonumber;
    }

    public boolean isMirrorActors() {
        return mirrorActors;
    }

    /**
     * Sets the mirror-actors flag. Changing the value drops stored directives that mention
     * {@code mirrorActors}, since they no longer describe the diagram.
     *
     * @param mirrorActors new flag value
     */
    public void setMirrorActors(boolean mirrorActors) {
        if (this.mirrorActors != mirrorActors) {
            directives.removeIf(directive -> directive.contains(MIRROR_ACTORS_KEY));
        }
        this.mirrorActors = mirrorActors;
    }

    /**
     * Compares everything except comments, whose position is not preserved by a round trip.
     *
     * @param other diagram to compare with
     * @return true if participants, statements, boxes, directives and flags are equal
     */
    public boolean sameStructure(Diagram other) {
        return other != null
            && autonumber == other.autonumber
            && mirrorActors == other.mirrorActors
            && directives.equals(other.directives)
            && participants.equals(other.participants)
            && statements.equals(other.statements)
            && boxes.equals(other.boxes);
    }

    @Override
    public String toString() {
        return "Diagram{participants=" + participants.size()
            + ", statements=" + statements.size()
            + ", boxes=" + boxes.size()
            + ", autonumber=" + autonumber
            + ", mirrorActors=" + mirrorActors + '}';
    }

    private static final class RenamingVisitor implements StatementVisitor<Statement> {
        private final String oldId;
        private final String newId;

        RenamingVisitor(String oldId, String newId) {
            this.oldId = oldId;
            this.newId = newId;
        }

        private String rename(String id) {
            return id.equals(oldId) ? newId : id;
        }

        @Override
        public Statement visitMessage(Message m) {
            return new Message(rename(m.sender()), rename(m.receiver()), m.arrowKind(), m.text(),
                m.activateSender(), m.deactivateSender(), m.activateReceiver(), m.deactivateReceiver());
        }

        @Override
        public Statement visitNote(Note note) {
            return new Note(note.position(), note.participants().stream().map(this::rename).toList(), note.text());
        }

        @Override
        public Statement visitActivation(ActivationStatement activation) {
            return new ActivationStatement(rename(activation.participantId()), activation.activate());
        }

        @Override
        public Statement visitCreate(CreateStatement create) {
            return new CreateStatement(rename(create.participantId()));
        }

        @Override
        public Statement visitDestroy(DestroyStatement destroy) {
            return new DestroyStatement(rename(destroy.participantId()));
        }

        @Override
        public Statement visitControlBlock(ControlBlock block) {
            List<Branch> branches = block.branches().stream()
                .map(b -> b.withStatements(b.statements().stream().map(s -> s.accept(this)).toList()))
                .toList();
            return new ControlBlock(block.type(), block.color(), branches);
        }
    }
}
