package com.seqdraft.core.generator.impl;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import com.seqdraft.core.generator.DiagramGenerator;
import com.seqdraft.core.generator.GeneratedDiagram;
import com.seqdraft.core.generator.GeneratorConfig;
import com.seqdraft.core.model.ActivationStatement;
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
import com.seqdraft.core.model.Participant;
import com.seqdraft.core.model.ParticipantKind;
import com.seqdraft.core.model.Statement;
import com.seqdraft.core.model.StatementVisitor;
import com.seqdraft.core.resolver.ParticipantResolver;

/**
 * Generates the canonical sequence diagram text from a {@link Diagram}.
 *
 * <p>The output is the exact inverse of {@code SequenceDiagramParser} up to whitespace and
 * comment placement. Layout:
 * <ol>
 *   <li>an init directive when {@code mirrorActors} is set</li>
 *   <li>the {@code sequenceDiagram} header</li>
 *   <li>stored comments (when enabled), then {@code autonumber} when set</li>
 *   <li>declared participants in column order; a box is written where its first member stands</li>
 *   <li>the statement tree, one indentation level per control block</li>
 *   <li>{@code link} lines</li>
 * </ol>
 *
 * <p>Created participants are not declared in the header: their {@code create} line is written
 * at the position of the create statement.
 *
 * <p>Activation shorthand is re-attached next to the arrow. A {@code -} after the sender is
 * followed by a space so that {@code A- ->>B} is not read back as {@code A-->>B}.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * MermaidGenerator generator = new MermaidGenerator();
 * GeneratedDiagram output = generator.generate(diagram, GeneratorConfig.defaults());
 * Files.writeString(target, output.content());
 * }</pre>
 *
 * @see <a href="https://mermaid.js.org/syntax/sequenceDiagram.html">Mermaid Sequence Diagrams</a>
 */
public class MermaidGenerator implements DiagramGenerator {

    private static final Logger log = LoggerFactory.getLogger(MermaidGenerator.class);
    private static final ObjectMapper JSON_MAPPER = JsonMapper.builder().build();

    // Generator identification
    private static final String GENERATOR_ID = "mermaid";
    private static final String GENERATOR_DISPLAY_NAME = "Mermaid Sequence Diagram Generator";
    private static final String FILE_EXTENSION = "mmd";
    private static final String DOCUMENT_NAME = "sequence-diagram";

    // Keywords
    private static final String HEADER = "sequenceDiagram";
    private static final String MIRROR_ACTORS_DIRECTIVE = "%%{init: {\"sequence\": {\"mirrorActors\": true}}}%%";
    private static final String AUTONUMBER = "autonumber";
    private static final String BOX = "box";
    private static final String END = "end";
    private static final String CREATE = "create ";
    private static final String DESTROY = "destroy ";
    private static final String NOTE = "Note ";
    private static final String LINK = "link ";
    private static final String LINKS = "links ";
    private static final String LINK_SEPARATOR = "@";
    private static final String ALIAS = " as ";

    private static final String NEWLINE = "\n";
    private static final String SPACE = " ";

    private final ParticipantResolver participantResolver = new ParticipantResolver();

    @Override
    public String getId() {
        return GENERATOR_ID;
    }

    @Override
    public String getDisplayName() {
        return GENERATOR_DISPLAY_NAME;
    }

    @Override
    public String getFileExtension() {
        return FILE_EXTENSION;
    }

    @Override
    public GeneratedDiagram generate(Diagram diagram, GeneratorConfig config) {
        Objects.requireNonNull(diagram, "diagram must not be null");
        Objects.requireNonNull(config, "config must not be null");

        log.debug("Generating Mermaid sequence diagram: {}", diagram);
        String content = render(diagram, config);
        log.info("Generated Mermaid sequence diagram: {} lines", content.lines().count());

        return new GeneratedDiagram(DOCUMENT_NAME, content, getFileExtension());
    }

    /**
     * Renders the canonical text of a diagram.
     *
     * @param diagram diagram to render
     * @param config indentation and comment settings
     * @return diagram text, ending with a newline
     */
    public String render(Diagram diagram, GeneratorConfig config) {
        StringBuilder sb = new StringBuilder();

        boolean mirrorWritten = false;
        for (String directive : diagram.directives()) {
            sb.append(directive).append(NEWLINE);
            mirrorWritten |= directive.contains(Diagram.MIRROR_ACTORS_KEY);
        }
        if (diagram.isMirrorActors() && !mirrorWritten) {
            sb.append(MIRROR_ACTORS_DIRECTIVE).append(NEWLINE);
        }
        sb.append(HEADER).append(NEWLINE);

        String indent = config.indent(1);
        if (config.includeComments()) {
            diagram.comments().forEach(comment -> sb.append(indent).append(comment).append(NEWLINE));
        }
        if (diagram.isAutonumber()) {
            sb.append(indent).append(AUTONUMBER).append(NEWLINE);
        }

        appendParticipants(sb, diagram, config);

        StatementWriter writer = new StatementWriter(sb, diagram, config);
        diagram.statements().forEach(writer::write);

        appendLinks(sb, diagram, indent);
        return sb.toString();
    }

    /**
     * Writes declared participants in column order, each box where its first member stands.
     * Boxes without declared members keep their relative position among the boxes.
     */
    private void appendParticipants(StringBuilder sb, Diagram diagram, GeneratorConfig config) {
        List<Participant> declared = participantResolver.orderedParticipants(diagram).stream()
            .filter(p -> p.explicit() && !p.created())
            .toList();
        Set<String> declaredIds = new HashSet<>();
        declared.forEach(p -> declaredIds.add(p.id()));

        Map<String, Box> boxByMember = new LinkedHashMap<>();
        for (Box box : diagram.boxes()) {
            box.participantIds().forEach(id -> boxByMember.putIfAbsent(id, box));
        }

        List<Box> boxes = diagram.boxes();
        Set<String> written = new HashSet<>();
        for (Participant participant : declared) {
            Box box = boxByMember.get(participant.id());
            if (box == null) {
                appendParticipant(sb, participant, config.indent(1));
                continue;
            }
            if (written.contains(box.id())) {
                continue;
            }
            for (Box earlier : boxes.subList(0, boxes.indexOf(box))) {
                if (!written.contains(earlier.id()) && earlier.participantIds().stream().noneMatch(declaredIds::contains)) {
                    appendBox(sb, earlier, List.of(), config);
                    written.add(earlier.id());
                }
            }
            List<Participant> members = declared.stream()
                .filter(p -> box.equals(boxByMember.get(p.id())))
                .toList();
            appendBox(sb, box, members, config);
            written.add(box.id());
        }
        for (Box box : boxes) {
            if (!written.contains(box.id())) {
                appendBox(sb, box, List.of(), config);
            }
        }
    }

    private void appendBox(StringBuilder sb, Box box, List<Participant> members, GeneratorConfig config) {
        sb.append(config.indent(1)).append(BOX);
        if (box.color() != null) {
            sb.append(SPACE).append(box.color());
        }
        if (box.description() != null) {
            sb.append(SPACE).append(box.description());
        }
        sb.append(NEWLINE);
        members.forEach(member -> appendParticipant(sb, member, config.indent(2)));
        sb.append(config.indent(1)).append(END).append(NEWLINE);
    }

    private void appendParticipant(StringBuilder sb, Participant participant, String indent) {
        sb.append(indent).append(declaration(participant.kind(), participant.id(), participant.displayLabel()))
            .append(NEWLINE);
    }

    private static String declaration(ParticipantKind kind, String id, String label) {
        return kind.keyword() + SPACE + id + (label != null ? ALIAS + label : "");
    }

    private void appendLinks(StringBuilder sb, Diagram diagram, String indent) {
        for (Participant participant : diagram.participants()) {
            for (Link link : participant.links()) {
                sb.append(indent).append(linkLine(participant.id(), link)).append(NEWLINE);
            }
        }
    }

    /**
     * Renders one link line. A label containing {@code @} cannot be split back from the URL in the
     * {@code link} form, so that link is written as a one-entry {@code links} JSON object instead.
     */
    static String linkLine(String participantId, Link link) {
        if (!link.label().contains(LINK_SEPARATOR)) {
            return LINK + participantId + ": " + link.label() + " " + LINK_SEPARATOR + " " + link.url();
        }
        try {
            return LINKS + participantId + ": " + JSON_MAPPER.writeValueAsString(Map.of(link.label(), link.url()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot write link of " + participantId + ": " + link, e);
        }
    }

    /**
     * Renders one message line, without indentation.
     *
     * @param message message to render
     * @return message line
     */
    static String messageLine(Message message) {
        StringBuilder line = new StringBuilder(message.sender());
        if (message.activateSender()) {
            line.append('+');
        } else if (message.deactivateSender()) {
            line.append("- ");
        }
        line.append(message.arrowKind().token());
        if (message.activateReceiver()) {
            line.append('+');
        } else if (message.deactivateReceiver()) {
            line.append('-');
        }
        line.append(message.receiver());
        if (message.text() != null) {
            line.append(':');
            if (!message.text().isEmpty()) {
                line.append(SPACE).append(message.text());
            }
        }
        return line.toString();
    }

    /**
     * Writes statements at increasing indentation, one visitor call per statement.
     */
    private static final class StatementWriter implements StatementVisitor<Void> {
        private final StringBuilder sb;
        private final Diagram diagram;
        private final GeneratorConfig config;
        private int level = 1;

        StatementWriter(StringBuilder sb, Diagram diagram, GeneratorConfig config) {
            this.sb = sb;
            this.diagram = diagram;
            this.config = config;
        }

        void write(Statement statement) {
            statement.accept(this);
        }

        private void line(String text) {
            sb.append(config.indent(level)).append(text).append(NEWLINE);
        }

        @Override
        public Void visitMessage(Message message) {
            line(messageLine(message));
            return null;
        }

        @Override
        public Void visitNote(Note note) {
            String text = note.text().isEmpty() ? ":" : ": " + note.text();
            line(NOTE + note.position().keyword() + SPACE + String.join(",", note.participants()) + text);
            return null;
        }

        @Override
        public Void visitActivation(ActivationStatement activation) {
            line(activation.keyword() + SPACE + activation.participantId());
            return null;
        }

        @Override
        public Void visitCreate(CreateStatement create) {
            Optional<Participant> participant = diagram.findParticipant(create.participantId());
            ParticipantKind kind = participant.map(Participant::kind).orElse(ParticipantKind.PARTICIPANT);
            String label = participant.map(Participant::displayLabel).orElse(null);
            line(CREATE + declaration(kind, create.participantId(), label));
            return null;
        }

        @Override
        public Void visitDestroy(DestroyStatement destroy) {
            line(DESTROY + destroy.participantId());
            return null;
        }

        @Override
        public Void visitControlBlock(ControlBlock block) {
            BlockType type = block.type();
            String opening = type == BlockType.RECT ? block.color() : block.label();
            line(opening != null ? type.keyword() + SPACE + opening : type.keyword());

            List<Branch> branches = block.branches();
            for (int i = 0; i < branches.size(); i++) {
                Branch branch = branches.get(i);
                if (i > 0) {
                    line(branch.label() != null ? type.separator() + SPACE + branch.label() : type.separator());
                }
                level++;
                branch.statements().forEach(this::write);
                level--;
            }
            line(END);
            return null;
        }
    }
}
