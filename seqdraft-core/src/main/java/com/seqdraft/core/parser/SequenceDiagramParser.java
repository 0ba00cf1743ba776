package com.seqdraft.core.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
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
import com.seqdraft.core.model.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Parses the line-oriented sequence diagram notation into a {@link Diagram}.
 *
 * <p>Lines are trimmed; blank lines are ignored and {@code %%} lines are kept as diagram comments.
 * The first content line must be {@code sequenceDiagram}. Every following line is classified by
 * its leading keyword; control blocks are parsed recursively until their matching {@code end}.
 *
 * <p>Error policy:
 * <ul>
 *   <li>Structural problems (unterminated block or box, unmatched {@code end}, missing header)
 *       throw {@link DiagramSyntaxException} and abort the parse.</li>
 *   <li>Every other malformed line is skipped and reported as a {@link ParseWarning}.</li>
 * </ul>
 *
 * <p>Only declared and created participants are stored. Message senders and receivers are left to
 * the participant resolver. Created participants are registered after all plain declarations, in
 * the order their {@code create} lines appear.
 *
 * <p>The parser holds no per-call state and may be shared.
 */
public class SequenceDiagramParser {

    private static final Logger log = LoggerFactory.getLogger(SequenceDiagramParser.class);

    private static final ObjectMapper JSON_MAPPER = JsonMapper.builder()
        .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
        .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
        .build();

    private static final TypeReference<LinkedHashMap<String, String>> LINK_MAP = new TypeReference<>() {
    };

    /**
     * Parses diagram text.
     *
     * @param text diagram text, may be empty
     * @return parsed diagram plus warnings for skipped lines
     * @throws DiagramSyntaxException on a structural error
     */
    public ParseResult parse(String text) {
        Objects.requireNonNull(text, "text must not be null");
        ParseResult result = new ParseSession(text).run();
        log.info("Parsed sequence diagram: {} participants, {} statements, {} warnings",
            result.diagram().participants().size(),
            result.diagram().statements().size(),
            result.warnings().size());
        return result;
    }

    private enum Terminator {
        END,
        SEPARATOR,
        EOF
    }

    private static final class OpenBox {
        private final SourceLine opener;
        private final String id;
        private final String color;
        private final String description;
        private final List<String> members = new ArrayList<>();

        OpenBox(SourceLine opener, String id, String color, String description) {
            this.opener = opener;
            this.id = id;
            this.color = color;
            this.description = description;
        }
    }

    /**
     * State of one parse call: a cursor over the lines plus the diagram under construction.
     */
    private static final class ParseSession {
        private final List<SourceLine> lines;
        private final Diagram diagram = new Diagram();
        private final List<ParseWarning> warnings = new ArrayList<>();
        private final List<Participant> pendingCreates = new ArrayList<>();
        private final Set<String> destroyed = new LinkedHashSet<>();
        private int position;
        private OpenBox currentBox;
        private String separatorLabel;

        ParseSession(String text) {
            String[] raw = text.split("\\R", -1);
            this.lines = new ArrayList<>(raw.length);
            for (int i = 0; i < raw.length; i++) {
                lines.add(new SourceLine(i + 1, raw[i].trim()));
            }
        }

        ParseResult run() {
            if (!readHeader()) {
                log.debug("No content after comments, returning an empty diagram");
                return new ParseResult(diagram, warnings);
            }

            List<Statement> statements = new ArrayList<>();
            parseStatements(statements, null);
            if (currentBox != null) {
                throw new DiagramSyntaxException(currentBox.opener.number(), currentBox.opener.text(),
                    "Unterminated 'box'");
            }

            for (Participant created : pendingCreates) {
                diagram.addParticipant(created);
            }
            for (String id : destroyed) {
                diagram.findParticipant(id)
                    .ifPresent(p -> diagram.updateParticipant(p.withDestroyed(true)));
            }
            statements.forEach(diagram::addStatement);
            return new ParseResult(diagram, warnings);
        }

        /**
         * Consumes leading blank and comment lines plus the header.
         *
         * @return false when the input holds no content line at all
         */
        private boolean readHeader() {
            while (position < lines.size()) {
                SourceLine line = lines.get(position++);
                if (line.isBlank()) {
                    continue;
                }
                if (line.isComment()) {
                    handleComment(line);
                    continue;
                }
                if (!LinePatterns.HEADER.equals(line.text())) {
                    throw new DiagramSyntaxException(line.number(), line.text(),
                        "Expected '" + LinePatterns.HEADER + "' header");
                }
                return true;
            }
            return false;
        }

        /**
         * Parses statements into {@code container} until a terminator for {@code open} is reached.
         *
         * @param container target statement list
         * @param open innermost open block, null at top level
         * @return what ended the statement list
         */
        private Terminator parseStatements(List<Statement> container, BlockType open) {
            while (position < lines.size()) {
                SourceLine line = lines.get(position++);
                String text = line.text();
                if (line.isBlank()) {
                    continue;
                }
                if (line.isComment()) {
                    handleComment(line);
                    continue;
                }
                if (currentBox != null) {
                    parseBoxLine(line);
                    continue;
                }
                if (LinePatterns.END.equals(text)) {
                    if (open == null) {
                        throw new DiagramSyntaxException(line.number(), text, "Unmatched 'end'");
                    }
                    return Terminator.END;
                }

                Matcher separator = LinePatterns.SEPARATOR.matcher(text);
                if (separator.matches()) {
                    if (open != null && separator.group(1).equals(open.separator())) {
                        separatorLabel = trimToNull(separator.group(2));
                        return Terminator.SEPARATOR;
                    }
                    warn(line, WarningType.MISPLACED_SEPARATOR, "'" + separator.group(1) + "' outside "
                        + (open == null ? "any block" : "'" + open.keyword() + "' block"));
                    continue;
                }

                Matcher opener = LinePatterns.BLOCK_OPENER.matcher(text);
                if (opener.matches()) {
                    BlockType type = BlockType.fromKeyword(opener.group(1)).orElseThrow();
                    container.add(parseBlock(line, type, trimToNull(opener.group(2))));
                    continue;
                }

                Matcher box = LinePatterns.BOX.matcher(text);
                if (box.matches()) {
                    if (open != null) {
                        throw new DiagramSyntaxException(line.number(), text,
                            "'box' is not allowed inside a '" + open.keyword() + "' block");
                    }
                    openBox(line, trimToNull(box.group(1)));
                    continue;
                }

                parseSimpleStatement(line, container);
            }
            return Terminator.EOF;
        }

        private ControlBlock parseBlock(SourceLine opener, BlockType type, String label) {
            log.debug("Parsing '{}' block at line {}", type.keyword(), opener.number());
            String color = type == BlockType.RECT ? label : null;
            String branchLabel = type == BlockType.RECT ? null : label;
            List<Branch> branches = new ArrayList<>();

            while (true) {
                List<Statement> body = new ArrayList<>();
                Terminator terminator = parseStatements(body, type);
                branches.add(new Branch(branchLabel, body));
                switch (terminator) {
                    case END:
                        return new ControlBlock(type, color, branches);
                    case SEPARATOR:
                        branchLabel = separatorLabel;
                        break;
                    case EOF:
                    default:
                        throw new DiagramSyntaxException(opener.number(), opener.text(),
                            "Unterminated '" + type.keyword() + "' block");
                }
            }
        }

        // ------------------------------------------------------------ boxes

        private void openBox(SourceLine line, String rest) {
            String color = null;
            String description = null;
            if (rest != null) {
                Matcher colorMatcher = LinePatterns.BOX_COLOR.matcher(rest);
                String[] words = rest.split("\\s+", 2);
                if (colorMatcher.matches()) {
                    color = colorMatcher.group(1);
                    description = trimToNull(colorMatcher.group(2));
                } else if (LinePatterns.isNamedColor(words[0])) {
                    color = words[0];
                    description = words.length > 1 ? trimToNull(words[1]) : null;
                } else {
                    description = rest;
                }
            }
            String id = "box-" + (diagram.boxes().size() + 1);
            currentBox = new OpenBox(line, id, color, description);
            log.debug("Opened box {} at line {}", id, line.number());
        }

        private void parseBoxLine(SourceLine line) {
            String text = line.text();
            if (LinePatterns.END.equals(text)) {
                diagram.addBox(new Box(currentBox.id, currentBox.color, currentBox.description, currentBox.members));
                currentBox = null;
                return;
            }
            if (LinePatterns.BOX.matcher(text).matches()) {
                throw new DiagramSyntaxException(line.number(), text, "Boxes cannot be nested");
            }
            Matcher participant = LinePatterns.PARTICIPANT.matcher(text);
            if (participant.matches()) {
                declare(line, participant);
                return;
            }
            warn(line, WarningType.UNRECOGNIZED_LINE, "Only participant declarations are allowed inside a box");
        }

        // ------------------------------------------------------------ simple statements

        private void parseSimpleStatement(SourceLine line, List<Statement> container) {
            String text = line.text();
            if (LinePatterns.AUTONUMBER.equals(text)) {
                diagram.setAutonumber(true);
                return;
            }

            Matcher m = LinePatterns.PARTICIPANT.matcher(text);
            if (m.matches()) {
                declare(line, m);
                return;
            }
            m = LinePatterns.CREATE.matcher(text);
            if (m.matches()) {
                create(line, m, container);
                return;
            }
            m = LinePatterns.DESTROY.matcher(text);
            if (m.matches()) {
                destroyed.add(m.group(1));
                container.add(new DestroyStatement(m.group(1)));
                return;
            }
            m = LinePatterns.ACTIVATION.matcher(text);
            if (m.matches()) {
                container.add(new ActivationStatement(m.group(2), "activate".equals(m.group(1))));
                return;
            }
            m = LinePatterns.NOTE.matcher(text);
            if (m.matches()) {
                parseNote(line, m).ifPresent(container::add);
                return;
            }
            m = LinePatterns.LINK.matcher(text);
            if (m.matches()) {
                addLinks(line, m.group(1), List.of(new Link(m.group(2), m.group(3).trim())));
                return;
            }
            m = LinePatterns.LINKS.matcher(text);
            if (m.matches()) {
                parseLinks(line, m.group(1), m.group(2));
                return;
            }

            parseMessage(line).ifPresent(container::add);
        }

        private void declare(SourceLine line, Matcher m) {
            String id = m.group(2);
            if (isDeclared(id)) {
                warn(line, WarningType.DUPLICATE_PARTICIPANT, "Participant '" + id + "' is already declared");
                return;
            }
            ParticipantKind kind = ParticipantKind.fromKeyword(m.group(1)).orElseThrow();
            Participant participant = Participant.declared(id, trimToNull(m.group(3)), kind);
            if (currentBox != null) {
                participant = participant.withBoxId(currentBox.id);
                currentBox.members.add(id);
            }
            diagram.addParticipant(participant);
        }

        private void create(SourceLine line, Matcher m, List<Statement> container) {
            String id = m.group(2);
            if (isDeclared(id)) {
                warn(line, WarningType.DUPLICATE_PARTICIPANT, "Participant '" + id + "' is already declared");
                return;
            }
            ParticipantKind kind = ParticipantKind.fromKeyword(m.group(1)).orElseThrow();
            pendingCreates.add(Participant.declared(id, trimToNull(m.group(3)), kind).withCreated(true));
            container.add(new CreateStatement(id));
        }

        private boolean isDeclared(String id) {
            return diagram.findParticipant(id).isPresent()
                || pendingCreates.stream().anyMatch(p -> p.id().equals(id));
        }

        private Optional<Statement> parseNote(SourceLine line, Matcher m) {
            NotePosition notePosition = NotePosition.fromKeyword(m.group(1)).orElseThrow();
            List<String> targets = Arrays.stream(m.group(2).split(","))
                .map(String::trim)
                .toList();
            if (!targets.stream().allMatch(LinePatterns::isIdentifier)) {
                warn(line, WarningType.UNRECOGNIZED_LINE, "Invalid note target list '" + m.group(2) + "'");
                return Optional.empty();
            }
            if (!notePosition.accepts(targets.size())) {
                warn(line, WarningType.NOTE_CARDINALITY, "Note " + notePosition.keyword() + " takes "
                    + notePosition.describeCardinality() + " participant(s), got " + targets.size());
                return Optional.empty();
            }
            return Optional.of(new Note(notePosition, targets, m.group(3).trim()));
        }

        private void parseLinks(SourceLine line, String id, String json) {
            Map<String, String> entries;
            try {
                entries = JSON_MAPPER.readValue(json, LINK_MAP);
            } catch (JsonProcessingException e) {
                warn(line, WarningType.INVALID_LINKS, "Invalid links JSON: " + e.getOriginalMessage());
                return;
            }
            List<Link> links = new ArrayList<>();
            entries.forEach((label, url) -> {
                if (url != null) {
                    links.add(new Link(label, url));
                }
            });
            addLinks(line, id, links);
        }

        private void addLinks(SourceLine line, String id, List<Link> links) {
            Optional<Participant> stored = diagram.findParticipant(id);
            if (stored.isPresent()) {
                Participant updated = stored.get();
                for (Link link : links) {
                    updated = updated.withLink(link);
                }
                diagram.updateParticipant(updated);
                return;
            }
            for (int i = 0; i < pendingCreates.size(); i++) {
                Participant pending = pendingCreates.get(i);
                if (pending.id().equals(id)) {
                    for (Link link : links) {
                        pending = pending.withLink(link);
                    }
                    pendingCreates.set(i, pending);
                    return;
                }
            }
            warn(line, WarningType.UNKNOWN_PARTICIPANT, "Links for undeclared participant '" + id + "'");
        }

        private Optional<Statement> parseMessage(SourceLine line) {
            String text = line.text();
            int colon = text.indexOf(':');
            String head = colon >= 0 ? text.substring(0, colon) : text;
            String messageText = colon >= 0 ? text.substring(colon + 1).trim() : null;

            Optional<ArrowKind> arrow = ArrowMatcher.find(head);
            if (arrow.isEmpty()) {
                warn(line, WarningType.UNRECOGNIZED_LINE, "Unrecognized line");
                return Optional.empty();
            }
            Optional<ArrowMatcher.ArrowSplit> split = ArrowMatcher.split(head, arrow.get());
            if (split.isEmpty()) {
                warn(line, WarningType.MALFORMED_MESSAGE,
                    "Arrow '" + arrow.get().token() + "' must split the line into exactly two parts");
                return Optional.empty();
            }

            String sender = split.get().left().trim();
            boolean activateSender = sender.endsWith("+");
            boolean deactivateSender = sender.endsWith("-");
            if (activateSender || deactivateSender) {
                sender = sender.substring(0, sender.length() - 1).trim();
            }
            String receiver = split.get().right().trim();
            boolean activateReceiver = receiver.startsWith("+");
            boolean deactivateReceiver = receiver.startsWith("-");
            if (activateReceiver || deactivateReceiver) {
                receiver = receiver.substring(1).trim();
            }

            if (!LinePatterns.isIdentifier(sender) || !LinePatterns.isIdentifier(receiver)) {
                warn(line, WarningType.MALFORMED_MESSAGE,
                    "Invalid sender '" + sender + "' or receiver '" + receiver + "'");
                return Optional.empty();
            }
            return Optional.of(new Message(sender, receiver, arrow.get(), messageText,
                activateSender, deactivateSender, activateReceiver, deactivateReceiver));
        }

        // ------------------------------------------------------------ comments and directives

        private void handleComment(SourceLine line) {
            Matcher directive = LinePatterns.DIRECTIVE.matcher(line.text());
            if (directive.matches()) {
                applyDirective(line, directive.group(1).trim());
            } else {
                diagram.addComment(line.text());
            }
        }

        private void applyDirective(SourceLine line, String content) {
            readDirective(line, content);
            diagram.addDirective(line.text());
        }

        private void readDirective(SourceLine line, String content) {
            JsonNode root;
            try {
                root = JSON_MAPPER.readTree("{" + content + "}");
            } catch (JsonProcessingException e) {
                warn(line, WarningType.INVALID_DIRECTIVE, "Invalid directive: " + e.getOriginalMessage());
                return;
            }
            JsonNode init = root.has("init") ? root.get("init") : root.path("initialize");
            JsonNode mirror = init.path("sequence").path(Diagram.MIRROR_ACTORS_KEY);
            if (mirror.isMissingNode()) {
                mirror = init.path(Diagram.MIRROR_ACTORS_KEY);
            }
            if (mirror.isBoolean()) {
                diagram.setMirrorActors(mirror.booleanValue());
            } else {
                log.debug("Directive at line {} carries no sequence settings", line.number());
            }
        }

        private void warn(SourceLine line, WarningType type, String message) {
            ParseWarning warning = new ParseWarning(line.number(), line.text(), type, message);
            log.warn("Skipping {}: '{}'", warning, line.text());
            warnings.add(warning);
        }

        private static String trimToNull(String value) {
            if (value == null) {
                return null;
            }
            String trimmed = value.trim();
            return trimmed.isEmpty() ? null : trimmed;
        }
    }
}
