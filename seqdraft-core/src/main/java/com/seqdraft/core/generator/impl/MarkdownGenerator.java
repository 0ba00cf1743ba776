package com.seqdraft.core.generator.impl;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.seqdraft.core.generator.DiagramGenerator;
import com.seqdraft.core.generator.GeneratedDiagram;
import com.seqdraft.core.generator.GeneratorConfig;
import com.seqdraft.core.model.Box;
import com.seqdraft.core.model.Diagram;
import com.seqdraft.core.model.Participant;
import com.seqdraft.core.resolver.DiagramStatistics;
import com.seqdraft.core.resolver.ParticipantResolver;

/**
 * Generates a Markdown document for a sequence diagram.
 *
 * <p>The document holds a title, the canonical diagram text in a {@code ```mermaid} fence,
 * a participant table in column order and a statistics table. The title comes from
 * {@link GeneratorConfig#title()} and defaults to "Sequence Diagram".
 */
public class MarkdownGenerator implements DiagramGenerator {

    private static final Logger log = LoggerFactory.getLogger(MarkdownGenerator.class);

    private static final String DEFAULT_TITLE = "Sequence Diagram";
    private static final String DOCUMENT_NAME = "sequence-diagram";

    // Markdown formatting
    private static final String H1 = "# ";
    private static final String H2 = "## ";
    private static final String NEWLINE = "\n";
    private static final String DOUBLE_NEWLINE = "\n\n";
    private static final String CODE_BLOCK_START = "```mermaid\n";
    private static final String CODE_BLOCK_END = "```\n";
    private static final String PIPE = "|";
    private static final String SPACE = " ";
    private static final String NONE = "-";

    // Sections
    private static final String PARTICIPANTS_SECTION = "Participants";
    private static final String SUMMARY_SECTION = "Summary";
    private static final String NO_PARTICIPANTS = "No participants in this diagram.";

    private final MermaidGenerator mermaidGenerator = new MermaidGenerator();
    private final ParticipantResolver participantResolver = new ParticipantResolver();

    @Override
    public String getId() {
        return "markdown";
    }

    @Override
    public String getDisplayName() {
        return "Markdown Documentation Generator";
    }

    @Override
    public String getFileExtension() {
        return "md";
    }

    @Override
    public GeneratedDiagram generate(Diagram diagram, GeneratorConfig config) {
        Objects.requireNonNull(diagram, "diagram must not be null");
        Objects.requireNonNull(config, "config must not be null");

        log.debug("Generating Markdown documentation: {}", diagram);

        StringBuilder sb = new StringBuilder();
        String title = config.title() != null && !config.title().isBlank() ? config.title() : DEFAULT_TITLE;
        appendHeader(sb, H1, title);

        sb.append(CODE_BLOCK_START).append(mermaidGenerator.render(diagram, config)).append(CODE_BLOCK_END)
            .append(NEWLINE);

        appendParticipantTable(sb, diagram);
        appendSummaryTable(sb, DiagramStatistics.of(diagram));

        log.info("Generated Markdown documentation: {}", title);
        return new GeneratedDiagram(DOCUMENT_NAME, sb.toString(), getFileExtension());
    }

    private void appendHeader(StringBuilder sb, String prefix, String title) {
        sb.append(prefix).append(title).append(DOUBLE_NEWLINE);
    }

    private void appendParticipantTable(StringBuilder sb, Diagram diagram) {
        appendHeader(sb, H2, PARTICIPANTS_SECTION);
        List<Participant> participants = participantResolver.orderedParticipants(diagram);
        if (participants.isEmpty()) {
            sb.append(NO_PARTICIPANTS).append(DOUBLE_NEWLINE);
            return;
        }
        appendTableRow(sb, "Id", "Label", "Kind", "Declared", "Box");
        appendTableDivider(sb, 5);
        for (Participant p : participants) {
            appendTableRow(sb,
                p.id(),
                p.label(),
                p.kind().keyword(),
                declaration(p),
                boxName(diagram, p));
        }
        sb.append(NEWLINE);
    }

    private static String declaration(Participant p) {
        if (!p.explicit()) {
            return "implicit";
        }
        String declared = p.created() ? "created" : "explicit";
        return p.destroyed() ? declared + ", destroyed" : declared;
    }

    private static String boxName(Diagram diagram, Participant p) {
        return diagram.boxes().stream()
            .filter(box -> box.participantIds().contains(p.id()))
            .findFirst()
            .map(MarkdownGenerator::describe)
            .orElse(NONE);
    }

    private static String describe(Box box) {
        if (box.description() != null) {
            return box.description();
        }
        return box.color() != null ? box.color() : box.id();
    }

    private void appendSummaryTable(StringBuilder sb, DiagramStatistics stats) {
        appendHeader(sb, H2, SUMMARY_SECTION);
        appendTableRow(sb, "Metric", "Count");
        appendTableDivider(sb, 2);
        appendTableRow(sb, "Participants", String.valueOf(stats.totalParticipants()));
        appendTableRow(sb, "Implicit participants", String.valueOf(stats.implicitParticipants()));
        appendTableRow(sb, "Messages", String.valueOf(stats.messages()));
        appendTableRow(sb, "Notes", String.valueOf(stats.notes()));
        appendTableRow(sb, "Control blocks", String.valueOf(stats.controlBlocks()));
        appendTableRow(sb, "Max nesting depth", String.valueOf(stats.maxDepth()));
        appendTableRow(sb, "Activations", String.valueOf(stats.activations()));
    }

    private void appendTableRow(StringBuilder sb, String... columns) {
        sb.append(PIPE);
        for (String col : columns) {
            sb.append(SPACE).append(escapeCell(col)).append(SPACE).append(PIPE);
        }
        sb.append(NEWLINE);
    }

    private void appendTableDivider(StringBuilder sb, int columnCount) {
        sb.append(PIPE);
        for (int i = 0; i < columnCount; i++) {
            sb.append("--------|");
        }
        sb.append(NEWLINE);
    }

    private static String escapeCell(String value) {
        return value.replace("|", "\\|");
    }
}
