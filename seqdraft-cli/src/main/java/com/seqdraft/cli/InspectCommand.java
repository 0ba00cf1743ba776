package com.seqdraft.cli;

import com.seqdraft.core.model.Activation;
import com.seqdraft.core.model.Diagram;
import com.seqdraft.core.model.Participant;
import com.seqdraft.core.parser.ParseResult;
import com.seqdraft.core.resolver.ActivationResolver;
import com.seqdraft.core.resolver.DiagramStatistics;
import com.seqdraft.core.resolver.ParticipantResolver;
import picocli.CommandLine.Command;

import java.io.PrintWriter;
import java.util.List;
import java.util.Optional;

/**
 * Command to print the derived views of a diagram: participant columns, activation bars and counts.
 */
@Command(
    name = "inspect",
    description = "Show resolved participants, activations and statistics",
    mixinStandardHelpOptions = true
)
public class InspectCommand extends DiagramFileCommand {

    @Override
    public Integer call() {
        Optional<String> text = readFile();
        if (text.isEmpty()) {
            return EXIT_IO;
        }
        Optional<ParseResult> result = parse(text.get());
        if (result.isEmpty()) {
            return EXIT_INVALID;
        }
        Diagram diagram = result.get().diagram();
        PrintWriter out = out();

        out.println("Participants:");
        List<Participant> participants = new ParticipantResolver().orderedParticipants(diagram);
        for (Participant p : participants) {
            out.printf("  %d. %s (%s, %s)%s%n", p.insertionOrder() + 1, p.label(), p.kind().keyword(),
                p.explicit() ? "explicit" : "implicit", p.id().equals(p.label()) ? "" : " [" + p.id() + "]");
        }

        out.println("Activations:");
        List<Activation> activations = new ActivationResolver().resolve(diagram);
        if (activations.isEmpty()) {
            out.println("  none");
        }
        for (Activation a : activations) {
            out.printf("  %s: statements %d-%d, level %d%n", a.participantId(), a.startIndex(), a.endIndex(),
                a.nestLevel());
        }

        DiagramStatistics stats = DiagramStatistics.of(diagram);
        out.println("Statistics:");
        out.printf("  participants: %d (%d implicit)%n", stats.totalParticipants(), stats.implicitParticipants());
        out.printf("  statements: %d%n", stats.statements());
        out.printf("  messages: %d%n", stats.messages());
        out.printf("  notes: %d%n", stats.notes());
        out.printf("  control blocks: %d (max depth %d)%n", stats.controlBlocks(), stats.maxDepth());
        out.printf("  boxes: %d%n", stats.boxes());
        out.printf("  warnings: %d%n", result.get().warnings().size());
        out.flush();
        return EXIT_OK;
    }
}
