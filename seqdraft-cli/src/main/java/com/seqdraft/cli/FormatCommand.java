package com.seqdraft.cli;

import com.seqdraft.core.config.ConfigLoader;
import com.seqdraft.core.config.SeqDraftConfig;
import com.seqdraft.core.generator.DiagramGenerator;
import com.seqdraft.core.generator.GeneratedDiagram;
import com.seqdraft.core.generator.Generators;
import com.seqdraft.core.parser.ParseResult;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Command to parse a diagram and write it back through a generator.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Print canonical text
 * seqdraft format checkout.mmd
 *
 * # Write a Markdown document
 * seqdraft format checkout.mmd -f markdown -o docs/checkout.md
 * }</pre>
 */
@Command(
    name = "format",
    description = "Parse a diagram and write it in canonical form",
    mixinStandardHelpOptions = true
)
public class FormatCommand extends DiagramFileCommand {

    private static final Logger log = LoggerFactory.getLogger(FormatCommand.class);

    @Option(names = {"-o", "--output"}, description = "Output file (default: standard output)")
    private Path output;

    @Option(names = {"-f", "--format"}, description = "Generator id: mermaid or markdown (default: from config)")
    private String format;

    @Option(names = {"-c", "--config"}, description = "Configuration file (seqdraft.yaml)")
    private Path configFile;

    @Override
    public Integer call() {
        SeqDraftConfig config = configFile != null ? ConfigLoader.load(configFile) : SeqDraftConfig.defaults();
        String generatorId = format != null ? format : config.generator().formatOrDefault();

        Optional<DiagramGenerator> generator = Generators.find(generatorId);
        if (generator.isEmpty()) {
            log.error("Unknown format: {}", generatorId);
            err().println("Unknown format '" + generatorId + "'. Run 'seqdraft list' for available generators.");
            return EXIT_INVALID;
        }

        Optional<String> text = readFile();
        if (text.isEmpty()) {
            return EXIT_IO;
        }
        Optional<ParseResult> result = parse(text.get());
        if (result.isEmpty()) {
            return EXIT_INVALID;
        }
        result.get().warnings().forEach(w -> err().println(file + ": " + w));

        GeneratedDiagram generated = generator.get().generate(result.get().diagram(),
            config.generator().toGeneratorConfig());
        if (output == null) {
            out().print(generated.content());
            out().flush();
            return EXIT_OK;
        }

        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(output, generated.content());
            log.info("Wrote {} output to {}", generator.get().getId(), output);
            return EXIT_OK;
        } catch (IOException e) {
            log.error("Failed to write {}: {}", output, e.getMessage());
            err().println("Cannot write " + output + ": " + e.getMessage());
            return EXIT_IO;
        }
    }
}
