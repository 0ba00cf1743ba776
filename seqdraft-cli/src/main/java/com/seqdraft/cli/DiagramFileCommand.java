package com.seqdraft.cli;

import com.seqdraft.core.parser.DiagramSyntaxException;
import com.seqdraft.core.parser.ParseResult;
import com.seqdraft.core.parser.SequenceDiagramParser;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Base class for commands that read one diagram file.
 *
 * <p>Exit codes: {@value #EXIT_OK} on success, {@value #EXIT_INVALID} for structural errors and
 * failed checks, {@value #EXIT_IO} when a file cannot be read or written.
 */
abstract class DiagramFileCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_INVALID = 1;
    static final int EXIT_IO = 2;

    private static final Logger log = LoggerFactory.getLogger(DiagramFileCommand.class);

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", description = "Diagram file to read")
    Path file;

    private final SequenceDiagramParser parser = new SequenceDiagramParser();

    PrintWriter out() {
        return spec.commandLine().getOut();
    }

    PrintWriter err() {
        return spec.commandLine().getErr();
    }

    /**
     * Reads the diagram file as text.
     *
     * @return file content, empty after reporting an I/O failure
     */
    Optional<String> readFile() {
        try {
            return Optional.of(Files.readString(file));
        } catch (IOException e) {
            log.error("Failed to read diagram file {}: {}", file, e.getMessage());
            err().println("Cannot read " + file + ": " + e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Parses diagram text.
     *
     * @param text diagram text
     * @return parse result, empty after reporting a structural error
     */
    Optional<ParseResult> parse(String text) {
        try {
            return Optional.of(parser.parse(text));
        } catch (DiagramSyntaxException e) {
            log.error("Structural error in {}: {}", file, e.getMessage());
            err().println(file + ": " + e.getMessage());
            err().println("    " + e.getLine());
            return Optional.empty();
        }
    }
}
