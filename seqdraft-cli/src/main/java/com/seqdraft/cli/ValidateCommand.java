package com.seqdraft.cli;

import com.seqdraft.core.config.ConfigLoader;
import com.seqdraft.core.parser.ParseResult;
import com.seqdraft.core.parser.ParseWarning;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Command to check a diagram file.
 *
 * <p>Structural errors always fail. Skipped lines only fail with {@code --strict} or
 * {@code parser.strict: true} in the configuration.
 */
@Command(
    name = "validate",
    description = "Report skipped lines and structural errors of a diagram",
    mixinStandardHelpOptions = true
)
public class ValidateCommand extends DiagramFileCommand {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Option(names = "--strict", description = "Fail when any line was skipped")
    private boolean strict;

    @Option(names = {"-c", "--config"}, description = "Configuration file (seqdraft.yaml)")
    private Path configFile;

    @Override
    public Integer call() {
        boolean failOnWarnings = strict
            || (configFile != null && ConfigLoader.load(configFile).parser().isStrict());
        log.info("Validating diagram: {}", file);

        Optional<String> text = readFile();
        if (text.isEmpty()) {
            return EXIT_IO;
        }
        Optional<ParseResult> result = parse(text.get());
        if (result.isEmpty()) {
            return EXIT_INVALID;
        }

        for (ParseWarning warning : result.get().warnings()) {
            out().println(file + ": " + warning);
        }
        int count = result.get().warnings().size();
        if (count == 0) {
            out().println(file + ": valid");
            return EXIT_OK;
        }
        out().println(file + ": " + count + (count == 1 ? " line" : " lines") + " skipped");
        return failOnWarnings ? EXIT_INVALID : EXIT_OK;
    }
}
