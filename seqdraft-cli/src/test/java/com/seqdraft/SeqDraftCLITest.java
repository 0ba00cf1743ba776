package com.seqdraft;

import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SeqDraftCLI} global options.
 */
class SeqDraftCLITest {

    @Test
    void parseArgs_readsGlobalOptions() {
        CommandLine commandLine = SeqDraftCLI.newCommandLine();
        commandLine.parseArgs("-v", "list");
        SeqDraftCLI cli = commandLine.getCommand();

        assertThat(cli.isVerbose()).isTrue();
        assertThat(cli.isQuiet()).isFalse();
    }

    @Test
    void run_withoutSubcommand_printsBanner() {
        StringWriter out = new StringWriter();
        CommandLine commandLine = SeqDraftCLI.newCommandLine();
        commandLine.setOut(new PrintWriter(out, true));

        assertThat(commandLine.execute()).isZero();
        assertThat(out.toString()).contains("seqdraft - sequence diagram formatter");
    }

    @Test
    void run_quiet_suppressesBanner() {
        StringWriter out = new StringWriter();
        CommandLine commandLine = SeqDraftCLI.newCommandLine();
        commandLine.setOut(new PrintWriter(out, true));

        assertThat(commandLine.execute("-q")).isZero();
        assertThat(out.toString()).isEmpty();
        assertThat(((SeqDraftCLI) commandLine.getCommand()).isQuiet()).isTrue();
    }
}
