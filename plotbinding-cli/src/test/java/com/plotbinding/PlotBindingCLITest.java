package com.plotbinding;

import ch.qos.logback.classic.Level;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link PlotBindingCLI}.
 */
class PlotBindingCLITest {

    private final ch.qos.logback.classic.Logger root =
        (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

    @AfterEach
    void resetLogging() {
        root.setLevel(Level.INFO);
    }

    @Test
    void verbose_setsDebugLevelBeforeSubcommandRuns() {
        CommandLine commandLine = PlotBindingCLI.createCommandLine();
        commandLine.setOut(new PrintWriter(new StringWriter()));

        int exitCode = commandLine.execute("-v", "list", "modes");

        assertThat(exitCode).isZero();
        assertThat(root.getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void quiet_setsErrorLevel() {
        CommandLine commandLine = PlotBindingCLI.createCommandLine();
        commandLine.setOut(new PrintWriter(new StringWriter()));

        commandLine.execute("-q", "list", "components");

        assertThat(root.getLevel()).isEqualTo(Level.ERROR);
    }

    @Test
    void version_printsVersion() {
        CommandLine commandLine = PlotBindingCLI.createCommandLine();
        StringWriter out = new StringWriter();
        commandLine.setOut(new PrintWriter(out));

        int exitCode = commandLine.execute("--version");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("PlotBinding 0.1.0-SNAPSHOT");
    }
}
