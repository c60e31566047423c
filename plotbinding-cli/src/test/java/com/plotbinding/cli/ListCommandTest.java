package com.plotbinding.cli;

import com.plotbinding.PlotBindingCLI;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ListCommand}.
 */
class ListCommandTest {

    private CommandLine commandLine;
    private StringWriter out;

    @BeforeEach
    void setUp() {
        commandLine = PlotBindingCLI.createCommandLine();
        out = new StringWriter();
        commandLine.setOut(new PrintWriter(out));
    }

    @Test
    void listModes_printsAllEightModes() {
        int exitCode = commandLine.execute("-q", "list", "modes");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("cdn (default)", "cdn-dev", "inline", "inline-dev",
                "relative", "relative-dev", "absolute", "absolute-dev")
            .contains("Base URL: http://cdn.pydata.org/bokeh/release/");
    }

    @Test
    void listComponents_showsCompilerWithoutStylesheet() {
        int exitCode = commandLine.execute("-q", "list", "components");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("bokeh (CORE)")
            .contains("bokeh-widgets (WIDGETS)")
            .contains("bokeh-compiler (COMPILER)")
            .containsOnlyOnce("Forms: js%n".formatted());
    }

    @Test
    void listRenderers_showsBuiltInRenderers() {
        int exitCode = commandLine.execute("-q", "list", "renderers");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("html (.html)", "json (.json)");
    }

    @Test
    void listUnknownType_returnsError() {
        assertThat(commandLine.execute("-q", "list", "plugins")).isEqualTo(1);
    }
}
