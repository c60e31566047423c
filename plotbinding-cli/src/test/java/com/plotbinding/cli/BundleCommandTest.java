package com.plotbinding.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.plotbinding.PlotBindingCLI;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link BundleCommand}.
 */
class BundleCommandTest {

    @TempDir
    Path tempDir;

    private CommandLine commandLine;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        commandLine = PlotBindingCLI.createCommandLine();
        out = new StringWriter();
        err = new StringWriter();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    private int run(String... args) {
        String[] withConfig = new String[args.length + 2];
        System.arraycopy(args, 0, withConfig, 0, args.length);
        withConfig[args.length] = "--config";
        withConfig[args.length + 1] = tempDir.resolve("missing.yaml").toString();
        return commandLine.execute(withConfig);
    }

    @Test
    void bundle_defaults_printsCdnHtml() {
        int exitCode = run("-q", "bundle");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("href=\"http://cdn.pydata.org/bokeh/release/bokeh-0.8.2.min.css\"")
            .contains("src=\"http://cdn.pydata.org/bokeh/release/bokeh-0.8.2.min.js\"")
            .contains("Bokeh.set_log_level('info');")
            .doesNotContain("bokeh-widgets");
    }

    @Test
    void bundle_widgetsAndCompiledScript_addsOptionalComponents() {
        int exitCode = run("-q", "bundle", "--mode", "cdn-dev", "--widgets", "--compiled-script");

        String html = out.toString();
        assertThat(exitCode).isZero();
        assertThat(html.indexOf("bokeh-0.8.2.js"))
            .isLessThan(html.indexOf("bokeh-widgets-0.8.2.js"));
        assertThat(html.indexOf("bokeh-widgets-0.8.2.js"))
            .isLessThan(html.indexOf("bokeh-compiler-0.8.2.js"));
        assertThat(html.indexOf("bokeh-compiler-0.8.2.js"))
            .isLessThan(html.indexOf("Bokeh.set_log_level('debug');"));
        assertThat(html).doesNotContain("bokeh-compiler-0.8.2.css");
    }

    @Test
    void bundle_customJavaScript_doesNotAddCompiler() {
        int exitCode = run("-q", "bundle", "--custom-js", "--format", "json");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("\"scripts\"")
            .doesNotContain("bokeh-compiler");
    }

    @Test
    void bundle_unknownMode_returnsUsageError() {
        int exitCode = run("-q", "bundle", "--mode", "nonsense");

        assertThat(exitCode).isEqualTo(BundleCommand.EXIT_USAGE);
        assertThat(err.toString()).contains("No such mode: nonsense");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void bundle_unknownFormat_returnsUsageError() {
        int exitCode = run("-q", "bundle", "--format", "xml");

        assertThat(exitCode).isEqualTo(BundleCommand.EXIT_USAGE);
        assertThat(err.toString()).contains("Unknown format: xml");
    }

    @Test
    void bundle_missingAssets_returnsResolutionFailure() {
        int exitCode = run("-q", "bundle", "--mode", "inline", "--root", "no/such/root");

        assertThat(exitCode).isEqualTo(BundleCommand.EXIT_RESOLUTION_FAILED);
        assertThat(err.toString()).contains("no/such/root/js/bokeh.min.js");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void bundle_outputFile_writesRenderedBundle() throws IOException {
        Path target = tempDir.resolve("build/head.html");

        int exitCode = run("-q", "bundle", "--output", target.toString());

        assertThat(exitCode).isZero();
        assertThat(target).exists();
        assertThat(Files.readString(target)).contains("bokeh-0.8.2.min.js");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void bundle_modeFromConfig_isUsed() throws IOException {
        Path config = tempDir.resolve("plotbinding.yaml");
        Files.writeString(config, """
            resources:
              mode: cdn-dev
            output:
              format: json
            """);

        int exitCode = commandLine.execute("-q", "bundle", "--config", config.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("bokeh-0.8.2.js")
            .contains("\"location\" : \"URL\"");
    }

    @Test
    void bundle_unknownModeInConfig_fallsBackToCdn() throws IOException {
        Path config = tempDir.resolve("plotbinding.yaml");
        Files.writeString(config, """
            resources:
              mode: CDN
            """);

        int exitCode = commandLine.execute("-q", "bundle", "--config", config.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("bokeh-0.8.2.min.js");
    }

    @Test
    void bundle_missingAssets_logsErrorWithoutStackTrace() {
        Logger commandLog = (Logger) LoggerFactory.getLogger(BundleCommand.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        commandLog.addAppender(appender);
        try {
            int exitCode = commandLine.execute("bundle", "--mode", "absolute", "--root", "no/such/root",
                "--config", tempDir.resolve("missing.yaml").toString());

            assertThat(exitCode).isEqualTo(BundleCommand.EXIT_RESOLUTION_FAILED);
            assertThat(appender.list)
                .filteredOn(event -> event.getLevel() == Level.ERROR)
                .singleElement()
                .satisfies(event -> {
                    assertThat(event.getFormattedMessage()).contains("no/such/root/js/bokeh.min.js");
                    assertThat(event.getThrowableProxy()).isNull();
                });
        } finally {
            commandLog.detachAppender(appender);
        }
    }
}
