package com.plotbinding.cli;

import com.plotbinding.core.config.ConfigLoader;
import com.plotbinding.core.config.ProjectConfig;
import com.plotbinding.core.resources.AssetLayoutValidator;
import com.plotbinding.core.resources.LayoutReport;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Command to check that the bundled BokehJS build is complete.
 *
 * <p>This library does not ship the BokehJS build. The {@code js/} and {@code css/}
 * directories come from a separately packaged build on the class path, and
 * {@code --root} or {@code resources.root} in {@code plotbinding.yaml} must point at it.
 * Without one, every asset is reported missing and only the {@code cdn} modes resolve.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * plotbinding validate --root static/bokehjs
 * }</pre>
 */
@Command(
    name = "validate",
    description = "Check that every BokehJS asset is present on the class path",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Spec
    private CommandSpec spec;

    @Option(names = {"-r", "--root"}, description = "Class path root of the bundled BokehJS build (overrides config)")
    private String root;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: plotbinding.yaml)")
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();

        String resourceRoot = root;
        if (resourceRoot == null) {
            ProjectConfig config = ConfigLoader.load(configPath);
            resourceRoot = config.resourcesOrDefaults().rootOrDefault();
        }

        log.info("Validating asset layout under: '{}'", resourceRoot);
        LayoutReport report = new AssetLayoutValidator(Thread.currentThread().getContextClassLoader())
            .validate(resourceRoot);

        out.printf("Checked %d assets, %d found%n", report.expected().size(), report.foundCount());
        for (String missing : report.missing()) {
            out.println("  ✗ missing: " + missing);
        }
        if (report.isComplete()) {
            out.println("✓ Asset layout complete");
        }
        out.flush();
        return report.isComplete() ? 0 : 1;
    }
}
