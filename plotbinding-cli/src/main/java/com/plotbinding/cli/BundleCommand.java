package com.plotbinding.cli;

import com.plotbinding.core.config.ConfigLoader;
import com.plotbinding.core.config.ProjectConfig;
import com.plotbinding.core.model.CustomModelReference;
import com.plotbinding.core.model.ModelReference;
import com.plotbinding.core.model.PlotReference;
import com.plotbinding.core.model.WidgetReference;
import com.plotbinding.core.renderer.BundleRenderer;
import com.plotbinding.core.renderer.BundleRenderers;
import com.plotbinding.core.resources.AssetBundle;
import com.plotbinding.core.resources.DeploymentMode;
import com.plotbinding.core.resources.ResourceResolutionException;
import com.plotbinding.core.resources.ResourceResolver;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Command to resolve the asset bundle for a document.
 *
 * <p>The document always contains a plot. Flags add a widget or custom models so the
 * optional components are pulled in.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # CDN tags for a plot with widgets
 * plotbinding bundle --widgets
 *
 * # Relative file paths, unminified, written to a file
 * plotbinding bundle --mode relative-dev --output build/head.html
 * }</pre>
 */
@Command(
    name = "bundle",
    description = "Resolve BokehJS scripts and stylesheets for a document",
    mixinStandardHelpOptions = true
)
public class BundleCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(BundleCommand.class);

    static final int EXIT_RESOLUTION_FAILED = 1;
    static final int EXIT_USAGE = 2;

    @Spec
    private CommandSpec spec;

    @Option(names = {"-m", "--mode"}, description = "Deployment mode (overrides config): ${COMPLETION-CANDIDATES}",
        completionCandidates = ModeCandidates.class)
    private String modeName;

    @Option(names = {"-w", "--widgets"}, description = "Document contains a widget")
    private boolean widgets;

    @Option(names = {"--compiled-script"}, description = "Document contains a custom model written in CoffeeScript")
    private boolean compiledScript;

    @Option(names = {"--custom-js"}, description = "Document contains a custom model written in JavaScript")
    private boolean customJavaScript;

    @Option(names = {"-f", "--format"}, description = "Output format: html or json (overrides config)")
    private String format;

    @Option(names = {"-o", "--output"}, description = "Output file (default: standard output)")
    private Path outputFile;

    @Option(names = {"-r", "--root"}, description = "Class path root of the bundled BokehJS build (overrides config)")
    private String root;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: plotbinding.yaml)")
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        ProjectConfig config = ConfigLoader.load(configPath);

        Optional<DeploymentMode> mode = selectMode(config);
        if (mode.isEmpty()) {
            err.println("✗ No such mode: " + modeName);
            err.println("  Use 'plotbinding list modes' to see available modes");
            return EXIT_USAGE;
        }

        String rendererId = format != null ? format : config.outputOrDefaults().format();
        Optional<BundleRenderer> renderer = BundleRenderers.find(rendererId);
        if (renderer.isEmpty()) {
            err.println("✗ Unknown format: " + rendererId);
            return EXIT_USAGE;
        }

        String resourceRoot = root != null ? root : config.resourcesOrDefaults().rootOrDefault();
        List<ModelReference> refs = documentReferences();

        try {
            log.info("Resolving bundle in mode '{}' for {} models", mode.get().name(), refs.size());
            ResourceResolver resolver = new ResourceResolver(Thread.currentThread().getContextClassLoader(), resourceRoot);
            AssetBundle bundle = resolver.resolve(mode.get(), refs);
            String rendered = renderer.get().render(bundle);

            Path target = outputFile != null ? outputFile : configuredOutputFile(config);
            if (target == null) {
                out.print(rendered);
                out.flush();
            } else {
                writeOutput(target, rendered);
                err.println("✓ Wrote " + bundle.scripts().size() + " scripts and "
                    + bundle.styles().size() + " styles to " + target);
            }
            return 0;
        } catch (ResourceResolutionException e) {
            log.error("Bundle resolution failed for {}: {}", e.getResourcePath(), e.getMessage());
            log.debug("Resolution failure details", e);
            err.println("✗ Bundle resolution failed: " + e.getMessage());
            return EXIT_RESOLUTION_FAILED;
        } catch (IllegalStateException e) {
            log.error("Bundle resolution failed: {}", e.getMessage());
            log.debug("Resolution failure details", e);
            err.println("✗ Bundle resolution failed: " + e.getMessage());
            return EXIT_RESOLUTION_FAILED;
        }
    }

    /**
     * An explicit but unknown {@code --mode} is an error. An unknown mode in the
     * configuration file falls back to the default.
     */
    private Optional<DeploymentMode> selectMode(ProjectConfig config) {
        if (modeName != null) {
            return DeploymentMode.fromString(modeName);
        }
        ProjectConfig.ResourcesConfig resources = config.resourcesOrDefaults();
        Optional<DeploymentMode> configured = resources.deploymentMode();
        if (configured.isEmpty()) {
            log.warn("Unknown deployment mode in configuration: {}. Using '{}'.",
                resources.mode(), DeploymentMode.DEFAULT.name());
            return Optional.of(DeploymentMode.DEFAULT);
        }
        return configured;
    }

    private List<ModelReference> documentReferences() {
        List<ModelReference> refs = new ArrayList<>();
        refs.add(new PlotReference("plot"));
        if (widgets) {
            refs.add(new WidgetReference("widget", "Slider"));
        }
        if (compiledScript) {
            refs.add(new CustomModelReference("custom-coffee",
                CustomModelReference.Implementation.coffeeScript("class CustomView extends Bokeh.PlotView")));
        }
        if (customJavaScript) {
            refs.add(new CustomModelReference("custom-js",
                CustomModelReference.Implementation.javaScript("var CustomView = Bokeh.PlotView.extend({});")));
        }
        return refs;
    }

    private static Path configuredOutputFile(ProjectConfig config) {
        String file = config.outputOrDefaults().file();
        return file == null || file.isBlank() ? null : Paths.get(file);
    }

    private static void writeOutput(Path target, String content) {
        log.debug("Writing bundle to: {}", target);
        try {
            Path parentDir = target.toAbsolutePath().getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }
            Files.writeString(target, content);
            log.info("Wrote file: {} ({} bytes)", target, content.length());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + target, e);
        }
    }

    /**
     * Mode names for help text and shell completion.
     */
    public static class ModeCandidates extends ArrayList<String> {
        public ModeCandidates() {
            DeploymentMode.values().forEach(mode -> add(mode.name()));
        }
    }
}
