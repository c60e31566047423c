package com.plotbinding.cli;

import com.plotbinding.core.model.AssetComponent;
import com.plotbinding.core.model.AssetKind;
import com.plotbinding.core.renderer.BundleRenderer;
import com.plotbinding.core.renderer.BundleRenderers;
import com.plotbinding.core.resources.DeploymentMode;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * Command to list deployment modes, asset components or bundle renderers.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * plotbinding list modes
 * plotbinding list components
 * plotbinding list renderers
 * }</pre>
 */
@Command(
    name = "list",
    description = "List deployment modes, asset components or renderers",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(
        index = "0",
        description = "Type to list: modes, components, or renderers"
    )
    private String type;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        int exitCode = switch (type.toLowerCase()) {
            case "modes", "mode" -> listModes(out);
            case "components", "component" -> listComponents(out);
            case "renderers", "renderer" -> listRenderers(out);
            default -> {
                log.error("Unknown type: {}. Use: modes, components, or renderers", type);
                yield 1;
            }
        };
        out.flush();
        return exitCode;
    }

    private int listModes(PrintWriter out) {
        out.println("Deployment Modes:");
        out.println();

        for (DeploymentMode mode : DeploymentMode.values()) {
            String marker = mode.equals(DeploymentMode.DEFAULT) ? " (default)" : "";
            out.printf("  • %s%s%n", mode.name(), marker);
            out.printf("    Location: %s%n", mode.locationKind());
            out.printf("    Minified: %s, Log level: %s, Indent: %d%n",
                mode.minified(), mode.logLevel().clientName(), mode.indent());
            if (mode.baseUrl() != null) {
                out.printf("    Base URL: %s%n", mode.baseUrl());
            }
            out.println();
        }
        return 0;
    }

    private int listComponents(PrintWriter out) {
        out.println("Asset Components:");
        out.println();

        for (AssetComponent component : AssetComponent.values()) {
            String forms = component.kinds().stream()
                .map(AssetKind::extension)
                .collect(Collectors.joining(", "));
            out.printf("  • %s (%s)%n", component.assetName(), component);
            out.printf("    Forms: %s%n", forms);
            out.println();
        }
        return 0;
    }

    private int listRenderers(PrintWriter out) {
        out.println("Available Renderers:");
        out.println();

        List<BundleRenderer> renderers = BundleRenderers.all();
        for (BundleRenderer renderer : renderers) {
            out.printf("  • %s (.%s)%n", renderer.getId(), renderer.getFileExtension());
        }

        if (renderers.isEmpty()) {
            out.println("  No renderers found.");
        }
        return 0;
    }
}
