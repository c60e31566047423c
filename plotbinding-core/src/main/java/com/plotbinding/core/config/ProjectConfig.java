package com.plotbinding.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.plotbinding.core.resources.DeploymentMode;

import java.util.Optional;

/**
 * Root configuration of a PlotBinding project.
 *
 * <p>Loaded from {@code plotbinding.yaml}. Chooses how BokehJS assets are delivered
 * and where documents are written.
 *
 * <p>The BokehJS build itself is packaged separately. The {@code inline},
 * {@code relative} and {@code absolute} modes need it on the class path, with
 * {@code resources.root} pointing at it. The {@code cdn} modes need no local assets.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * resources:
 *   mode: inline-dev
 *   root: "bokehjs"
 *
 * output:
 *   format: html
 *   file: "./build/resources.html"
 * }</pre>
 *
 * @param resources asset resolution settings
 * @param output bundle output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectConfig(
    @JsonProperty("resources") ResourcesConfig resources,
    @JsonProperty("output") OutputConfig output
) {
    /**
     * Creates the default configuration: CDN assets, HTML written to standard output.
     *
     * @return default configuration
     */
    public static ProjectConfig defaults() {
        return new ProjectConfig(
            new ResourcesConfig(DeploymentMode.DEFAULT.name(), ""),
            new OutputConfig("html", null)
        );
    }

    /**
     * Returns resource settings, falling back to defaults when the section is absent.
     *
     * @return resource settings, never null
     */
    public ResourcesConfig resourcesOrDefaults() {
        return resources != null ? resources : defaults().resources();
    }

    /**
     * Returns output settings, falling back to defaults when the section is absent.
     *
     * @return output settings, never null
     */
    public OutputConfig outputOrDefaults() {
        return output != null ? output : defaults().output();
    }

    /**
     * Asset resolution settings.
     *
     * @param mode deployment mode selector, e.g. {@code cdn-dev}
     * @param root class path prefix of the externally packaged BokehJS build
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ResourcesConfig(
        @JsonProperty("mode") String mode,
        @JsonProperty("root") String root
    ) {
        /**
         * Looks up the configured mode.
         *
         * @return the mode, or empty if it is unset or unknown
         */
        public Optional<DeploymentMode> deploymentMode() {
            return DeploymentMode.fromString(mode);
        }

        public String rootOrDefault() {
            return root != null ? root : "";
        }
    }

    /**
     * Bundle output settings.
     *
     * @param format renderer id, {@code html} or {@code json}
     * @param file target file, null for standard output
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("format") String format,
        @JsonProperty("file") String file
    ) {}
}
