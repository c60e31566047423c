package com.plotbinding.core.resources;

import com.plotbinding.core.model.LogLevel;

import java.net.URI;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Strategy for locating BokehJS assets plus its development/production overlay.
 *
 * <p>The development overlay only changes three fields: assets are not minified, the
 * client log level is {@link LogLevel#DEBUG} and generated JSON is indented.
 *
 * <p><b>Named modes:</b>
 * <ul>
 *   <li>{@code cdn}, {@code cdn-dev} - versioned files from the public CDN</li>
 *   <li>{@code inline}, {@code inline-dev} - asset text embedded in the document</li>
 *   <li>{@code relative}, {@code relative-dev} - bundled files, path relative to the working directory</li>
 *   <li>{@code absolute}, {@code absolute-dev} - bundled files, absolute path</li>
 * </ul>
 *
 * @param name selector string of this mode
 * @param locationKind where assets are taken from
 * @param minified whether {@code .min} assets are referenced
 * @param logLevel client log level
 * @param indent JSON indent width, 0 for compact output
 * @param baseUrl base URL of remote assets, null unless {@code locationKind} is {@link LocationKind#REMOTE}
 */
public record DeploymentMode(
    String name,
    LocationKind locationKind,
    boolean minified,
    LogLevel logLevel,
    int indent,
    URI baseUrl
) {
    /** Public CDN hosting released BokehJS builds. */
    public static final URI CDN_URL = URI.create("http://cdn.pydata.org/bokeh/release/");

    public static final DeploymentMode CDN = production("cdn", LocationKind.REMOTE, CDN_URL);
    public static final DeploymentMode CDN_DEV = development("cdn-dev", CDN);
    public static final DeploymentMode INLINE = production("inline", LocationKind.EMBEDDED, null);
    public static final DeploymentMode INLINE_DEV = development("inline-dev", INLINE);
    public static final DeploymentMode RELATIVE = production("relative", LocationKind.LOCAL_RELATIVE, null);
    public static final DeploymentMode RELATIVE_DEV = development("relative-dev", RELATIVE);
    public static final DeploymentMode ABSOLUTE = production("absolute", LocationKind.LOCAL_ABSOLUTE, null);
    public static final DeploymentMode ABSOLUTE_DEV = development("absolute-dev", ABSOLUTE);

    /** Mode used when none is specified. */
    public static final DeploymentMode DEFAULT = CDN;

    private static final List<DeploymentMode> ALL = List.of(
        CDN, CDN_DEV, INLINE, INLINE_DEV, RELATIVE, RELATIVE_DEV, ABSOLUTE, ABSOLUTE_DEV
    );

    /**
     * Compact constructor with validation.
     */
    public DeploymentMode {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(locationKind, "locationKind must not be null");
        Objects.requireNonNull(logLevel, "logLevel must not be null");
        if (indent < 0) {
            throw new IllegalArgumentException("indent must not be negative: " + indent);
        }
        if (locationKind == LocationKind.REMOTE && baseUrl == null) {
            throw new IllegalArgumentException("Remote mode '" + name + "' requires a base URL");
        }
    }

    /**
     * Looks up a named mode. Matching is exact and case-sensitive.
     *
     * @param name selector string such as {@code cdn-dev}
     * @return the mode, or empty if there is no mode with that name
     */
    public static Optional<DeploymentMode> fromString(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return ALL.stream()
            .filter(mode -> mode.name().equals(name))
            .findFirst();
    }

    /**
     * Returns all named modes, production before development for each location kind.
     *
     * @return named modes
     */
    public static List<DeploymentMode> values() {
        return ALL;
    }

    /**
     * Checks whether this mode carries the development overlay.
     *
     * @return true for development modes
     */
    public boolean isDevelopment() {
        return !minified;
    }

    private static DeploymentMode production(String name, LocationKind locationKind, URI baseUrl) {
        return new DeploymentMode(name, locationKind, true, LogLevel.INFO, 0, baseUrl);
    }

    private static DeploymentMode development(String name, DeploymentMode base) {
        return new DeploymentMode(name, base.locationKind(), false, LogLevel.DEBUG, 2, base.baseUrl());
    }
}
