package com.plotbinding.core.resources;

import com.plotbinding.core.model.AssetComponent;
import com.plotbinding.core.model.AssetKind;
import com.plotbinding.core.model.ModelReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Computes the asset bundle a document needs.
 *
 * <p>Component selection:
 * <ol>
 *   <li>{@link AssetComponent#CORE} is always selected</li>
 *   <li>{@link AssetComponent#WIDGETS} if any reference requires widgets</li>
 *   <li>{@link AssetComponent#COMPILER} if any reference requires script compilation</li>
 * </ol>
 *
 * <p>Each selected component is then resolved according to the {@link DeploymentMode}:
 * embedded text, a local file path, or a versioned remote URL. The client log-level
 * snippet always closes the script list.
 *
 * <p>Instances hold only read-only environment and can be shared between threads.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ResourceResolver resolver = new ResourceResolver();
 * AssetBundle bundle = resolver.resolve(DeploymentMode.CDN, List.of(
 *     new PlotReference("p1"),
 *     new WidgetReference("w1", "Slider")
 * ));
 * }</pre>
 */
public class ResourceResolver {

    private static final Logger log = LoggerFactory.getLogger(ResourceResolver.class);

    private final ClassLoader classLoader;
    private final String resourceRoot;
    private final Path workingDirectory;
    private final String version;

    /**
     * Creates a resolver over this library's class path, resolving relative paths
     * against {@code user.dir}.
     */
    public ResourceResolver() {
        this(ResourceResolver.class.getClassLoader(), "");
    }

    /**
     * Creates a resolver looking up assets below a resource root.
     *
     * @param classLoader class loader holding the bundled assets
     * @param resourceRoot resource path prefix, empty for the class path root
     */
    public ResourceResolver(ClassLoader classLoader, String resourceRoot) {
        this(classLoader, resourceRoot, Paths.get(System.getProperty("user.dir")), BokehVersion.get());
    }

    /**
     * Creates a resolver with a fully specified environment.
     *
     * @param classLoader class loader holding the bundled assets
     * @param resourceRoot resource path prefix, empty for the class path root
     * @param workingDirectory directory relative paths are computed against
     * @param version BokehJS version used in remote file names
     */
    public ResourceResolver(ClassLoader classLoader, String resourceRoot, Path workingDirectory, String version) {
        this.classLoader = Objects.requireNonNull(classLoader, "classLoader must not be null");
        this.resourceRoot = normalizeRoot(resourceRoot);
        this.workingDirectory = Objects.requireNonNull(workingDirectory, "workingDirectory must not be null")
            .toAbsolutePath();
        this.version = Objects.requireNonNull(version, "version must not be null");
    }

    /**
     * Resolves the bundle for a set of referenced models.
     *
     * @param mode deployment mode
     * @param refs models the document renders
     * @return the complete bundle
     * @throws ResourceNotFoundException if a bundled asset is missing
     * @throws UnsupportedLocationException if a local mode meets a non-file resource
     * @throws IllegalStateException if a remote URL cannot be built
     */
    public AssetBundle resolve(DeploymentMode mode, List<? extends ModelReference> refs) {
        Objects.requireNonNull(mode, "mode must not be null");
        Objects.requireNonNull(refs, "refs must not be null");

        List<AssetComponent> components = selectComponents(refs);
        log.debug("Resolving {} for {} references in mode '{}'", components, refs.size(), mode.name());

        List<ResourceReference> scripts = new ArrayList<>();
        for (AssetComponent component : components) {
            if (component.hasScript()) {
                scripts.add(resolveAsset(mode, component, AssetKind.SCRIPT));
            }
        }
        scripts.add(ResourceReference.inline(AssetKind.SCRIPT, DocumentScripts.logLevelScript(mode)));

        List<ResourceReference> styles = new ArrayList<>();
        for (AssetComponent component : components) {
            if (component.hasStyle()) {
                styles.add(resolveAsset(mode, component, AssetKind.STYLE));
            }
        }

        return new AssetBundle(scripts, styles);
    }

    /**
     * Selects the components a set of references needs, in load order.
     *
     * @param refs referenced models
     * @return core, then widgets and compiler when required
     */
    public List<AssetComponent> selectComponents(List<? extends ModelReference> refs) {
        List<AssetComponent> components = new ArrayList<>();
        components.add(AssetComponent.CORE);
        if (refs.stream().anyMatch(ModelReference::requiresWidgets)) {
            components.add(AssetComponent.WIDGETS);
        }
        if (refs.stream().anyMatch(ModelReference::requiresCompiler)) {
            components.add(AssetComponent.COMPILER);
        }
        return List.copyOf(components);
    }

    /**
     * Builds the file name of a component asset.
     *
     * @param mode mode deciding minification
     * @param component asset component
     * @param kind script or style
     * @param includeVersion whether to insert {@code -<version>} after the name
     * @return file name such as {@code bokeh.min.js} or {@code bokeh-0.8.2.css}
     */
    public String fileName(DeploymentMode mode, AssetComponent component, AssetKind kind, boolean includeVersion) {
        StringBuilder name = new StringBuilder(component.assetName());
        if (includeVersion) {
            name.append('-').append(version);
        }
        if (mode.minified()) {
            name.append(".min");
        }
        return name.append('.').append(kind.extension()).toString();
    }

    private ResourceReference resolveAsset(DeploymentMode mode, AssetComponent component, AssetKind kind) {
        return switch (mode.locationKind()) {
            case EMBEDDED -> resolveEmbedded(mode, component, kind);
            case LOCAL_RELATIVE, LOCAL_ABSOLUTE -> resolveLocal(mode, component, kind);
            case REMOTE -> resolveRemote(mode, component, kind);
        };
    }

    private ResourceReference resolveEmbedded(DeploymentMode mode, AssetComponent component, AssetKind kind) {
        String path = resourcePath(kind, fileName(mode, component, kind, false));
        URL resource = getResource(path);
        try (InputStream in = resource.openStream()) {
            String text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            log.debug("Embedded {} ({} chars)", path, text.length());
            return ResourceReference.inline(kind, text);
        } catch (IOException e) {
            throw new ResourceNotFoundException(path, e);
        }
    }

    private ResourceReference resolveLocal(DeploymentMode mode, AssetComponent component, AssetKind kind) {
        String fileName = fileName(mode, component, kind, false);
        String path = resourcePath(kind, fileName);
        Path file = toFile(path, getResource(path));
        Path directory = file.getParent();

        Path resolved = mode.locationKind() == LocationKind.LOCAL_RELATIVE
            ? relativize(directory)
            : directory.toAbsolutePath();
        return ResourceReference.file(kind, resolved.resolve(fileName));
    }

    private ResourceReference resolveRemote(DeploymentMode mode, AssetComponent component, AssetKind kind) {
        String fileName = fileName(mode, component, kind, true);
        URI url;
        try {
            url = mode.baseUrl().resolve("./" + fileName);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Malformed asset URL for " + fileName, e);
        }
        if (!url.isAbsolute()) {
            throw new IllegalStateException("Base URL of mode '" + mode.name() + "' is not absolute: " + mode.baseUrl());
        }
        return ResourceReference.url(kind, url);
    }

    private URL getResource(String path) {
        URL resource = classLoader.getResource(path);
        if (resource == null) {
            throw new ResourceNotFoundException(path);
        }
        return resource;
    }

    private Path toFile(String path, URL resource) {
        if (!"file".equals(resource.getProtocol())) {
            throw new UnsupportedLocationException(path, resource.getProtocol());
        }
        try {
            return Paths.get(resource.toURI());
        } catch (URISyntaxException | IllegalArgumentException e) {
            throw new UnsupportedLocationException(path, resource.getProtocol());
        }
    }

    /**
     * Makes a directory relative to the working directory. Directories outside of it
     * stay absolute.
     */
    private Path relativize(Path directory) {
        URI base = workingDirectory.toUri();
        URI target = directory.toAbsolutePath().toUri();
        URI relative = base.relativize(target);
        if (relative.isAbsolute()) {
            return directory.toAbsolutePath();
        }
        return Paths.get(relative.getPath());
    }

    private String resourcePath(AssetKind kind, String fileName) {
        return resourceRoot + kind.lookupRoot() + "/" + fileName;
    }

    static String normalizeRoot(String root) {
        if (root == null || root.isBlank()) {
            return "";
        }
        String trimmed = root.strip();
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        return trimmed.isEmpty() || trimmed.endsWith("/") ? trimmed : trimmed + "/";
    }
}
