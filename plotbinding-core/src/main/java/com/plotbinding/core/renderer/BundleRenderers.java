package com.plotbinding.core.renderer;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Looks up {@link BundleRenderer} implementations registered via SPI.
 */
public final class BundleRenderers {

    private BundleRenderers() {
        // Utility class
    }

    /**
     * Returns all registered renderers.
     *
     * @return renderers in discovery order
     */
    public static List<BundleRenderer> all() {
        List<BundleRenderer> renderers = new ArrayList<>();
        ServiceLoader.load(BundleRenderer.class).forEach(renderers::add);
        return renderers;
    }

    /**
     * Finds a renderer by id.
     *
     * @param id renderer id, e.g. {@code json}
     * @return the renderer, or empty if none is registered under that id
     */
    public static Optional<BundleRenderer> find(String id) {
        return all().stream()
            .filter(renderer -> renderer.getId().equals(id))
            .findFirst();
    }
}
