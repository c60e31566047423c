package com.plotbinding.core.resources;

import java.util.List;

/**
 * Ordered script and style references for one document.
 *
 * <p>Scripts start with the core component and end with the log-level snippet.
 * Styles follow component selection order.
 *
 * @param scripts script references, in load order
 * @param styles style references, in load order
 */
public record AssetBundle(
    List<ResourceReference> scripts,
    List<ResourceReference> styles
) {
    /**
     * Compact constructor making defensive copies.
     */
    public AssetBundle {
        scripts = scripts == null ? List.of() : List.copyOf(scripts);
        styles = styles == null ? List.of() : List.copyOf(styles);
    }
}
