package com.plotbinding.core.renderer;

import com.plotbinding.core.resources.AssetBundle;

/**
 * Turns a resolved {@link AssetBundle} into text a document template can use.
 *
 * <p>Renderers are discovered via Java Service Provider Interface (SPI).
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.plotbinding.core.renderer.BundleRenderer}
 */
public interface BundleRenderer {

    /**
     * Returns unique identifier for this renderer, e.g. {@code html}.
     *
     * @return renderer identifier
     */
    String getId();

    /**
     * Returns the file extension of rendered output, without the dot.
     *
     * @return file extension
     */
    String getFileExtension();

    /**
     * Renders the bundle. Styles and scripts keep their bundle order.
     *
     * @param bundle resolved bundle
     * @return rendered text
     */
    String render(AssetBundle bundle);
}
