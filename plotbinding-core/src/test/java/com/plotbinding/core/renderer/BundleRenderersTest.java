package com.plotbinding.core.renderer;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link BundleRenderers} service discovery.
 */
class BundleRenderersTest {

    @Test
    void all_discoversBuiltInRenderers() {
        assertThat(BundleRenderers.all())
            .extracting(BundleRenderer::getId)
            .containsExactlyInAnyOrder("html", "json");
    }

    @Test
    void find_unknownId_returnsEmpty() {
        assertThat(BundleRenderers.find("xml")).isEmpty();
        assertThat(BundleRenderers.find("json")).isPresent();
    }
}
