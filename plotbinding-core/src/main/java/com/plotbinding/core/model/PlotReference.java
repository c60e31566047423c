package com.plotbinding.core.model;

import java.util.Objects;

/**
 * Reference to a plain plot or glyph model. Needs only the core component.
 *
 * @param id model id
 */
public record PlotReference(String id) implements ModelReference {

    public PlotReference {
        Objects.requireNonNull(id, "id must not be null");
    }

    @Override
    public boolean requiresWidgets() {
        return false;
    }

    @Override
    public boolean requiresCompiler() {
        return false;
    }
}
