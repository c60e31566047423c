package com.plotbinding.core.model;

import java.util.Objects;

/**
 * Reference to an interactive widget (slider, button, data table...).
 *
 * @param id model id
 * @param widgetType widget type name, e.g. {@code Slider}
 */
public record WidgetReference(String id, String widgetType) implements ModelReference {

    public WidgetReference {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(widgetType, "widgetType must not be null");
    }

    @Override
    public boolean requiresWidgets() {
        return true;
    }

    @Override
    public boolean requiresCompiler() {
        return false;
    }
}
