package com.plotbinding.core.model;

/**
 * A domain object a document wants rendered.
 *
 * <p>The set of reference kinds is closed. Every kind states which optional asset
 * components it needs, so component selection never inspects runtime types.
 *
 * @see PlotReference
 * @see WidgetReference
 * @see CustomModelReference
 */
public sealed interface ModelReference permits PlotReference, WidgetReference, CustomModelReference {

    /**
     * Returns the model identifier.
     *
     * @return model id
     */
    String id();

    /**
     * Whether the widgets component must be loaded for this model.
     *
     * @return true if widget support is required
     */
    boolean requiresWidgets();

    /**
     * Whether the compiler component must be loaded for this model.
     *
     * @return true if script compilation support is required
     */
    boolean requiresCompiler();
}
