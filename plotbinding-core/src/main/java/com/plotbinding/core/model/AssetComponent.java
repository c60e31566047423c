package com.plotbinding.core.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Named logical bundles of BokehJS scripts and stylesheets.
 *
 * <p>Each component declares the asset kinds it ships. The compiler is script only.
 * Constants are declared in selection order.
 */
public enum AssetComponent {
    /** Core runtime, always required */
    CORE("bokeh", EnumSet.of(AssetKind.SCRIPT, AssetKind.STYLE)),

    /** Widget support, required when a widget model is referenced */
    WIDGETS("bokeh-widgets", EnumSet.of(AssetKind.SCRIPT, AssetKind.STYLE)),

    /** In-browser compiler for custom models written in a compiled-script language */
    COMPILER("bokeh-compiler", EnumSet.of(AssetKind.SCRIPT));

    private final String assetName;
    private final Set<AssetKind> kinds;

    AssetComponent(String assetName, EnumSet<AssetKind> kinds) {
        this.assetName = assetName;
        this.kinds = Collections.unmodifiableSet(kinds);
    }

    /**
     * Returns the base file name of this component's assets (e.g. {@code bokeh-widgets}).
     *
     * @return asset base name
     */
    public String assetName() {
        return assetName;
    }

    /**
     * Returns the asset kinds this component ships.
     *
     * @return unmodifiable set of kinds
     */
    public Set<AssetKind> kinds() {
        return kinds;
    }

    public boolean provides(AssetKind kind) {
        return kinds.contains(kind);
    }

    public boolean hasScript() {
        return provides(AssetKind.SCRIPT);
    }

    public boolean hasStyle() {
        return provides(AssetKind.STYLE);
    }
}
