package com.plotbinding.core.model;

/**
 * Forms an asset component can ship in.
 */
public enum AssetKind {
    /** JavaScript, looked up under {@code js/} */
    SCRIPT("js"),

    /** Stylesheet, looked up under {@code css/} */
    STYLE("css");

    private final String extension;

    AssetKind(String extension) {
        this.extension = extension;
    }

    /**
     * Returns the file extension, without the dot.
     *
     * @return file extension
     */
    public String extension() {
        return extension;
    }

    /**
     * Returns the directory the bundled resources of this kind live in.
     *
     * <p>Same as the extension: {@code js} or {@code css}.
     *
     * @return lookup directory name
     */
    public String lookupRoot() {
        return extension;
    }
}
