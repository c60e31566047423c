package com.plotbinding.core.resources;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.plotbinding.core.model.AssetKind;

import java.net.URI;
import java.nio.file.Path;
import java.util.Objects;

/**
 * One entry of an {@link AssetBundle}.
 *
 * @param kind script or stylesheet
 * @param location how {@code value} is to be interpreted
 * @param value asset text, file path or URL
 */
public record ResourceReference(
    AssetKind kind,
    Location location,
    String value
) {
    /**
     * How a reference points at its asset.
     */
    public enum Location {
        /** {@code value} is the asset text itself */
        INLINE,

        /** {@code value} is a filesystem path */
        FILE,

        /** {@code value} is an absolute URL */
        URL
    }

    /**
     * Compact constructor with validation.
     */
    public ResourceReference {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(location, "location must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }

    public static ResourceReference inline(AssetKind kind, String text) {
        return new ResourceReference(kind, Location.INLINE, text);
    }

    public static ResourceReference file(AssetKind kind, Path path) {
        return new ResourceReference(kind, Location.FILE, path.toString());
    }

    public static ResourceReference url(AssetKind kind, URI url) {
        return new ResourceReference(kind, Location.URL, url.toString());
    }

    @JsonIgnore
    public boolean isInline() {
        return location == Location.INLINE;
    }
}
