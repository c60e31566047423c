package com.plotbinding.core.resources;

/**
 * Base class for fatal asset resolution failures.
 *
 * <p>These indicate a broken install or an unusable deployment mode. Callers should
 * treat them as startup configuration errors; resolution is never retried.
 */
public class ResourceResolutionException extends RuntimeException {

    private final String resourcePath;

    public ResourceResolutionException(String message, String resourcePath) {
        super(message);
        this.resourcePath = resourcePath;
    }

    public ResourceResolutionException(String message, String resourcePath, Throwable cause) {
        super(message, cause);
        this.resourcePath = resourcePath;
    }

    /**
     * Returns the class path resource that could not be resolved.
     *
     * @return resource path, e.g. {@code js/bokeh.min.js}
     */
    public String getResourcePath() {
        return resourcePath;
    }
}
