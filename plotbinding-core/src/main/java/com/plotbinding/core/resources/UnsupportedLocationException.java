package com.plotbinding.core.resources;

/**
 * Thrown when a local deployment mode meets a resource that is not a plain file,
 * e.g. one packaged inside a jar.
 */
public class UnsupportedLocationException extends ResourceResolutionException {

    private final String protocol;

    public UnsupportedLocationException(String resourcePath, String protocol) {
        super("unable to load " + resourcePath + " due to invalid protocol: " + protocol, resourcePath);
        this.protocol = protocol;
    }

    public String getProtocol() {
        return protocol;
    }
}
