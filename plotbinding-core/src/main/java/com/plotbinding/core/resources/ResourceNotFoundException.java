package com.plotbinding.core.resources;

/**
 * Thrown when a bundled asset is missing from the class path.
 */
public class ResourceNotFoundException extends ResourceResolutionException {

    public ResourceNotFoundException(String resourcePath) {
        super("resource '" + resourcePath + "' not found", resourcePath);
    }

    public ResourceNotFoundException(String resourcePath, Throwable cause) {
        super("resource '" + resourcePath + "' could not be read", resourcePath, cause);
    }
}
