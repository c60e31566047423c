package com.plotbinding.core.resources;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Version of the BokehJS build this binding ships with.
 *
 * <p>Read once from {@code plotbinding-version.properties} on the class path.
 */
public final class BokehVersion {

    private static final Logger log = LoggerFactory.getLogger(BokehVersion.class);

    static final String PROPERTIES_RESOURCE = "plotbinding-version.properties";
    static final String VERSION_KEY = "bokehjs.version";

    private BokehVersion() {
        // Utility class
    }

    /**
     * Returns the bundled BokehJS version.
     *
     * @return version string, e.g. {@code 0.8.2}
     * @throws IllegalStateException if the version resource is missing or incomplete
     */
    public static String get() {
        return Holder.VERSION;
    }

    static String load(ClassLoader classLoader) {
        try (InputStream in = classLoader.getResourceAsStream(PROPERTIES_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Version resource not found: " + PROPERTIES_RESOURCE);
            }
            Properties properties = new Properties();
            properties.load(in);
            String version = properties.getProperty(VERSION_KEY);
            if (version == null || version.isBlank()) {
                throw new IllegalStateException("Property '" + VERSION_KEY + "' missing from " + PROPERTIES_RESOURCE);
            }
            log.debug("Bundled BokehJS version: {}", version);
            return version.trim();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + PROPERTIES_RESOURCE, e);
        }
    }

    private static final class Holder {
        private static final String VERSION = load(BokehVersion.class.getClassLoader());
    }
}
