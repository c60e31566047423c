package com.plotbinding.core.renderer.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.plotbinding.core.renderer.BundleRenderer;
import com.plotbinding.core.resources.AssetBundle;

/**
 * Renders a bundle as JSON for tools that assemble documents themselves.
 *
 * <p><b>Example Output:</b>
 * <pre>{@code
 * {
 *   "scripts" : [ { "kind" : "SCRIPT", "location" : "URL", "value" : "http://..." } ],
 *   "styles" : [ { "kind" : "STYLE", "location" : "URL", "value" : "http://..." } ]
 * }
 * }</pre>
 */
public class JsonBundleRenderer implements BundleRenderer {

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    @Override
    public String getId() {
        return "json";
    }

    @Override
    public String getFileExtension() {
        return "json";
    }

    @Override
    public String render(AssetBundle bundle) {
        try {
            return JSON_MAPPER.writeValueAsString(bundle);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize bundle", e);
        }
    }
}
