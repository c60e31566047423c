package com.plotbinding.core.resources;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

/**
 * Mode-aware snippets document templates embed next to the asset bundle.
 */
public final class DocumentScripts {

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    private DocumentScripts() {
        // Utility class
    }

    /**
     * Serializes a value to JSON using the mode's indent.
     *
     * @param mode deployment mode, {@code indent == 0} gives compact output
     * @param value value to serialize
     * @return JSON text
     * @throws IllegalArgumentException if the value cannot be serialized
     */
    public static String stringify(DeploymentMode mode, Object value) {
        try {
            return writerFor(mode.indent()).writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value cannot be serialized to JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Wraps code so it runs once BokehJS has loaded.
     *
     * @param code JavaScript statements
     * @return wrapped code
     */
    public static String wrap(String code) {
        return "Bokeh.$(function() {\n" + code + "\n});";
    }

    /**
     * Returns the snippet setting the client log level.
     *
     * @param mode deployment mode
     * @return e.g. {@code Bokeh.set_log_level('info');}
     */
    public static String logLevelScript(DeploymentMode mode) {
        return "Bokeh.set_log_level('" + mode.logLevel().clientName() + "');";
    }

    private static ObjectWriter writerFor(int indent) {
        if (indent <= 0) {
            return JSON_MAPPER.writer();
        }
        DefaultIndenter indenter = new DefaultIndenter(" ".repeat(indent), "\n");
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
            .withObjectIndenter(indenter)
            .withArrayIndenter(indenter);
        return JSON_MAPPER.writer(printer);
    }
}
