package com.plant.flowsheet.io;

import com.plant.flowsheet.api.ConfigurationException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads flowsheet definitions from JSON with Jackson.
 */
public final class FlowsheetLoader {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);

    private FlowsheetLoader() {
    }

    /** Parses a JSON file. */
    public static FlowsheetDefinition load(Path path) {
        try {
            return MAPPER.readValue(path.toFile(), FlowsheetDefinition.class);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load flowsheet definition from " + path, e);
        }
    }

    /** Parses a JSON string. */
    public static FlowsheetDefinition parse(String json) {
        try {
            return MAPPER.readValue(json, FlowsheetDefinition.class);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Malformed flowsheet definition: " + e.getOriginalMessage(), e);
        }
    }

    /** Parses a JSON file from the classpath. */
    public static FlowsheetDefinition loadResource(String resource) {
        InputStream in = FlowsheetLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null)
            throw new ConfigurationException("Flowsheet resource not found: " + resource);
        try (in) {
            return MAPPER.readValue(in, FlowsheetDefinition.class);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load flowsheet definition from classpath:" + resource, e);
        }
    }

    /** Serializes a definition back to pretty-printed JSON. */
    public static String toJson(FlowsheetDefinition def) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(def);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Cannot serialize flowsheet definition", e);
        }
    }
}
