package com.mathdocx.component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mathdocx.exception.MathGenerationException;

import java.util.List;

/**
 * JSON form of a component list, for document builders running out of process.
 *
 * <p>Example:
 * <pre>
 * [{"type":"fraction",
 *   "numerator":[{"type":"run","text":"1","normal":false}],
 *   "denominator":[{"type":"run","text":"2","normal":false}]}]
 * </pre>
 */
public final class ComponentJsonWriter {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private static final TypeReference<List<MathComponent>> COMPONENT_LIST =
        new TypeReference<>() {};

    private ComponentJsonWriter() {}

    /**
     * Serializes components to a JSON array.
     *
     * @param components the components
     * @return the JSON text
     */
    public static String toJson(List<MathComponent> components) {
        try {
            return objectMapper.writerFor(COMPONENT_LIST).writeValueAsString(components);
        } catch (JsonProcessingException e) {
            throw new MathGenerationException("Failed to serialize components: " + e.getMessage(), e, null);
        }
    }

    /**
     * Reads a JSON array written by {@link #toJson(List)}.
     *
     * @param json the JSON text
     * @return the components
     * @throws IllegalArgumentException if the JSON is not a valid component list
     */
    public static List<MathComponent> fromJson(String json) {
        try {
            return objectMapper.readValue(json, COMPONENT_LIST);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to parse component JSON: " + e.getMessage(), e);
        }
    }
}
