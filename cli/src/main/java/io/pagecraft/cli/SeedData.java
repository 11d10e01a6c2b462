package io.pagecraft.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;

/** Parses the {@code --data} option into seed bindings. */
final class SeedData {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private SeedData() {}

    /**
     * Parses a JSON object. Nested objects become {@link Map}s, arrays become lists.
     *
     * @throws IllegalArgumentException if {@code json} is not valid JSON or not an object
     */
    static Map<String, Object> parse(String json) {
        JsonNode node;
        try {
            node = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON in --data: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("--data must be a JSON object, e.g. '{\"name\": \"World\"}'");
        }
        return MAPPER.convertValue(node, MAP_TYPE);
    }
}
