package ai.designerkit.util;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON helpers shared by the tools. Output is pretty-printed and paths are written as plain strings. Null bean
 * properties and null map values are both omitted, since tool results are mostly built as ordered maps.
 */
public final class Json {
    private static final ObjectMapper MAPPER = createMapper();

    private Json() {}

    private static ObjectMapper createMapper() {
        var pathModule = new SimpleModule("PathModule").addSerializer(Path.class, new PathSerializer());

        return new ObjectMapper()
                .registerModule(pathModule)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .setDefaultPropertyInclusion(
                        JsonInclude.Value.construct(JsonInclude.Include.NON_NULL, JsonInclude.Include.NON_NULL))
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public static String toJson(Object obj) {
        try {
            return MAPPER.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize object to JSON", e);
        }
    }

    /**
     * Parses a flat JSON object of string values, as accepted for property overrides.
     *
     * @throws IllegalArgumentException if {@code json} is not such an object
     */
    public static Map<String, String> stringMap(String json) {
        try {
            var parsed = MAPPER.readValue(json, new TypeReference<LinkedHashMap<String, String>>() {});
            return parsed == null ? Map.of() : parsed;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Expected a JSON object of string values: " + e.getOriginalMessage(), e);
        }
    }

    /** The standard failure payload: {@code {"success": false, "error": message}}. */
    public static String error(String message) {
        var result = new LinkedHashMap<String, Object>();
        result.put("success", false);
        result.put("error", message);
        return toJson(result);
    }

    /** True when {@code json} is an object whose {@code success} field is false. */
    public static boolean isError(String json) {
        try {
            JsonNode node = MAPPER.readTree(json);
            return node != null && node.isObject() && node.has("success") && !node.get("success").asBoolean();
        } catch (JsonProcessingException e) {
            return false;
        }
    }

    public static ObjectMapper getMapper() {
        return MAPPER;
    }

    private static class PathSerializer extends JsonSerializer<Path> {
        @Override
        public void serialize(Path value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            gen.writeString(value.toString());
        }
    }
}
