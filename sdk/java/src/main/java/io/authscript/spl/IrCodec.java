package io.authscript.spl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.Map;
import java.util.Objects;

/**
 * JSON and map forms of {@link PolicyIr}, for handing a compiled policy to another process.
 * Integral property values come back as {@code Long}, matching what the parser produces.
 */
public final class IrCodec {
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.USE_LONG_FOR_INTS, true)
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .configure(SerializationFeature.INDENT_OUTPUT, true);

    private IrCodec() {}

    public static String toJson(PolicyIr ir) {
        Objects.requireNonNull(ir, "ir");
        try {
            return MAPPER.writeValueAsString(ir);
        } catch (JsonProcessingException e) {
            throw new SplException("failed to encode policy IR", e);
        }
    }

    public static PolicyIr fromJson(String json) {
        Objects.requireNonNull(json, "json");
        try {
            return MAPPER.readValue(json, PolicyIr.class);
        } catch (JsonProcessingException | RuntimeException e) {
            throw new SplException("failed to decode policy IR: " + e.getMessage(), e);
        }
    }

    public static Map<String, Object> toMap(PolicyIr ir) {
        Objects.requireNonNull(ir, "ir");
        try {
            return MAPPER.convertValue(ir, new TypeReference<Map<String, Object>>() {});
        } catch (IllegalArgumentException e) {
            throw new SplException("failed to convert policy IR", e);
        }
    }

    public static PolicyIr fromMap(Map<String, ?> map) {
        Objects.requireNonNull(map, "map");
        try {
            return MAPPER.convertValue(map, PolicyIr.class);
        } catch (RuntimeException e) {
            throw new SplException("failed to convert policy IR: " + e.getMessage(), e);
        }
    }
}
