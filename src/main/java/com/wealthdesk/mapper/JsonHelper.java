package com.wealthdesk.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static JSON helper shared by the MapStruct mappers and the seed loader.
 *
 * <p>Audit event details are a free-form map in the domain and a JSON string in
 * the audit_events table. Dates are written as ISO-8601 strings.
 */
public final class JsonHelper {

    private static final Logger log = LoggerFactory.getLogger(JsonHelper.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    static {
        OBJECT_MAPPER.findAndRegisterModules();
        OBJECT_MAPPER.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        OBJECT_MAPPER.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    private JsonHelper() {}

    /** Serialize an object to JSON string. Returns null if input is null. */
    public static String toJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return OBJECT_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize to JSON: {}", value.getClass().getSimpleName(), e);
            throw new IllegalStateException("JSON serialization failed", e);
        }
    }

    /** Deserialize a JSON string to a generic type. Returns null if input is null or blank. */
    public static <T> T fromJson(String json, TypeReference<T> typeRef) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return OBJECT_MAPPER.readValue(json, typeRef);
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize JSON to {}: {}", typeRef.getType(), json, e);
            throw new IllegalStateException("JSON deserialization failed", e);
        }
    }

    /** Deserialize a JSON object string to an ordered map. Returns an empty map for null input. */
    public static Map<String, Object> toMap(String json) {
        Map<String, Object> map = fromJson(json, new TypeReference<LinkedHashMap<String, Object>>() {});
        return map != null ? map : new LinkedHashMap<>();
    }

    /** Read a whole JSON document from a stream, typically a classpath resource. */
    public static <T> T read(InputStream inputStream, Class<T> type) {
        try {
            return OBJECT_MAPPER.readValue(inputStream, type);
        } catch (IOException e) {
            log.error("Failed to read JSON document as {}", type.getSimpleName(), e);
            throw new IllegalStateException("JSON document could not be read", e);
        }
    }
}
