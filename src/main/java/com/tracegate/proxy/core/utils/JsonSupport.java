package com.tracegate.proxy.core.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import com.tracegate.proxy.core.exceptions.GatewayException;

/**
 * Shared Jackson mapper. Instants are written as ISO-8601 strings.
 */
public final class JsonSupport {

    private static final ObjectMapper MAPPER = createObjectMapper();

    private JsonSupport() {
        // Utility class
    }

    private static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    /**
     * @return The shared, thread-safe mapper. Callers must not reconfigure it.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Serializes a value to a JSON string.
     * 
     * @throws GatewayException If the value cannot be serialized.
     */
    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new GatewayException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
