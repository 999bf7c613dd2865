package com.example.grouping.json;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Shared Jackson configuration for records and configuration documents.
 *
 * <p>Enum values match case-insensitively ({@code "sum"}, {@code "SUM"}) and
 * unknown properties are ignored, so configurations written for richer
 * front ends load unchanged.
 */
public final class JsonSupport {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private JsonSupport() {
    }

    /**
     * Returns the shared, thread-safe mapper.
     */
    public static ObjectMapper objectMapper() {
        return MAPPER;
    }
}
