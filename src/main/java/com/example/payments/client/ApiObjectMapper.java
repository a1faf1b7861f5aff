package com.example.payments.client;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.type.TypeFactory;

/**
 * The Jackson configuration matching the API's JSON: snake_case names,
 * unknown properties tolerated, unset values left out.
 */
public final class ApiObjectMapper {

    private static final ObjectMapper SHARED = create();

    private ApiObjectMapper() {
    }

    /**
     * Creates a fresh, configured mapper.
     */
    public static ObjectMapper create() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        return mapper;
    }

    /**
     * Returns a process-wide mapper. Configured mappers are thread-safe.
     */
    public static ObjectMapper shared() {
        return SHARED;
    }

    public static JavaType typeOf(Class<?> type) {
        return TypeFactory.defaultInstance().constructType(type);
    }
}
