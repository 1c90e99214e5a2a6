package com.tnpds.scraper;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared Jackson mappers: ISO-8601 timestamps, absent fields omitted, unknown input fields ignored.
 */
public final class ObjectMapperFactory {
    private static final ObjectMapper MAPPER = configure(new ObjectMapper());
    private static final ObjectMapper PRETTY_PRINT_MAPPER = MAPPER.copy().enable(SerializationFeature.INDENT_OUTPUT);

    private ObjectMapperFactory() {}

    public static ObjectMapper getDefaultMapper() {
        return MAPPER;
    }

    public static ObjectMapper getPrettyPrintMapper() {
        return PRETTY_PRINT_MAPPER;
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        return mapper;
    }
}
