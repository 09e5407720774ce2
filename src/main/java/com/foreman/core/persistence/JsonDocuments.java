package com.foreman.core.persistence;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Reads and writes persisted records as JSON, translating Jackson failures
 * into {@link StoreSerializationException}.
 */
public class JsonDocuments {

    private final ObjectMapper objectMapper;

    public JsonDocuments(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Mapper used for workspace documents: ISO-8601 instants, indented output,
     * absent values omitted, unknown fields ignored.
     */
    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .setSerializationInclusion(JsonInclude.Include.NON_ABSENT);
    }

    public <T> T read(String content, Class<T> type, String source) {
        try {
            T value = objectMapper.readValue(content, type);
            if (value == null) {
                throw new StoreSerializationException("Empty " + type.getSimpleName() + " record in " + source);
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new StoreSerializationException(
                    "Malformed " + type.getSimpleName() + " record in " + source + ": " + e.getOriginalMessage(), e);
        } catch (IllegalArgumentException e) {
            // constructor validation (e.g. a bad task id) surfaces through Jackson as IAE
            throw new StoreSerializationException(
                    "Invalid " + type.getSimpleName() + " record in " + source + ": " + e.getMessage(), e);
        }
    }

    public String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StoreSerializationException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
