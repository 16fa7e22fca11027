package com.vigil.health;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON rendering of status snapshots for dashboards and command-line consumers.
 * <p>
 * Timestamps are ISO-8601 strings, statuses are lower-case names and null fields are omitted.
 */
public final class StatusSnapshotSerializer {

    private static final ObjectMapper MAPPER = createMapper();

    private StatusSnapshotSerializer() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return configure(new ObjectMapper());
    }

    /**
     * Applies the snapshot rendering settings to an existing mapper, so other mappers (such as a
     * web framework's) render snapshots the same way.
     *
     * @return the same mapper
     */
    public static ObjectMapper configure(ObjectMapper mapper) {
        return mapper
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.WRITE_ENUMS_USING_TO_STRING)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    /**
     * @throws StatusSerializationException if serialization fails
     */
    public static String serialize(SystemStatus status) {
        return write(status);
    }

    /**
     * @throws StatusSerializationException if serialization fails
     */
    public static String serialize(ServiceStatus status) {
        return write(status);
    }

    private static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StatusSerializationException("Failed to serialize status snapshot", e);
        }
    }

    /** Returns the shared ObjectMapper. */
    public static ObjectMapper objectMapper() {
        return MAPPER;
    }

    /**
     * Thrown when a snapshot cannot be rendered, typically because a check put an
     * unserializable value into its extra data.
     */
    public static class StatusSerializationException extends RuntimeException {
        public StatusSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
