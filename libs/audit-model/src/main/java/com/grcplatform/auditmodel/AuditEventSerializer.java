package com.grcplatform.auditmodel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Optional;

/**
 * JSON serialization and deserialization for {@link AuditEvent}.
 * <p>
 * The canonical form sorts properties and map keys so the same event always produces the same
 * bytes; {@link AuditChain} hashes that form.
 */
public final class AuditEventSerializer {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    private AuditEventSerializer() {
        // utility class
    }

    /**
     * Serializes an audit event to its canonical JSON string.
     *
     * @throws AuditSerializationException if serialization fails
     */
    public static String serialize(AuditEvent event) {
        try {
            return MAPPER.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new AuditSerializationException("Failed to serialize audit event: " + event.eventId(), e);
        }
    }

    /**
     * Deserializes a JSON string to an audit event.
     *
     * @throws AuditSerializationException if the JSON is malformed
     */
    public static AuditEvent deserialize(String json) {
        try {
            return MAPPER.readValue(json, AuditEvent.class);
        } catch (JsonProcessingException e) {
            throw new AuditSerializationException("Failed to deserialize audit event", e);
        }
    }

    /**
     * Deserializes, returning empty on malformed input.
     */
    public static Optional<AuditEvent> tryDeserialize(String json) {
        try {
            return Optional.of(deserialize(json));
        } catch (AuditSerializationException | IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /** Returns the shared canonical ObjectMapper. */
    public static ObjectMapper objectMapper() {
        return MAPPER;
    }

    /**
     * Thrown when audit event serialization or deserialization fails.
     */
    public static class AuditSerializationException extends RuntimeException {
        public AuditSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
