package com.atrium.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON form of {@link AuditEntry}, used for the audit log stream.
 * Timestamps are written as ISO 8601 strings.
 */
public final class AuditEntrySerializer {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private AuditEntrySerializer() {
        // utility class
    }

    /**
     * @throws AuditSerializationException if serialization fails
     */
    public static String serialize(AuditEntry entry) {
        try {
            return MAPPER.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            throw new AuditSerializationException("Failed to serialize audit entry " + entry.entryId(), e);
        }
    }

    /**
     * @throws AuditSerializationException if the JSON is malformed or incomplete
     */
    static AuditEntry deserialize(String json) {
        try {
            return MAPPER.readValue(json, AuditEntry.class);
        } catch (JsonProcessingException e) {
            throw new AuditSerializationException("Failed to deserialize audit entry", e);
        }
    }

    public static class AuditSerializationException extends RuntimeException {
        public AuditSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
