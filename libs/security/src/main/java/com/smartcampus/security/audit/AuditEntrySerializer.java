package com.smartcampus.security.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON form of {@link AuditEntry}, used for audit log lines and for shipping entries to
 * external collectors. Timestamps are ISO-8601 strings.
 */
public final class AuditEntrySerializer {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private AuditEntrySerializer() {
        // utility class
    }

    /**
     * @throws AuditWriteException if the entry cannot be serialized
     */
    public static String serialize(AuditEntry entry) {
        try {
            return MAPPER.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            throw new AuditWriteException("Failed to serialize audit entry " + entry.sequence(), e);
        }
    }

}
