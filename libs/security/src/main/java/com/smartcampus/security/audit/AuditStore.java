package com.smartcampus.security.audit;

/**
 * Durable destination of audit entries.
 */
public interface AuditStore {

    /**
     * Appends one entry.
     *
     * @throws AuditWriteException if the entry could not be stored
     */
    void append(AuditEntry entry);

    /**
     * Highest sequence number already stored, so that a restarted sink keeps numbering
     * upwards. Stores that do not survive restarts return 0.
     */
    default long lastSequence() {
        return 0L;
    }
}
