package com.smartcampus.security.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each entry as one JSON line on the {@value #AUDIT_LOGGER} logger, for deployments
 * that ship logs to a collector instead of keeping an audit table.
 */
public final class Slf4jAuditStore implements AuditStore {

    public static final String AUDIT_LOGGER = "campus.audit";

    private final Logger auditLog;

    public Slf4jAuditStore() {
        this(LoggerFactory.getLogger(AUDIT_LOGGER));
    }

    Slf4jAuditStore(Logger auditLog) {
        this.auditLog = auditLog;
    }

    @Override
    public void append(AuditEntry entry) {
        auditLog.info(AuditEntrySerializer.serialize(entry));
    }
}
