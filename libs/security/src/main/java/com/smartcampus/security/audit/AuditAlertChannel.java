package com.smartcampus.security.audit;

/**
 * Operational channel told about lost audit data. Losing an entry is a degraded-mode
 * condition for operators, not a failure of the request that caused it.
 */
public interface AuditAlertChannel {

    void auditWriteFailed(AuditEntry entry, Exception cause);
}
