package com.smartcampus.database.audit;

import com.smartcampus.security.audit.AuditEntry;
import com.smartcampus.security.audit.AuditStore;
import com.smartcampus.security.audit.AuditWriteException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * {@link AuditStore} over the {@code audit_log} table.
 *
 * <p>Inserts only; there is no update or delete path. Each entry's {@code seq_no} is the primary
 * key, so a replayed entry fails loudly instead of being stored twice.
 */
public class JdbcAuditStore implements AuditStore {

    private static final String INSERT = """
            INSERT INTO audit_log (seq_no, occurred_at, principal_id, role, tenant_id, action,
                                   resource_kind, resource_id, resource_tenant_id, outcome, reason,
                                   correlation_id, client_address, user_agent)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private final JdbcTemplate jdbc;

    public JdbcAuditStore(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void append(AuditEntry entry) {
        try {
            jdbc.update(INSERT,
                    entry.sequence(),
                    OffsetDateTime.ofInstant(entry.timestamp(), ZoneOffset.UTC),
                    entry.principalId(),
                    entry.role() == null ? null : entry.role().value(),
                    entry.tenantId(),
                    entry.action().value(),
                    entry.resourceKind() == null ? null : entry.resourceKind().value(),
                    entry.resourceId(),
                    entry.resourceTenantId(),
                    entry.outcome().name(),
                    entry.reason(),
                    entry.correlationId(),
                    entry.clientAddress(),
                    entry.userAgent());
        } catch (DataAccessException e) {
            throw new AuditWriteException("Failed to insert audit entry " + entry.sequence(), e);
        }
    }

    @Override
    public long lastSequence() {
        Long max = jdbc.queryForObject("SELECT COALESCE(MAX(seq_no), 0) FROM audit_log", Long.class);
        return max == null ? 0L : max;
    }
}
