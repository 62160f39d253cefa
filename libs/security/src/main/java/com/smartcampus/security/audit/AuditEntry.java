package com.smartcampus.security.audit;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.smartcampus.security.Action;
import com.smartcampus.security.ResourceKind;
import com.smartcampus.security.Role;
import com.smartcampus.security.policy.Decision;
import java.time.Instant;

/**
 * One audited authorization decision. Append-only: the application never updates or
 * deletes an entry.
 *
 * @param sequence         strictly increasing number assigned when the decision was recorded;
 *                         orders entries independently of when storage commits complete
 * @param timestamp        decision time
 * @param principalId      the caller
 * @param role             the caller's role
 * @param tenantId         the caller's school code (null for super administrators)
 * @param action           the attempted action
 * @param resourceKind     kind of the resource; {@code null} when the caller named a kind
 *                         this service does not recognise
 * @param resourceId       ID of the resource, or {@code *} for a collection scope
 * @param resourceTenantId school of the resource when known; differs from {@code tenantId}
 *                         only for explicit cross-school super-admin access
 * @param outcome          Allow or Deny
 * @param reason           the decision's reason
 * @param correlationId    correlation ID of the request, when one was bound
 * @param clientAddress    network address of the caller, when known
 * @param userAgent        the caller's user agent, when known
 */
public record AuditEntry(
        long sequence,
        Instant timestamp,
        String principalId,
        Role role,
        String tenantId,
        Action action,
        ResourceKind resourceKind,
        String resourceId,
        String resourceTenantId,
        Decision.Outcome outcome,
        String reason,
        String correlationId,
        String clientAddress,
        String userAgent
) {

    /** Resource ID recorded for collection-level access. */
    public static final String COLLECTION = "*";

    @JsonIgnore
    public boolean isCrossTenant() {
        return resourceTenantId != null && !resourceTenantId.equals(tenantId);
    }
}
