package com.smartcampus.security.audit;

import com.smartcampus.security.Action;
import com.smartcampus.security.Principal;
import com.smartcampus.security.ResourceDescriptor;
import com.smartcampus.security.ResourceKind;
import com.smartcampus.security.policy.Decision;

/**
 * Append-only, best-effort-durable record of authorization decisions.
 * <p>
 * Implementations stamp the sequence number and timestamp when {@code record} is called,
 * not when the write completes. A failed write never propagates to the caller: the
 * business operation that triggered it must not be rolled back or blocked. Failures are
 * reported to an {@link AuditAlertChannel} instead.
 */
public interface AuditSink {

    void record(Principal principal, Action action, ResourceKind resourceKind, String resourceId, Decision decision);

    /**
     * Records a decision about a loaded resource, keeping the resource's school for
     * cross-school review.
     */
    void record(Principal principal, Action action, ResourceDescriptor resource, Decision decision);
}
