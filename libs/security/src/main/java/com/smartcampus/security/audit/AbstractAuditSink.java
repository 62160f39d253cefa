package com.smartcampus.security.audit;

import com.smartcampus.observability.RequestContext;
import com.smartcampus.observability.RequestContextHolder;
import com.smartcampus.security.Action;
import com.smartcampus.security.Principal;
import com.smartcampus.security.ResourceDescriptor;
import com.smartcampus.security.ResourceKind;
import com.smartcampus.security.policy.Decision;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Builds {@link AuditEntry} values at decision time and hands them to {@link #dispatch}.
 * <p>
 * Sequence numbers continue from the store's {@link AuditStore#lastSequence()} and are taken
 * on the calling thread, so entries for sequential decisions are numbered in decision order
 * whatever order the writes finish in.
 */
public abstract class AbstractAuditSink implements AuditSink {

    protected final AuditStore store;
    protected final AuditAlertChannel alerts;
    private final Clock clock;
    private final AtomicLong sequence;

    protected AbstractAuditSink(AuditStore store, AuditAlertChannel alerts, Clock clock) {
        if (store == null || alerts == null || clock == null) {
            throw new IllegalArgumentException("store, alerts and clock must not be null");
        }
        this.store = store;
        this.alerts = alerts;
        this.clock = clock;
        this.sequence = new AtomicLong(store.lastSequence());
    }

    @Override
    public final void record(Principal principal, Action action, ResourceKind resourceKind,
                             String resourceId, Decision decision) {
        dispatch(newEntry(principal, action, resourceKind, resourceId, null, decision));
    }

    @Override
    public final void record(Principal principal, Action action, ResourceDescriptor resource, Decision decision) {
        dispatch(newEntry(principal, action, resource.kind(), resource.id(), resource.tenantId(), decision));
    }

    /**
     * Writes or enqueues the entry. Must not throw.
     */
    protected abstract void dispatch(AuditEntry entry);

    /**
     * Appends to the store, turning any failure into an alert.
     */
    protected final void write(AuditEntry entry) {
        try {
            store.append(entry);
        } catch (RuntimeException e) {
            alerts.auditWriteFailed(entry, e);
        }
    }

    private AuditEntry newEntry(Principal principal, Action action, ResourceKind kind,
                                String resourceId, String resourceTenantId, Decision decision) {
        Optional<RequestContext> context = RequestContextHolder.get();
        return new AuditEntry(
                sequence.incrementAndGet(),
                clock.instant(),
                principal.id(),
                principal.role(),
                principal.tenantId(),
                action,
                kind,
                resourceId,
                resourceTenantId,
                decision.outcome(),
                decision.reason(),
                context.map(RequestContext::correlationId).orElse(null),
                context.map(RequestContext::clientAddress).orElse(null),
                context.map(RequestContext::userAgent).orElse(null));
    }
}
