package com.smartcampus.security.audit;

import java.time.Clock;

/**
 * Writes each entry on the calling thread, immediately after the decision.
 */
public final class DirectAuditSink extends AbstractAuditSink {

    public DirectAuditSink(AuditStore store, AuditAlertChannel alerts) {
        this(store, alerts, Clock.systemUTC());
    }

    public DirectAuditSink(AuditStore store, AuditAlertChannel alerts, Clock clock) {
        super(store, alerts, clock);
    }

    @Override
    protected void dispatch(AuditEntry entry) {
        write(entry);
    }
}
