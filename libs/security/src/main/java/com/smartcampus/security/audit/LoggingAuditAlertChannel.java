package com.smartcampus.security.audit;

import com.smartcampus.observability.MetricFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Alerts on lost audit entries through an ERROR log line and the
 * {@value #FAILURE_COUNTER} counter, which operators alert on.
 */
public final class LoggingAuditAlertChannel implements AuditAlertChannel {

    public static final String FAILURE_COUNTER = "campus.audit.write.failures";

    private static final Logger log = LoggerFactory.getLogger(LoggingAuditAlertChannel.class);

    private final MetricFactory metrics;

    public LoggingAuditAlertChannel(MetricFactory metrics) {
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        this.metrics = metrics;
    }

    @Override
    public void auditWriteFailed(AuditEntry entry, Exception cause) {
        log.error("AUDIT DEGRADED: entry seq={} principal={} action={} kind={} resource={} outcome={} was not stored",
                entry.sequence(), entry.principalId(), entry.action(), entry.resourceKind(),
                entry.resourceId(), entry.outcome(), cause);
        metrics.counter(FAILURE_COUNTER, "Audit entries that could not be stored",
                        "cause", cause.getClass().getSimpleName())
                .increment();
    }
}
