package com.smartcampus.accessservice.infrastructure.health;

import com.smartcampus.security.audit.AsyncAuditSink;
import com.smartcampus.security.audit.AuditSink;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the audit sink under {@code /actuator/health} as {@code auditSink}.
 *
 * <p>A closed async sink is {@code DOWN}: every entry recorded from then on becomes an alert. A
 * queue at or above 90% of its capacity is {@code OUT_OF_SERVICE}, since the next burst of
 * mutations will start losing entries. The synchronous sink has no queue and is always {@code UP}.
 */
@Component
public class AuditSinkHealthIndicator implements HealthIndicator {

    static final double SATURATION_THRESHOLD = 0.9;

    private final AuditSink sink;

    public AuditSinkHealthIndicator(AuditSink sink) {
        this.sink = sink;
    }

    @Override
    public Health health() {
        if (!(sink instanceof AsyncAuditSink async)) {
            return Health.up().withDetail("mode", "sync").build();
        }
        int pending = async.pending();
        Health.Builder builder;
        if (async.isClosed()) {
            builder = Health.down();
        } else if (pending >= async.capacity() * SATURATION_THRESHOLD) {
            builder = Health.outOfService();
        } else {
            builder = Health.up();
        }
        return builder.withDetail("mode", "async")
                .withDetail("pending", pending)
                .withDetail("capacity", async.capacity())
                .build();
    }
}
