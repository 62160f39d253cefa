package com.smartcampus.security.audit;

import static org.assertj.core.api.Assertions.assertThat;

import com.smartcampus.security.Action;
import com.smartcampus.security.ResourceDescriptor;
import com.smartcampus.security.ResourceKind;
import com.smartcampus.security.policy.Decision;
import com.smartcampus.security.testing.TestPrincipals;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AsyncAuditSink")
class AsyncAuditSinkTest {

    private final RecordingAlerts alerts = new RecordingAlerts();

    @Test
    @DisplayName("stores entries in decision order")
    void decisionOrder() {
        var store = new InMemoryAuditStore();
        var sink = new AsyncAuditSink(store, alerts, 1000);

        for (int i = 0; i < 200; i++) {
            sink.record(TestPrincipals.teacher("SCH1", "C1"), Action.UPDATE,
                    ResourceDescriptor.owned(ResourceKind.ATTENDANCE, "SCH1", "att-" + i, "C1"), Decision.allow());
        }
        sink.close();

        assertThat(store.entries()).hasSize(200);
        assertThat(store.entries()).extracting(AuditEntry::sequence).isSorted().doesNotHaveDuplicates();
        assertThat(store.entries().get(0).resourceId()).isEqualTo("att-0");
        assertThat(store.entries().get(199).resourceId()).isEqualTo("att-199");
        assertThat(alerts.failures).isEmpty();
    }

    @Test
    @DisplayName("continues numbering after the store's last sequence")
    void continuesSequence() {
        var store = new InMemoryAuditStore();
        store.append(entry(41L));
        var sink = new AsyncAuditSink(store, alerts, 10);

        sink.record(TestPrincipals.superAdmin(), Action.READ, ResourceKind.SCHOOL, "SCH1", Decision.allow());
        sink.close();

        assertThat(store.entries()).extracting(AuditEntry::sequence).containsExactly(41L, 42L);
    }

    @Test
    @DisplayName("alerts instead of throwing when the store fails")
    void storeFailure() {
        AuditStore failing = entry -> {
            throw new AuditWriteException("disk full");
        };
        var sink = new AsyncAuditSink(failing, alerts, 10);

        sink.record(TestPrincipals.superAdmin(), Action.DELETE, ResourceKind.SCHOOL, "SCH2", Decision.allow());
        sink.close();

        assertThat(alerts.failures).singleElement().satisfies(failure -> {
            assertThat(failure.entry().resourceId()).isEqualTo("SCH2");
            assertThat(failure.cause()).hasMessage("disk full");
        });
    }

    @Test
    @DisplayName("alerts when the queue is full without blocking the caller")
    void queueFull() throws InterruptedException {
        var release = new CountDownLatch(1);
        var started = new CountDownLatch(1);
        var store = new InMemoryAuditStore();
        AuditStore slowStore = entry -> {
            started.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            store.append(entry);
        };
        var sink = new AsyncAuditSink(slowStore, alerts, 1, Duration.ofSeconds(5), Clock.systemUTC());

        // first entry occupies the writer, second fills the queue, third is rejected
        sink.record(TestPrincipals.superAdmin(), Action.UPDATE, ResourceKind.SCHOOL, "SCH1", Decision.allow());
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(sink.capacity()).isEqualTo(1);
        for (int i = 2; i <= 3; i++) {
            sink.record(TestPrincipals.superAdmin(), Action.UPDATE, ResourceKind.SCHOOL, "SCH" + i, Decision.allow());
        }

        assertThat(alerts.failures).singleElement().satisfies(failure -> {
            assertThat(failure.entry().resourceId()).isEqualTo("SCH3");
            assertThat(failure.cause()).hasMessage("audit queue is full");
        });

        release.countDown();
        sink.close();
        assertThat(store.entries()).extracting(AuditEntry::resourceId).containsExactly("SCH1", "SCH2");
    }

    @Test
    @DisplayName("alerts on entries recorded after close")
    void afterClose() {
        var store = new InMemoryAuditStore();
        var sink = new AsyncAuditSink(store, alerts, 10);
        assertThat(sink.isClosed()).isFalse();
        sink.close();
        assertThat(sink.isClosed()).isTrue();

        sink.record(TestPrincipals.superAdmin(), Action.READ, ResourceKind.USER, "u-1", Decision.allow());

        assertThat(store.size()).isZero();
        assertThat(alerts.failures).singleElement()
                .satisfies(failure -> assertThat(failure.cause()).hasMessage("audit sink is closed"));
    }

    private static AuditEntry entry(long sequence) {
        return new AuditEntry(sequence, Instant.EPOCH, "u-0", null, "SCH1", Action.UPDATE,
                ResourceKind.NOTICE, "n-0", "SCH1", Decision.Outcome.ALLOW, "allowed by policy", null,
                null, null);
    }

    record Failure(AuditEntry entry, Exception cause) {}

    static final class RecordingAlerts implements AuditAlertChannel {

        final List<Failure> failures = new CopyOnWriteArrayList<>();

        @Override
        public void auditWriteFailed(AuditEntry entry, Exception cause) {
            failures.add(new Failure(entry, cause));
        }
    }
}
