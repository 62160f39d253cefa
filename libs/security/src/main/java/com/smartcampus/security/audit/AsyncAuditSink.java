package com.smartcampus.security.audit;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes entries on a single background thread, fed by a bounded queue.
 * <p>
 * One writer means entries reach the store in the order they were queued, and a caller's
 * sequential decisions are queued in decision order. The request thread never waits on
 * storage: a full queue or a closed sink turns the entry into an alert instead of an error.
 */
public final class AsyncAuditSink extends AbstractAuditSink implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AsyncAuditSink.class);

    private final ThreadPoolExecutor writer;
    private final Duration shutdownTimeout;
    private final int queueCapacity;

    public AsyncAuditSink(AuditStore store, AuditAlertChannel alerts, int queueCapacity) {
        this(store, alerts, queueCapacity, Duration.ofSeconds(10), Clock.systemUTC());
    }

    public AsyncAuditSink(AuditStore store, AuditAlertChannel alerts, int queueCapacity,
                          Duration shutdownTimeout, Clock clock) {
        super(store, alerts, clock);
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("queueCapacity must be positive");
        }
        this.shutdownTimeout = shutdownTimeout;
        this.queueCapacity = queueCapacity;
        this.writer = new ThreadPoolExecutor(
                1, 1, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(queueCapacity),
                runnable -> {
                    Thread thread = new Thread(runnable, "audit-writer");
                    thread.setDaemon(true);
                    return thread;
                },
                new ThreadPoolExecutor.AbortPolicy());
    }

    @Override
    protected void dispatch(AuditEntry entry) {
        try {
            writer.execute(new WriteTask(entry));
        } catch (RejectedExecutionException e) {
            alerts.auditWriteFailed(entry, new AuditWriteException(
                    writer.isShutdown() ? "audit sink is closed" : "audit queue is full", e));
        }
    }

    /** Number of entries waiting to be written. */
    public int pending() {
        return writer.getQueue().size();
    }

    public int capacity() {
        return queueCapacity;
    }

    public boolean isClosed() {
        return writer.isShutdown();
    }

    /**
     * Stops accepting entries, drains the queue within the shutdown timeout and alerts on
     * every entry still unwritten after it.
     */
    @Override
    public void close() {
        writer.shutdown();
        try {
            if (!writer.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                List<Runnable> dropped = writer.shutdownNow();
                log.error("Audit writer did not drain within {}; {} entries dropped", shutdownTimeout, dropped.size());
                for (Runnable task : dropped) {
                    if (task instanceof WriteTask writeTask) {
                        alerts.auditWriteFailed(writeTask.entry(),
                                new AuditWriteException("audit writer shut down before the entry was written"));
                    }
                }
            }
        } catch (InterruptedException e) {
            writer.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private final class WriteTask implements Runnable {

        private final AuditEntry entry;

        private WriteTask(AuditEntry entry) {
            this.entry = entry;
        }

        AuditEntry entry() {
            return entry;
        }

        @Override
        public void run() {
            write(entry);
        }
    }
}
