package com.smartcampus.security.policy;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide reference to the current {@link PolicyTable} snapshot.
 * <p>
 * Tables are immutable; a reload builds a complete new table and swaps the reference in
 * one step, so an in-flight evaluation sees either the old rules or the new ones, never
 * a mix. Evaluators read {@link #current()} once per call.
 */
public final class PolicyTableHolder {

    private static final Logger log = LoggerFactory.getLogger(PolicyTableHolder.class);

    private final AtomicReference<PolicyTable> current;

    public PolicyTableHolder(PolicyTable initial) {
        if (initial == null) {
            throw new IllegalArgumentException("initial table must not be null");
        }
        this.current = new AtomicReference<>(initial);
    }

    public PolicyTable current() {
        return current.get();
    }

    /**
     * Publishes a new table.
     *
     * @return the table it replaced
     */
    public PolicyTable replace(PolicyTable next) {
        if (next == null) {
            throw new IllegalArgumentException("table must not be null");
        }
        PolicyTable previous = current.getAndSet(next);
        log.info("Policy table replaced: {} rules -> {} rules", previous.size(), next.size());
        return previous;
    }

    /**
     * Loads a table from {@code source} and publishes it. If loading fails the current
     * table stays in effect and the failure propagates to the caller.
     *
     * @return the newly published table
     * @throws PolicyConfigurationException if the source yields an invalid table
     */
    public PolicyTable reload(Supplier<PolicyTable> source) {
        PolicyTable next;
        try {
            next = source.get();
        } catch (PolicyConfigurationException e) {
            log.error("Policy reload rejected, keeping {} current rules: {}", current().size(), e.getMessage());
            throw e;
        }
        replace(next);
        return next;
    }
}
